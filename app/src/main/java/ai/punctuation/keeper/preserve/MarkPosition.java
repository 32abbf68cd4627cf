package ai.punctuation.keeper.preserve;

/**
 * Where a mark run sits relative to the line it was taken from.
 */
public enum MarkPosition {
    BEGIN,
    END,
    MIDDLE,
    ALONE
}
