package ai.punctuation.keeper.mark;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches runs of configured punctuation marks.
 *
 * <p>A run is one or more marks with optional whitespace on either side, repeated as long as
 * possible, so {@code "a , ! b"} holds the single run {@code " , ! "}. Instances are immutable.
 */
public final class MarkMatcher {

    private final String marks;
    private final Pattern pattern;

    public MarkMatcher(CharSequence marks) {
        if (marks == null) {
            throw new InvalidConfigurationException("punctuation marks must be defined as a character sequence");
        }
        Set<Integer> codePoints = marks.codePoints()
                .boxed()
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (codePoints.isEmpty()) {
            throw new InvalidConfigurationException("punctuation marks must contain at least one character");
        }
        StringBuilder collapsed = new StringBuilder();
        StringBuilder characterClass = new StringBuilder();
        for (int codePoint : codePoints) {
            if (DigitSeparator.isReserved(codePoint)) {
                throw new InvalidConfigurationException(
                        "punctuation mark U+%04X is reserved for digit protection".formatted(codePoint));
            }
            collapsed.appendCodePoint(codePoint);
            characterClass.append("\\x{").append(Integer.toHexString(codePoint)).append('}');
        }
        this.marks = collapsed.toString();
        this.pattern = Pattern.compile("(\\s*[" + characterClass + "]+\\s*)+", Pattern.UNICODE_CHARACTER_CLASS);
    }

    /**
     * Returns the configured marks with duplicates collapsed.
     */
    public String marks() {
        return marks;
    }

    /**
     * Replaces every mark run with a single space and strips the result.
     */
    public String remove(String text) {
        Objects.requireNonNull(text, "text");
        return pattern.matcher(text).replaceAll(" ").strip();
    }

    public List<String> remove(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(remove(line));
        }
        return List.copyOf(result);
    }

    /**
     * Finds the mark runs of a line, leftmost first, without overlap.
     */
    public List<MarkUnit> detect(String line) {
        Objects.requireNonNull(line, "line");
        List<MarkUnit> units = new ArrayList<>();
        Matcher matcher = pattern.matcher(line);
        while (matcher.find()) {
            units.add(new MarkUnit(matcher.group(), matcher.start(), matcher.end()));
        }
        return units;
    }

    @Override
    public String toString() {
        return "MarkMatcher[" + marks + "]";
    }
}
