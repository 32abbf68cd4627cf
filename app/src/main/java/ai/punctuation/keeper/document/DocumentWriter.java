package ai.punctuation.keeper.document;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes processed documents to a file, or to a fallback stream when no file is given.
 */
public class DocumentWriter {

    private final PrintStream fallback;

    public DocumentWriter() {
        this(System.out);
    }

    public DocumentWriter(PrintStream fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public void write(Optional<Path> target, List<String> lines) {
        if (target == null || lines == null) {
            throw new IllegalArgumentException("target and lines must be provided");
        }
        if (target.isEmpty()) {
            for (String line : lines) {
                fallback.println(line);
            }
            fallback.flush();
            return;
        }
        Path path = target.get();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write processed document: " + path, ex);
        }
    }
}
