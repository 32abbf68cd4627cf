package ai.punctuation.keeper.document;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads UTF-8 documents line by line, from a file or from a fallback stream.
 */
public class DocumentReader {

    private final InputStream fallback;

    public DocumentReader() {
        this(System.in);
    }

    public DocumentReader(InputStream fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public List<String> read(Optional<Path> source) {
        Objects.requireNonNull(source, "source");
        if (source.isPresent()) {
            Path path = source.get();
            try {
                return Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read document: " + path, ex);
            }
        }
        // the fallback stream belongs to the caller and stays open
        BufferedReader reader = new BufferedReader(new InputStreamReader(fallback, StandardCharsets.UTF_8));
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document from standard input", ex);
        }
        return lines;
    }
}
