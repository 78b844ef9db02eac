package ca.jonathanfritz.dealwatch.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads messages from a plain text file.
 * Messages may span several lines and are separated from each other by a line that contains only {@value #SEPARATOR}.
 */
public class MessageFileReader {

    private static final Logger logger = LogManager.getLogger(MessageFileReader.class);

    public static final String SEPARATOR = "---";

    public List<String> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final List<String> messages = read(reader);
            logger.info("Read {} messages from {}", messages.size(), path);
            return messages;
        }
    }

    public List<String> read(Reader reader) throws IOException {
        final BufferedReader bufferedReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        final List<String> messages = new ArrayList<>();

        StringBuilder current = new StringBuilder();
        boolean hasContent = false;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            if (line.strip().equals(SEPARATOR)) {
                messages.add(current.toString());
                current = new StringBuilder();
                hasContent = false;
                continue;
            }
            if (hasContent) {
                current.append('\n');
            }
            current.append(line);
            hasContent = true;
        }

        // the last message doesn't need a trailing separator, and trailing blank lines are not a message
        if (hasContent && !current.toString().isBlank()) {
            messages.add(current.toString());
        }
        return messages;
    }
}
