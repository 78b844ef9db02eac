package ca.jonathanfritz.dealwatch.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MessageFileReaderTest {

    private final MessageFileReader reader = new MessageFileReader();

    @TempDir
    Path tempDir;

    @Test
    void splitsMessagesOnSeparatorLines() throws IOException {
        // Setup
        String content = """
                Selling iPhone 15
                500€, like new
                ---
                PS5 for $400
                ---
                Road bike
                """;

        // Execute
        List<String> messages = reader.read(new StringReader(content));

        // Verify: multi-line messages keep their line breaks
        assertEquals(List.of("Selling iPhone 15\n500€, like new", "PS5 for $400", "Road bike"), messages);
    }

    @Test
    void separatorMayBeIndented() throws IOException {
        // Execute
        List<String> messages = reader.read(new StringReader("one\n  ---  \ntwo"));

        // Verify
        assertEquals(List.of("one", "two"), messages);
    }

    @Test
    void dashesInsideALineAreNotASeparator() throws IOException {
        // Execute
        List<String> messages = reader.read(new StringReader("price --- negotiable\n----\nsecond"));

        // Verify
        assertEquals(List.of("price --- negotiable\n----\nsecond"), messages);
    }

    @Test
    void emptyMessageBetweenSeparatorsIsKept() throws IOException {
        // Execute
        List<String> messages = reader.read(new StringReader("one\n---\n---\ntwo"));

        // Verify: the scan reports it as a message without text
        assertEquals(List.of("one", "", "two"), messages);
    }

    @Test
    void trailingSeparatorAndBlankLinesDoNotAddAMessage() throws IOException {
        // Execute
        List<String> messages = reader.read(new StringReader("one\n---\n\n\n"));

        // Verify
        assertEquals(List.of("one"), messages);
    }

    @Test
    void emptyInputHasNoMessages() throws IOException {
        assertTrue(reader.read(new StringReader("")).isEmpty());
    }

    @Test
    void readsUtf8File() throws IOException {
        // Setup
        Path file = tempDir.resolve("messages.txt");
        Files.writeString(file, "Продам айфон\n---\n250 евро");

        // Execute
        List<String> messages = reader.read(file);

        // Verify
        assertEquals(List.of("Продам айфон", "250 евро"), messages);
    }
}
