package ca.jonathanfritz.dealwatch.service;

import java.util.List;

/**
 * Counts what happened to the messages of one scan. Not thread-safe: every scan has its own instance.
 */
public class ScanStatistics {

    private int messagesScanned;
    private int messagesNoText;
    private int messagesNoMatch;
    private int messagesFailed;
    private int matchesFound;
    private int matchesMuted;

    void messageScanned() {
        messagesScanned++;
    }

    void messageWithoutText() {
        messagesNoText++;
    }

    void messageWithoutMatch() {
        messagesNoMatch++;
    }

    void messageFailed() {
        messagesFailed++;
    }

    void matchFound(boolean notify) {
        matchesFound++;
        if (!notify) {
            matchesMuted++;
        }
    }

    public int getMessagesScanned() {
        return messagesScanned;
    }

    public int getMessagesNoText() {
        return messagesNoText;
    }

    public int getMessagesNoMatch() {
        return messagesNoMatch;
    }

    public int getMessagesFailed() {
        return messagesFailed;
    }

    public int getMatchesFound() {
        return matchesFound;
    }

    /**
     * Returns the number of matches on products that have notifications turned off
     */
    public int getMatchesMuted() {
        return matchesMuted;
    }

    public List<String> toLines() {
        return List.of(
                "Messages scanned: " + messagesScanned,
                "Matches found: " + matchesFound + (matchesMuted > 0 ? " (" + matchesMuted + " muted)" : ""),
                "Messages skipped (no text): " + messagesNoText,
                "Messages with no match: " + messagesNoMatch,
                "Messages that failed: " + messagesFailed);
    }

    @Override
    public String toString() {
        return "ScanStatistics{" + "messagesScanned="
                + messagesScanned + ", messagesNoText="
                + messagesNoText + ", messagesNoMatch="
                + messagesNoMatch + ", messagesFailed="
                + messagesFailed + ", matchesFound="
                + matchesFound + ", matchesMuted="
                + matchesMuted + '}';
    }
}
