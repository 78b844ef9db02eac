package ca.jonathanfritz.dealwatch.service;

import ca.jonathanfritz.dealwatch.cli.CLI;
import ca.jonathanfritz.dealwatch.matching.MatchResult;
import ca.jonathanfritz.dealwatch.matching.ProductMatcher;
import ca.jonathanfritz.dealwatch.utils.StringUtils;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs messages through the {@link ProductMatcher} and prints the matches.
 */
public class MessageScanService {

    private static final Logger logger = LogManager.getLogger(MessageScanService.class);

    private static final int PREVIEW_LENGTH = 100;

    private final ProductMatcher productMatcher;
    private final CLI cli;

    @Inject
    public MessageScanService(ProductMatcher productMatcher, CLI cli) {
        this.productMatcher = productMatcher;
        this.cli = cli;
    }

    /**
     * Processes the messages in order. A message that cannot be processed is logged and skipped.
     *
     * @param messages the messages to scan, oldest first
     * @return what happened to the messages
     */
    public ScanStatistics scan(List<String> messages) {
        final ScanStatistics statistics = new ScanStatistics();
        for (int i = 0; i < messages.size(); i++) {
            try {
                process(i + 1, messages.get(i), statistics);
            } catch (RuntimeException e) {
                logger.error("Error processing message #{}", i + 1, e);
                statistics.messageFailed();
            }
        }
        logger.info("Scan complete: {}", statistics);
        return statistics;
    }

    /**
     * Matches one message and prints every match whose product wants to be notified about.
     *
     * @return the matches found in the message, including muted ones
     */
    public List<MatchResult> process(int messageNumber, String message, ScanStatistics statistics) {
        statistics.messageScanned();

        if (StringUtils.coerceNullableString(message).isEmpty()) {
            logger.debug("Msg #{} skipped: no text", messageNumber);
            statistics.messageWithoutText();
            return List.of();
        }

        logger.info("Msg #{}: {}", messageNumber, StringUtils.preview(message, PREVIEW_LENGTH));

        final List<MatchResult> matches = productMatcher.match(message);
        if (matches.isEmpty()) {
            logger.info("Msg #{}: no product matches", messageNumber);
            statistics.messageWithoutMatch();
            return matches;
        }

        logger.info("Msg #{}: found {} product match(es)", messageNumber, matches.size());
        for (int i = 0; i < matches.size(); i++) {
            final MatchResult match = matches.get(i);
            logger.info("[{}/{}] {} (keywords: {})", i + 1, matches.size(), match.productName(),
                    String.join(", ", match.matchedKeywords()));
            statistics.matchFound(match.notifyEnabled());

            if (match.notifyEnabled()) {
                cli.printMatch(i + 1, matches.size(), match, message);
            } else {
                logger.debug("Notifications are turned off for {}", match.productName());
            }
        }
        return matches;
    }
}
