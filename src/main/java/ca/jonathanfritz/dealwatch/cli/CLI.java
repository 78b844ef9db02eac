package ca.jonathanfritz.dealwatch.cli;

import ca.jonathanfritz.dealwatch.matching.Currency;
import ca.jonathanfritz.dealwatch.matching.MatchResult;
import ca.jonathanfritz.dealwatch.utils.StringUtils;
import com.google.inject.Inject;
import org.beryx.textio.TextIO;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class CLI {

    static final int MAX_MESSAGE_LENGTH = 500;

    private final TextIO textIO;

    @Inject
    public CLI(TextIO textIO) {
        this.textIO = textIO;
    }

    public void printWelcomeBanner() {
        textIO.getTextTerminal().println(Arrays.asList(
                "     _            _               _       _     ",
                "  __| | ___  __ _| |_      ____ _| |_ ___| |__  ",
                " / _` |/ _ \\/ _` | \\ \\ /\\ / / _` | __/ __| '_ \\ ",
                "| (_| |  __/ (_| | |\\ V  V / (_| | || (__| | | |",
                " \\__,_|\\___|\\__,_|_| \\_/\\_/ \\__,_|\\__\\___|_| |_|",
                "                                                "
        ));
    }

    /**
     * Prints the specified line to the terminal, along with a trailing newline character
     */
    public void println(String line) {
        textIO.getTextTerminal().println(line);
    }

    /**
     * Prints the specified lines to the terminal, advancing to the next line after each
     */
    public void println(List<String> lines) {
        textIO.getTextTerminal().println(lines);
    }

    /**
     * Prints a product match found in a message
     *
     * @param index       the 1-based position of this match among all matches found in the message
     * @param total       the number of matches found in the message
     * @param match       the match to print
     * @param messageText the message that the match was found in
     */
    public void printMatch(int index, int total, MatchResult match, String messageText) {
        textIO.getTextTerminal().println(formatMatch(index, total, match, messageText));
    }

    public void exit() {
        textIO.dispose();
    }

    static List<String> formatMatch(int index, int total, MatchResult match, String messageText) {
        final List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(String.format("[%d/%d] Found: %s", index, total, match.productName()));
        lines.add("Keywords: " + String.join(", ", match.matchedKeywords()));
        if (match.hasPrice()) {
            lines.add("Price: " + formatPrice(match.price(), match.currency()));
        }
        lines.add("Message:");
        lines.add(StringUtils.truncate(messageText, MAX_MESSAGE_LENGTH));
        return lines;
    }

    /**
     * Euro amounts are written with the symbol after the amount, everything else with the symbol in front
     */
    static String formatPrice(double price, Currency currency) {
        final String amount = String.format(Locale.ROOT, "%.2f", price);
        if (currency == Currency.EURO) {
            return amount + currency.getSymbol();
        }
        return currency.getSymbol() + amount;
    }
}
