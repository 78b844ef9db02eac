package ca.jonathanfritz.dealwatch.matching;

import java.util.List;

/**
 * A product that was found in a message.
 *
 * @param productName     the product's display name
 * @param matchedKeywords every inclusion keyword that matched, in catalog order, as written in the catalog
 * @param price           the extracted price, or null if the product has no price range
 * @param currency        the currency written next to the price, {@link Currency#UNKNOWN} if none was found
 * @param notifyEnabled   copied from {@link Product#isNotify()}
 */
public record MatchResult(String productName, List<String> matchedKeywords, Double price, Currency currency, boolean notifyEnabled) {

    public MatchResult {
        matchedKeywords = List.copyOf(matchedKeywords);
        currency = currency != null ? currency : Currency.UNKNOWN;
    }

    public boolean hasPrice() {
        return price != null;
    }
}
