package ca.jonathanfritz.dealwatch.matching;

/**
 * A price found in a message, along with the currency that was written next to it.
 */
public record ExtractedPrice(double value, Currency currency) {}
