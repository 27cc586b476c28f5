package com.brokerbridge.engine.shortrate;

/**
 * One line of a short-stock availability file.
 *
 * @param source the file the line came from, without its extension (e.g. {@code usa})
 * @param conId broker contract id, or null if the file had none
 * @param available shares available to borrow, as published (e.g. {@code >10000000})
 */
public record ShortRate(String source, String symbol, String currency, String name, Long conId,
                        Double rebateRate, Double feeRate, String available) {
}
