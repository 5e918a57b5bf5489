package org.carball.widgetq.filter;

/**
 * How compiled predicates quote identifiers and string literals.
 */
public interface QuotingStrategy {

    String quoteIdentifier(String identifier);

    String quoteLiteral(String literal);
}
