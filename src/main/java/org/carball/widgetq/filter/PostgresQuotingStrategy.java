package org.carball.widgetq.filter;

/**
 * {@code "identifier"} and {@code 'literal'}, doubling embedded quotes.
 */
public class PostgresQuotingStrategy implements QuotingStrategy {

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteLiteral(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }
}
