package org.carball.widgetq.filter;

/**
 * SQL Server style {@code [identifier]} quoting.
 */
public class BracketQuotingStrategy implements QuotingStrategy {

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public String quoteLiteral(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }
}
