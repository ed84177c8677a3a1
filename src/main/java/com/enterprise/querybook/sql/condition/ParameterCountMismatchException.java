package com.enterprise.querybook.sql.condition;

/**
 * A condition expression declares a different number of {@code $?} markers
 * than the values supplied with it. Raised when the leaf is built.
 */
public class ParameterCountMismatchException extends IllegalArgumentException {

    private final String expression;
    private final int markers;
    private final int values;

    public ParameterCountMismatchException(String expression, int markers, int values) {
        super("Expression '" + expression + "' has " + markers
                + " parameter marker(s) but " + values + " value(s) were supplied");
        this.expression = expression;
        this.markers = markers;
        this.values = values;
    }

    public String expression() { return expression; }
    public int markers() { return markers; }
    public int values() { return values; }
}
