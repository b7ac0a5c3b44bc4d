package io.cadence.core;

public class UnparsableExpressionException extends IllegalArgumentException {
    private final String expression;

    public UnparsableExpressionException(String expression) {
        super("Cannot parse time: " + expression);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
