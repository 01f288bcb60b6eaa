package com.snqlsdk.metrics;

/**
 * Arithmetic functions a {@link Formula} can apply. These render infix in MQL;
 * every other formula function renders as a call.
 */
public enum ArithmeticOperator {
    PLUS("plus", "+"),
    MINUS("minus", "-"),
    MULTIPLY("multiply", "*"),
    DIVIDE("divide", "/");

    private final String functionName;
    private final String symbol;

    ArithmeticOperator(String functionName, String symbol) {
        this.functionName = functionName;
        this.symbol = symbol;
    }

    /**
     * Returns the function name the operator is known by, e.g. "divide".
     */
    public String functionName() {
        return functionName;
    }

    /**
     * Returns the infix symbol, e.g. "/".
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by function name.
     *
     * @param functionName a formula function name
     * @return the operator, or null if the function is not arithmetic
     */
    public static ArithmeticOperator fromFunctionName(String functionName) {
        for (ArithmeticOperator operator : values()) {
            if (operator.functionName.equals(functionName)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * Looks up an operator by infix symbol.
     *
     * @param symbol one of + - * /
     * @return the operator
     * @throws IllegalArgumentException for any other symbol
     */
    public static ArithmeticOperator fromSymbol(String symbol) {
        for (ArithmeticOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown arithmetic symbol: " + symbol);
    }
}
