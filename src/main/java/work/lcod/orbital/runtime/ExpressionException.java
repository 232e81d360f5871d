package work.lcod.orbital.runtime;

/**
 * Malformed expression: unknown operator, missing argument or unusable argument value.
 */
public final class ExpressionException extends RuntimeException {
    public static final String UNKNOWN_OPERATOR = "UNKNOWN_OPERATOR";
    public static final String MISSING_ARGUMENT = "MISSING_ARGUMENT";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String NOT_CALLABLE = "NOT_CALLABLE";

    private final String code;
    private final String operator;
    private final int position;

    public ExpressionException(String code, String operator, int position, String message) {
        super(message);
        this.code = code;
        this.operator = operator;
        this.position = position;
    }

    public static ExpressionException unknownOperator(String operator) {
        return new ExpressionException(UNKNOWN_OPERATOR, operator, 0, "Unknown operator: " + operator);
    }

    public static ExpressionException missingArgument(String operator, int position) {
        return new ExpressionException(
            MISSING_ARGUMENT,
            operator,
            position,
            "Operator '" + operator + "' is missing required argument at position " + position
        );
    }

    public static ExpressionException invalidArgument(String operator, int position, String detail) {
        return new ExpressionException(
            INVALID_ARGUMENT,
            operator,
            position,
            "Operator '" + operator + "' argument " + position + ": " + detail
        );
    }

    public static ExpressionException notCallable(String operator, int position, Object value) {
        var kind = value == null ? "null" : value.getClass().getSimpleName();
        return new ExpressionException(
            NOT_CALLABLE,
            operator,
            position,
            "Operator '" + operator + "' argument " + position + ": expected a lambda but got " + kind
        );
    }

    public String code() {
        return code;
    }

    public String operator() {
        return operator;
    }

    /**
     * 1-based argument index; 0 refers to the operator itself.
     */
    public int position() {
        return position;
    }
}
