package work.lcod.orbital.behavior;

/**
 * A behavior file that cannot be read, or a definition that fails validation.
 */
public final class BehaviorDefinitionException extends RuntimeException {
    public static final String UNREADABLE = "UNREADABLE_BEHAVIOR";
    public static final String INVALID = "INVALID_BEHAVIOR";
    public static final String UNKNOWN = "UNKNOWN_BEHAVIOR";

    private final String code;
    private final Object data;

    public BehaviorDefinitionException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public BehaviorDefinitionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = null;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
