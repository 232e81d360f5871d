package work.lcod.orbital.behavior;

/**
 * Instance configuration that does not satisfy the behavior's config schema.
 */
public final class BehaviorConfigException extends RuntimeException {
    public static final String MISSING_FIELD = "MISSING_CONFIG_FIELD";
    public static final String NOT_ALLOWED = "CONFIG_VALUE_NOT_ALLOWED";

    private final String code;
    private final Object data;

    public BehaviorConfigException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
