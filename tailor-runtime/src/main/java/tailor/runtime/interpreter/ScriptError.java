package tailor.runtime.interpreter;

/**
 * 脚本中的错误值，由 {@code throw} 抛出、由 {@code catch} 绑定
 */
public final class ScriptError {
    private final ErrorType type;
    private final String message;

    public ScriptError(ErrorType type, String message) {
        this.type = type;
        this.message = message != null ? message : "";
    }

    public ErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message.isEmpty() ? type.getName() : type.getName() + ": " + message;
    }
}
