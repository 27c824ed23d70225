package tailor.runtime.guard;

import java.util.Objects;

/**
 * 守卫检查结果：通过，或带消息的失败
 */
public final class GuardResult {

    private static final GuardResult PASS = new GuardResult(null);

    private final String message;  // 通过时为 null

    private GuardResult(String message) {
        this.message = message;
    }

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult fail(String message) {
        return new GuardResult(Objects.requireNonNull(message, "message"));
    }

    public boolean isPassed() {
        return message == null;
    }

    public boolean isFailed() {
        return message != null;
    }

    /**
     * 失败消息，通过时为 null
     */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GuardResult)) return false;
        return Objects.equals(message, ((GuardResult) o).message);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(message);
    }

    @Override
    public String toString() {
        return isPassed() ? "pass" : "fail(" + message + ")";
    }
}
