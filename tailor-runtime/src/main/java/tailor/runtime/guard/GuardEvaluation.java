package tailor.runtime.guard;

/**
 * 一次调用的守卫检查记录
 *
 * <p>状态只能按 PENDING → EVALUATING → PASSED / FAILED 推进。
 * 只属于一次调用，不跨线程共享。</p>
 */
public final class GuardEvaluation {
    private GuardState state = GuardState.PENDING;
    private int evaluated;
    private int failedIndex = -1;
    private String message;

    GuardEvaluation() {
    }

    void begin() {
        expect(GuardState.PENDING);
        state = GuardState.EVALUATING;
    }

    void recordPass() {
        expect(GuardState.EVALUATING);
        evaluated++;
    }

    void fail(int index, String failureMessage) {
        expect(GuardState.EVALUATING);
        evaluated++;
        failedIndex = index;
        message = failureMessage;
        state = GuardState.FAILED;
    }

    void pass() {
        expect(GuardState.EVALUATING);
        state = GuardState.PASSED;
    }

    private void expect(GuardState required) {
        if (state != required) {
            throw new IllegalStateException("Guard evaluation is " + state + ", expected " + required);
        }
    }

    public GuardState getState() {
        return state;
    }

    public boolean isPassed() {
        return state == GuardState.PASSED;
    }

    /** 已执行的守卫数（含失败的那个） */
    public int getEvaluatedCount() {
        return evaluated;
    }

    /** 失败守卫的下标，未失败时为 -1 */
    public int getFailedIndex() {
        return failedIndex;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return state == GuardState.FAILED
                ? "FAILED at guard #" + failedIndex + ": " + message
                : state.name();
    }
}
