package tailor.runtime.guard;

/**
 * 一次调用中守卫检查的状态：PENDING → EVALUATING → PASSED / FAILED
 */
public enum GuardState {
    PENDING,
    EVALUATING,
    PASSED,
    FAILED
}
