package tailor.runtime.guard;

import tailor.runtime.Arguments;
import tailor.runtime.TailorCallable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 守卫执行：按给定顺序逐个检查，第一个失败即停止（fail-fast）
 *
 * <p>全部通过时以原参数调用目标函数；有守卫失败时按 {@link FailureBehavior} 处理，目标函数不执行。
 * 不可变，可被多个线程同时使用。</p>
 */
public final class GuardRuntime {
    private static final Logger LOG = Logger.getLogger(GuardRuntime.class.getName());

    /** 守卫返回 null 时使用的失败消息 */
    public static final String DEFAULT_FAILURE_MESSAGE = "Guard clause failed";

    private final String functionName;
    private final List<Guard> guards;
    private final FailureBehavior onError;
    private final boolean log;

    public GuardRuntime(String functionName, List<Guard> guards, FailureBehavior onError, boolean log) {
        this.functionName = functionName;
        this.guards = Collections.unmodifiableList(new ArrayList<>(guards));
        this.onError = onError;
        this.log = log;
    }

    /**
     * 只做检查，不调用目标函数
     */
    public GuardEvaluation evaluate(Arguments args) {
        GuardEvaluation evaluation = new GuardEvaluation();
        evaluation.begin();
        for (int i = 0; i < guards.size(); i++) {
            GuardResult result = guards.get(i).check(args);
            if (result == null) {
                result = GuardResult.fail(DEFAULT_FAILURE_MESSAGE);
            }
            if (result.isFailed()) {
                evaluation.fail(i, result.getMessage());
                return evaluation;
            }
            evaluation.recordPass();
        }
        evaluation.pass();
        return evaluation;
    }

    /**
     * 检查后调用目标函数，或应用失败处理
     */
    public Object invoke(TailorCallable target, Arguments args) {
        GuardEvaluation evaluation = evaluate(args);
        if (evaluation.isPassed()) {
            return target.call(args);
        }
        String message = evaluation.getMessage();
        if (log) {
            LOG.info("Guard clause failed in " + functionName + ": " + message);
        }
        return onError.apply(message, args);
    }

    public List<Guard> getGuards() {
        return guards;
    }

    public FailureBehavior getOnError() {
        return onError;
    }

    public boolean isLog() {
        return log;
    }
}
