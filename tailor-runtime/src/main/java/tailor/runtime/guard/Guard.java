package tailor.runtime.guard;

import tailor.runtime.Arguments;
import tailor.runtime.TailorCallable;

import java.util.function.Predicate;

/**
 * 守卫：在函数执行前检查调用参数
 *
 * <p>返回 {@link GuardResult#pass()} 表示通过；返回 {@link GuardResult#fail(String)} 或 null 表示失败。
 * 守卫抛出的异常不算失败，直接传给调用方。</p>
 */
@FunctionalInterface
public interface Guard {

    GuardResult check(Arguments args);

    /**
     * 由谓词构造守卫
     */
    static Guard of(Predicate<Arguments> predicate, String message) {
        return args -> predicate.test(args) ? GuardResult.pass() : GuardResult.fail(message);
    }

    /**
     * 把脚本函数当作守卫：返回 true 表示通过，返回字符串表示以该字符串为消息失败，
     * 其他返回值按失败处理。
     */
    static Guard fromCallable(TailorCallable callable) {
        return args -> {
            Object result = callable.call(args);
            if (Boolean.TRUE.equals(result)) return GuardResult.pass();
            if (result instanceof String) return GuardResult.fail((String) result);
            return GuardResult.fail(GuardRuntime.DEFAULT_FAILURE_MESSAGE);
        };
    }
}
