package tailor.runtime.guard;

import tailor.runtime.Arguments;
import tailor.runtime.TailorCallable;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 守卫失败后的处理方式：抛出异常、交给处理器、或返回固定值
 */
public abstract class FailureBehavior {

    public enum Kind {
        RAISE,
        HANDLER,
        SENTINEL
    }

    private static final FailureBehavior DEFAULT = raise(GuardClauseError::new);

    private FailureBehavior() {
    }

    public abstract Kind getKind();

    /**
     * 应用失败处理
     *
     * @return 作为本次调用结果的值（RAISE 不返回）
     */
    public abstract Object apply(String message, Arguments args);

    /**
     * 默认处理：抛出 {@link GuardClauseError}
     */
    public static FailureBehavior defaultBehavior() {
        return DEFAULT;
    }

    /**
     * 以失败消息构造异常并抛出
     */
    public static FailureBehavior raise(Function<String, ? extends RuntimeException> exceptionFactory) {
        return new Raise(Objects.requireNonNull(exceptionFactory, "exceptionFactory"));
    }

    /**
     * 抛出指定类型的异常，该类型必须有 (String) 构造器
     */
    public static FailureBehavior raise(Class<? extends RuntimeException> exceptionType) {
        final Constructor<? extends RuntimeException> constructor;
        try {
            constructor = exceptionType.getConstructor(String.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(exceptionType.getName() + " has no public (String) constructor", e);
        }
        return raise(message -> {
            try {
                return constructor.newInstance(message);
            } catch (InstantiationException | IllegalAccessException e) {
                throw new IllegalStateException("Cannot instantiate " + exceptionType.getName(), e);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Constructor of " + exceptionType.getName() + " failed",
                        e.getCause());
            }
        });
    }

    /**
     * 交给处理器，处理器返回值作为调用结果
     */
    public static FailureBehavior handler(FailureHandler handler) {
        return new Handler(Objects.requireNonNull(handler, "handler"));
    }

    /**
     * 交给脚本函数处理：以 (message, 原位置参数..., 原关键字参数...) 调用
     */
    public static FailureBehavior handler(TailorCallable callable) {
        Objects.requireNonNull(callable, "callable");
        return handler((message, args) -> {
            Arguments.Builder builder = Arguments.builder().add(message);
            for (Object value : args.positional()) {
                builder.add(value);
            }
            for (Map.Entry<String, Object> entry : args.keywords().entrySet()) {
                builder.put(entry.getKey(), entry.getValue());
            }
            return callable.call(builder.build());
        });
    }

    /**
     * 原样返回固定值
     */
    public static FailureBehavior sentinel(Object value) {
        return new Sentinel(value);
    }

    private static final class Raise extends FailureBehavior {
        private final Function<String, ? extends RuntimeException> exceptionFactory;

        Raise(Function<String, ? extends RuntimeException> exceptionFactory) {
            this.exceptionFactory = exceptionFactory;
        }

        @Override
        public Kind getKind() {
            return Kind.RAISE;
        }

        @Override
        public Object apply(String message, Arguments args) {
            throw exceptionFactory.apply(message);
        }
    }

    private static final class Handler extends FailureBehavior {
        private final FailureHandler handler;

        Handler(FailureHandler handler) {
            this.handler = handler;
        }

        @Override
        public Kind getKind() {
            return Kind.HANDLER;
        }

        @Override
        public Object apply(String message, Arguments args) {
            return handler.handle(message, args);
        }
    }

    private static final class Sentinel extends FailureBehavior {
        private final Object value;

        Sentinel(Object value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.SENTINEL;
        }

        @Override
        public Object apply(String message, Arguments args) {
            return value;
        }
    }
}
