package tailor.runtime.guard;

import tailor.runtime.TailorCallable;
import tailor.runtime.materialize.FunctionMaterializer;
import tailor.runtime.materialize.ImplicitReturn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 守卫表达式：一组守卫加上失败处理方式，用来包装函数
 *
 * <pre>
 * GuardedFunction process = GuardedExpression.builder()
 *         .guard(CommonGuards.notNone("x"))
 *         .guard(CommonGuards.positive("x"))
 *         .onError(FailureBehavior.sentinel(-1))
 *         .build()
 *         .wrap(module.function("process"));
 * </pre>
 *
 * <p>开启隐式返回（默认开启）时，包装前先做隐式返回改写，定义期错误在 wrap 时抛出。</p>
 */
public final class GuardedExpression {
    private final List<Guard> guards;
    private final boolean implicitReturn;
    private final FailureBehavior onError;
    private final boolean log;
    private final FunctionMaterializer materializer;

    private GuardedExpression(Builder builder) {
        this.guards = Collections.unmodifiableList(new ArrayList<>(builder.guards));
        this.implicitReturn = builder.implicitReturn;
        this.onError = builder.onError;
        this.log = builder.log;
        this.materializer = builder.materializer != null
                ? builder.materializer
                : ImplicitReturn.defaultMaterializer();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 包装函数
     */
    public GuardedFunction wrap(TailorCallable function) {
        Objects.requireNonNull(function, "function");
        TailorCallable target = implicitReturn ? materializer.materialize(function) : function;
        return new GuardedFunction(function, target,
                new GuardRuntime(function.getName(), guards, onError, log));
    }

    public List<Guard> getGuards() {
        return guards;
    }

    public boolean isImplicitReturn() {
        return implicitReturn;
    }

    public FailureBehavior getOnError() {
        return onError;
    }

    public boolean isLog() {
        return log;
    }

    public static final class Builder {
        private final List<Guard> guards = new ArrayList<>();
        private boolean implicitReturn = true;
        private FailureBehavior onError = FailureBehavior.defaultBehavior();
        private boolean log;
        private FunctionMaterializer materializer;

        private Builder() {
        }

        public Builder guard(Guard guard) {
            guards.add(Objects.requireNonNull(guard, "guard"));
            return this;
        }

        public Builder guards(Guard... more) {
            return guards(Arrays.asList(more));
        }

        public Builder guards(List<Guard> more) {
            for (Guard guard : more) {
                guard(guard);
            }
            return this;
        }

        public Builder implicitReturn(boolean implicitReturn) {
            this.implicitReturn = implicitReturn;
            return this;
        }

        public Builder onError(FailureBehavior onError) {
            this.onError = Objects.requireNonNull(onError, "onError");
            return this;
        }

        public Builder log(boolean log) {
            this.log = log;
            return this;
        }

        /** 隐式返回改写使用的物化器，不设置时使用进程内默认的 */
        public Builder materializer(FunctionMaterializer materializer) {
            this.materializer = materializer;
            return this;
        }

        public GuardedExpression build() {
            return new GuardedExpression(this);
        }
    }
}
