package tailor.runtime.materialize;

import tailor.runtime.TailorCallable;
import tailor.runtime.interpreter.Interpreter;

/**
 * 单独的隐式返回改写（不带守卫）
 *
 * <pre>
 * TailorCallable classify = ImplicitReturn.apply(module.function("classify"));
 * </pre>
 */
public final class ImplicitReturn {

    private ImplicitReturn() {
    }

    private static final class DefaultHolder {
        static final FunctionMaterializer INSTANCE =
                new FunctionMaterializer(EngineOptions.defaults(), new Interpreter());
    }

    /**
     * 以默认配置改写函数。对已改写的函数幂等。
     */
    public static TailorCallable apply(TailorCallable function) {
        return apply(function, DefaultHolder.INSTANCE);
    }

    public static TailorCallable apply(TailorCallable function, FunctionMaterializer materializer) {
        return materializer.materialize(function);
    }

    /** 默认的物化器（进程内共享） */
    public static FunctionMaterializer defaultMaterializer() {
        return DefaultHolder.INSTANCE;
    }
}
