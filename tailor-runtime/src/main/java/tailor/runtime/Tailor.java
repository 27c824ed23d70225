package tailor.runtime;

import tailor.runtime.cache.CacheStats;
import tailor.runtime.guard.GuardedExpression;
import tailor.runtime.interpreter.ScriptModule;
import tailor.runtime.materialize.EngineOptions;
import tailor.runtime.materialize.FunctionMaterializer;

/**
 * Tailor 入口
 *
 * <pre>
 * Tailor tailor = Tailor.create();
 * ScriptModule shapes = tailor.load(source, "shapes.tailor");
 * TailorCallable classify = tailor.implicitReturn(shapes.function("classify"));
 * Object result = classify.invoke(5);
 * </pre>
 */
public final class Tailor {
    private final EngineOptions options;
    private final ModuleLoader loader;

    private Tailor(EngineOptions options) {
        this.options = options;
        this.loader = new ModuleLoader(options);
    }

    public static Tailor create() {
        return new Tailor(EngineOptions.defaults());
    }

    public static Tailor create(EngineOptions options) {
        return new Tailor(options);
    }

    public ScriptModule load(String source, String fileName) {
        return loader.load(source, fileName);
    }

    public ScriptModule load(String source) {
        return loader.load(source);
    }

    /**
     * 取出模块中的函数
     */
    public TailorCallable function(ScriptModule module, String name) {
        return module.function(name);
    }

    /**
     * 隐式返回改写（幂等）
     */
    public TailorCallable implicitReturn(TailorCallable function) {
        return loader.getMaterializer().materialize(function);
    }

    /**
     * 守卫表达式构造器，隐式返回改写使用本实例的物化器
     */
    public GuardedExpression.Builder guarded() {
        return GuardedExpression.builder().materializer(loader.getMaterializer());
    }

    public void register(ScriptModule module) {
        loader.register(module);
    }

    public ModuleLoader getLoader() {
        return loader;
    }

    public FunctionMaterializer getMaterializer() {
        return loader.getMaterializer();
    }

    public CacheStats getCacheStats() {
        return loader.getMaterializer().getCacheStats();
    }

    public EngineOptions getOptions() {
        return options;
    }
}
