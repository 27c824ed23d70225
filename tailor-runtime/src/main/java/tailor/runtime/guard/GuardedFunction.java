package tailor.runtime.guard;

import tailor.runtime.Arguments;
import tailor.runtime.FunctionSignature;
import tailor.runtime.TailorCallable;

import java.util.List;

/**
 * 带守卫的函数
 *
 * <p>名称、文档、签名和注解与原函数一致。不提供源码：守卫包装无法再被改写。</p>
 */
public final class GuardedFunction implements TailorCallable {
    private final TailorCallable original;
    private final TailorCallable target;
    private final GuardRuntime runtime;

    GuardedFunction(TailorCallable original, TailorCallable target, GuardRuntime runtime) {
        this.original = original;
        this.target = target;
        this.runtime = runtime;
    }

    @Override
    public Object call(Arguments args) {
        return runtime.invoke(target, args);
    }

    @Override
    public String getName() {
        return original.getName();
    }

    @Override
    public FunctionSignature getSignature() {
        return original.getSignature();
    }

    @Override
    public String getDocumentation() {
        return original.getDocumentation();
    }

    @Override
    public List<String> getAnnotations() {
        return original.getAnnotations();
    }

    /** 被包装的原函数 */
    public TailorCallable getOriginal() {
        return original;
    }

    /** 守卫通过后实际调用的函数（开启隐式返回时是改写后的函数） */
    public TailorCallable getTarget() {
        return target;
    }

    public GuardRuntime getRuntime() {
        return runtime;
    }

    @Override
    public String toString() {
        return "<guarded fun " + getName() + ">";
    }
}
