package tailor.runtime;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 原生（Java）函数
 *
 * <p>没有源码，不能进行隐式返回改写。</p>
 */
public final class NativeFunction implements TailorCallable {

    /**
     * 原生函数体
     */
    @FunctionalInterface
    public interface NativeBody {
        Object apply(Arguments args);
    }

    private final FunctionSignature signature;
    private final NativeBody body;

    public NativeFunction(FunctionSignature signature, NativeBody body) {
        this.signature = signature;
        this.body = body;
    }

    /**
     * 可变参数函数，函数体自行处理全部参数
     */
    public static NativeFunction of(String name, NativeBody body) {
        return new NativeFunction(FunctionSignature.variadic(name), body);
    }

    // ============ 便捷工厂方法 ============

    public static NativeFunction create(String name, Supplier<Object> func) {
        return new NativeFunction(FunctionSignature.of(name), args -> func.get());
    }

    public static NativeFunction create(String name, Function<Object, Object> func) {
        return new NativeFunction(FunctionSignature.of(name, "arg0"), args -> func.apply(args.get(0)));
    }

    public static NativeFunction create(String name, BiFunction<Object, Object, Object> func) {
        return new NativeFunction(FunctionSignature.of(name, "arg0", "arg1"),
                args -> func.apply(args.get(0), args.get(1)));
    }

    @Override
    public String getName() {
        return signature.getName();
    }

    @Override
    public FunctionSignature getSignature() {
        return signature;
    }

    @Override
    public Object call(Arguments args) {
        if (!signature.isVariadic()) {
            if (!args.keywords().isEmpty()) {
                throw new TailorException("Native function '" + getName() + "' does not accept keyword arguments");
            }
            if (args.size() != signature.getArity()) {
                throw new TailorException("Function '" + getName() + "' expects " + signature.getArity()
                        + " argument(s) but got " + args.size());
            }
        }
        return body.apply(args);
    }

    @Override
    public String toString() {
        return "<native fun " + getName() + ">";
    }
}
