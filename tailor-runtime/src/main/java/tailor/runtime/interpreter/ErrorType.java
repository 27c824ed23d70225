package tailor.runtime.interpreter;

import tailor.runtime.Arguments;
import tailor.runtime.FunctionSignature;
import tailor.runtime.ParameterInfo;
import tailor.runtime.TailorCallable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 脚本错误类型
 *
 * <p>错误类型组成以 {@code Error} 为根的单继承层次。类型本身可调用，
 * {@code ValueError("bad")} 构造一个错误值。</p>
 */
public final class ErrorType implements TailorCallable {

    public static final ErrorType ERROR = new ErrorType("Error", null);
    public static final ErrorType ARITHMETIC = new ErrorType("ArithmeticError", ERROR);
    public static final ErrorType TYPE = new ErrorType("TypeError", ERROR);
    public static final ErrorType NAME = new ErrorType("NameError", ERROR);
    public static final ErrorType VALUE = new ErrorType("ValueError", ERROR);
    public static final ErrorType INDEX = new ErrorType("IndexError", ERROR);
    public static final ErrorType KEY = new ErrorType("KeyError", ERROR);
    public static final ErrorType STATE = new ErrorType("StateError", ERROR);

    private static final List<ErrorType> BUILTINS = Collections.unmodifiableList(Arrays.asList(
            ERROR, ARITHMETIC, TYPE, NAME, VALUE, INDEX, KEY, STATE));

    private final String name;
    private final ErrorType parent;
    private final FunctionSignature signature;

    public ErrorType(String name, ErrorType parent) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Error type name must not be empty");
        }
        this.name = name;
        this.parent = parent;
        this.signature = new FunctionSignature(name,
                Collections.singletonList(new ParameterInfo("message", "String", "\"\"")), name);
    }

    /** 内置错误类型，根类型在前 */
    public static List<ErrorType> builtins() {
        return BUILTINS;
    }

    public ErrorType getParent() {
        return parent;
    }

    /** 是否为 other 本身或其子类型 */
    public boolean isSubtypeOf(ErrorType other) {
        for (ErrorType t = this; t != null; t = t.parent) {
            if (t == other) return true;
        }
        return false;
    }

    public ScriptError create(String message) {
        return new ScriptError(this, message);
    }

    /** 构造一个可直接 throw 的异常 */
    public ScriptErrorException raise(String message) {
        return new ScriptErrorException(create(message));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public FunctionSignature getSignature() {
        return signature;
    }

    @Override
    public Object call(Arguments args) {
        if (args.size() > 1) {
            throw new TailorRuntimeException(
                    "Function '" + name + "' expects at most 1 argument(s) but got " + args.size());
        }
        Object message = args.extract("message", 0, "");
        return create(Ops.stringify(message));
    }

    @Override
    public String toString() {
        return "<error type " + name + ">";
    }
}
