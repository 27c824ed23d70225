package tailor.runtime.interpreter;

import com.tailor.compiler.ast.expr.BinaryExpr.BinaryOp;
import tailor.runtime.Arguments;
import tailor.runtime.NativeFunction;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 内置函数与常量
 */
final class Builtins {

    private Builtins() {
    }

    static void install(Environment env, final PrintStream out) {
        env.defineVal("Infinity", Double.POSITIVE_INFINITY);
        env.defineVal("NaN", Double.NaN);
        for (ErrorType type : ErrorType.builtins()) {
            env.defineVal(type.getName(), type);
        }

        env.defineVal("print", NativeFunction.of("print", args -> {
            StringBuilder sb = new StringBuilder();
            for (Object value : args.positional()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(Ops.stringify(value));
            }
            out.println(sb);
            return null;
        }));
        env.defineVal("str", NativeFunction.create("str", (Object x) -> Ops.stringify(x)));
        env.defineVal("typeOf", NativeFunction.create("typeOf", (Object x) -> Ops.typeName(x)));
        env.defineVal("len", NativeFunction.create("len", Builtins::len));
        env.defineVal("int", NativeFunction.create("int", Builtins::toInt));
        env.defineVal("double", NativeFunction.create("double", Builtins::toDouble));
        env.defineVal("abs", NativeFunction.create("abs", Builtins::abs));
        env.defineVal("max", NativeFunction.of("max", args -> extreme("max", args, true)));
        env.defineVal("min", NativeFunction.of("min", args -> extreme("min", args, false)));
        env.defineVal("listOf", NativeFunction.of("listOf",
                args -> new ArrayList<>(args.positional())));
        env.defineVal("range", NativeFunction.of("range", Builtins::range));
        env.defineVal("errorType", NativeFunction.of("errorType", Builtins::errorType));
    }

    private static Object len(Object value) {
        if (value instanceof String) return ((String) value).length();
        if (value instanceof List) return ((List<?>) value).size();
        throw ErrorType.TYPE.raise("Object of type " + Ops.typeName(value) + " has no len()");
    }

    private static Object toInt(Object value) {
        if (value instanceof Integer) return value;
        if (value instanceof Long) return ((Long) value).intValue();
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw ErrorType.VALUE.raise("Cannot convert " + Ops.stringify(value) + " to Int");
            }
            return (int) d;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw ErrorType.VALUE.raise("Invalid literal for int(): '" + value + "'");
            }
        }
        throw ErrorType.TYPE.raise("int() argument must be a String or a number, not " + Ops.typeName(value));
    }

    private static Object toDouble(Object value) {
        if (Ops.isNumber(value)) return ((Number) value).doubleValue();
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw ErrorType.VALUE.raise("Invalid literal for double(): '" + value + "'");
            }
        }
        throw ErrorType.TYPE.raise("double() argument must be a String or a number, not " + Ops.typeName(value));
    }

    private static Object abs(Object value) {
        if (value instanceof Integer) return Math.abs((Integer) value);
        if (value instanceof Long) return Math.abs((Long) value);
        if (value instanceof Double) return Math.abs((Double) value);
        throw ErrorType.TYPE.raise("Bad operand type for abs(): " + Ops.typeName(value));
    }

    /** max / min：接受多个参数或单个列表 */
    private static Object extreme(String name, Arguments args, boolean max) {
        List<?> values = args.positional();
        if (values.size() == 1 && values.get(0) instanceof List) {
            values = (List<?>) values.get(0);
        }
        if (values.isEmpty()) {
            throw ErrorType.VALUE.raise(name + "() arg is an empty sequence");
        }
        Object best = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            Object candidate = values.get(i);
            if (Ops.compare(max ? BinaryOp.GT : BinaryOp.LT, candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static Object range(Arguments args) {
        List<Object> bounds = args.positional();
        if (bounds.isEmpty() || bounds.size() > 3) {
            throw new TailorRuntimeException("range() expects 1 to 3 arguments but got " + bounds.size());
        }
        int start = 0;
        int stop;
        int step = 1;
        if (bounds.size() == 1) {
            stop = requireInt(bounds.get(0), "range");
        } else {
            start = requireInt(bounds.get(0), "range");
            stop = requireInt(bounds.get(1), "range");
            if (bounds.size() == 3) step = requireInt(bounds.get(2), "range");
        }
        if (step == 0) {
            throw ErrorType.VALUE.raise("range() step must not be zero");
        }
        List<Object> result = new ArrayList<>();
        for (int i = start; step > 0 ? i < stop : i > stop; i += step) {
            result.add(i);
        }
        return result;
    }

    /** errorType(name, parent = Error)：定义新的错误类型 */
    private static Object errorType(Arguments args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new TailorRuntimeException("errorType() expects 1 or 2 arguments but got " + args.size());
        }
        Object name = args.extract("name", 0);
        Object parent = args.extract("parent", 1, ErrorType.ERROR);
        if (!(name instanceof String) || ((String) name).isEmpty()) {
            throw ErrorType.TYPE.raise("errorType() name must be a non-empty String");
        }
        if (!(parent instanceof ErrorType)) {
            throw ErrorType.TYPE.raise("errorType() parent must be an error type, not " + Ops.typeName(parent));
        }
        return new ErrorType((String) name, (ErrorType) parent);
    }

    static int requireInt(Object value, String function) {
        if (!(value instanceof Integer)) {
            throw ErrorType.TYPE.raise(function + "() expects Int arguments, not " + Ops.typeName(value));
        }
        return (Integer) value;
    }
}
