package tailor.runtime.interpreter;

import tailor.runtime.NativeFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * 可通过 import 导入的内置模块：math、strings
 */
final class BuiltinModules {

    private BuiltinModules() {
    }

    static List<ScriptModule> all() {
        List<ScriptModule> modules = new ArrayList<>();
        modules.add(math());
        modules.add(strings());
        return modules;
    }

    static ScriptModule math() {
        Environment scope = Environment.builtins().newModuleScope(null);
        scope.defineVal("pi", Math.PI);
        scope.defineVal("e", Math.E);
        scope.defineVal("inf", Double.POSITIVE_INFINITY);
        scope.defineVal("sqrt", NativeFunction.create("sqrt", (Object x) -> {
            double d = number(x, "sqrt");
            if (d < 0) throw ErrorType.VALUE.raise("math domain error");
            return Math.sqrt(d);
        }));
        scope.defineVal("pow", NativeFunction.create("pow",
                (Object x, Object y) -> Math.pow(number(x, "pow"), number(y, "pow"))));
        scope.defineVal("floor", NativeFunction.create("floor", (Object x) -> {
            if (x instanceof Integer || x instanceof Long) return x;
            return Math.floor(number(x, "floor"));
        }));
        scope.defineVal("ceil", NativeFunction.create("ceil", (Object x) -> {
            if (x instanceof Integer || x instanceof Long) return x;
            return Math.ceil(number(x, "ceil"));
        }));
        return new ScriptModule("math", scope, null);
    }

    static ScriptModule strings() {
        Environment scope = Environment.builtins().newModuleScope(null);
        scope.defineVal("join", NativeFunction.create("join", (Object items, Object separator) -> {
            if (!(items instanceof List)) {
                throw ErrorType.TYPE.raise("join() expects a List, not " + Ops.typeName(items));
            }
            List<?> list = (List<?>) items;
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(Ops.stringify(separator));
                sb.append(Ops.stringify(list.get(i)));
            }
            return sb.toString();
        }));
        scope.defineVal("repeat", NativeFunction.create("repeat", (Object s, Object n) -> {
            int count = Builtins.requireInt(n, "repeat");
            if (count < 0) throw ErrorType.VALUE.raise("repeat() count must not be negative");
            StringBuilder sb = new StringBuilder();
            String text = Ops.stringify(s);
            for (int i = 0; i < count; i++) {
                sb.append(text);
            }
            return sb.toString();
        }));
        return new ScriptModule("strings", scope, null);
    }

    private static double number(Object value, String function) {
        if (!Ops.isNumber(value)) {
            throw ErrorType.TYPE.raise(function + "() expects a number, not " + Ops.typeName(value));
        }
        return ((Number) value).doubleValue();
    }
}
