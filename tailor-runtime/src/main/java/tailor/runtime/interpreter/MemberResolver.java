package tailor.runtime.interpreter;

import tailor.runtime.NativeFunction;
import tailor.runtime.TailorCallable;

import java.util.List;

/**
 * 成员访问：字符串、列表、错误值、模块与函数的属性和方法
 *
 * <p>方法以绑定了接收者的 {@link NativeFunction} 返回，调用时不再需要接收者。</p>
 */
final class MemberResolver {

    private MemberResolver() {
    }

    static Object get(Object target, String member) {
        if (target instanceof String) return stringMember((String) target, member);
        if (target instanceof List) return listMember((List<?>) target, member);
        if (target instanceof ScriptError) return errorMember((ScriptError) target, member);
        if (target instanceof ScriptModule) return ((ScriptModule) target).get(member);
        if (target instanceof ErrorType && "name".equals(member)) return ((ErrorType) target).getName();
        if (target instanceof TailorCallable) return callableMember((TailorCallable) target, member);
        throw unknown(target, member);
    }

    static void set(Object target, String member, Object value) {
        if (target instanceof ScriptModule) {
            ((ScriptModule) target).set(member, value);
            return;
        }
        throw ErrorType.TYPE.raise("Cannot assign member '" + member + "' on " + Ops.typeName(target));
    }

    private static Object stringMember(final String s, String member) {
        switch (member) {
            case "length":
                return s.length();
            case "isEmpty":
                return NativeFunction.create("isEmpty", () -> s.isEmpty());
            case "uppercase":
                return NativeFunction.create("uppercase", () -> s.toUpperCase());
            case "lowercase":
                return NativeFunction.create("lowercase", () -> s.toLowerCase());
            case "trim":
                return NativeFunction.create("trim", () -> s.trim());
            case "contains":
                return NativeFunction.create("contains", (Object x) -> s.contains(requireString(x, "contains")));
            case "startsWith":
                return NativeFunction.create("startsWith", (Object x) -> s.startsWith(requireString(x, "startsWith")));
            case "endsWith":
                return NativeFunction.create("endsWith", (Object x) -> s.endsWith(requireString(x, "endsWith")));
            default:
                throw unknown(s, member);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object listMember(final List<?> list, String member) {
        switch (member) {
            case "size":
                return list.size();
            case "isEmpty":
                return NativeFunction.create("isEmpty", () -> list.isEmpty());
            case "first":
                return NativeFunction.create("first", () -> {
                    if (list.isEmpty()) throw ErrorType.INDEX.raise("List is empty");
                    return list.get(0);
                });
            case "last":
                return NativeFunction.create("last", () -> {
                    if (list.isEmpty()) throw ErrorType.INDEX.raise("List is empty");
                    return list.get(list.size() - 1);
                });
            case "contains":
                return NativeFunction.create("contains", (Object x) -> Ops.contains(list, x));
            case "add":
                return NativeFunction.create("add", (Object x) -> {
                    try {
                        ((List<Object>) list).add(x);
                    } catch (UnsupportedOperationException e) {
                        throw ErrorType.TYPE.raise("List is read-only");
                    }
                    return null;
                });
            default:
                throw unknown(list, member);
        }
    }

    private static Object errorMember(ScriptError error, String member) {
        switch (member) {
            case "message": return error.getMessage();
            case "type": return error.getType().getName();
            default: throw unknown(error, member);
        }
    }

    private static Object callableMember(TailorCallable fn, String member) {
        switch (member) {
            case "name": return fn.getName();
            case "doc": return fn.getDocumentation();
            default: throw unknown(fn, member);
        }
    }

    private static String requireString(Object value, String method) {
        if (!(value instanceof String)) {
            throw ErrorType.TYPE.raise(method + "() argument must be a String, not " + Ops.typeName(value));
        }
        return (String) value;
    }

    private static ScriptErrorException unknown(Object target, String member) {
        return ErrorType.NAME.raise("Unknown member '" + member + "' on " + Ops.typeName(target));
    }
}
