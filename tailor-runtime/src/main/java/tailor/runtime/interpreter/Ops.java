package tailor.runtime.interpreter;

import com.tailor.compiler.ast.expr.BinaryExpr.BinaryOp;
import tailor.runtime.TailorCallable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 值语义：类型名、字符串化、算术、比较与包含判断
 *
 * <p>数值按 Int &lt; Long &lt; Double 提升。{@code /} 总是得到 Double，两个整数相除且除数为零时
 * 抛出 ArithmeticError，含 Double 的运算遵循 IEEE 754。</p>
 */
public final class Ops {

    private static final int RANK_INT = 1;
    private static final int RANK_LONG = 2;
    private static final int RANK_DOUBLE = 3;

    private Ops() {
    }

    // ============ 类型 ============

    /**
     * 值在脚本中的类型名
     */
    public static String typeName(Object value) {
        if (value == null) return "Null";
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return "Int";
        if (value instanceof Long) return "Long";
        if (value instanceof Double || value instanceof Float) return "Double";
        if (value instanceof String) return "String";
        if (value instanceof Boolean) return "Boolean";
        if (value instanceof List) return "List";
        if (value instanceof Map) return "Map";
        if (value instanceof ScriptError) return ((ScriptError) value).getType().getName();
        if (value instanceof ErrorType) return "ErrorType";
        if (value instanceof TailorCallable) return "Function";
        if (value instanceof ScriptModule) return "Module";
        return value.getClass().getSimpleName();
    }

    /**
     * 内置类型名的实例判断
     *
     * @return 不是内置类型名时返回 null
     */
    public static Boolean isBuiltinInstance(Object value, String typeName) {
        switch (typeName) {
            case "Any": return value != null;
            case "Null": return value == null;
            case "Int": return numericRank(value) == RANK_INT;
            case "Long": return numericRank(value) == RANK_LONG;
            case "Double": return numericRank(value) == RANK_DOUBLE;
            case "Number": return numericRank(value) > 0;
            case "String": return value instanceof String;
            case "Boolean": return value instanceof Boolean;
            case "List": return value instanceof List;
            case "Map": return value instanceof Map;
            case "Function": return value instanceof TailorCallable;
            case "Module": return value instanceof ScriptModule;
            default: return null;
        }
    }

    static int numericRank(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return RANK_INT;
        if (value instanceof Long) return RANK_LONG;
        if (value instanceof Double || value instanceof Float) return RANK_DOUBLE;
        return 0;
    }

    public static boolean isNumber(Object value) {
        return numericRank(value) > 0;
    }

    // ============ 字符串化 ============

    public static String stringify(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return (String) value;
        if (value instanceof Collection) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object element : (Collection<?>) value) {
                if (!first) sb.append(", ");
                sb.append(stringify(element));
                first = false;
            }
            return sb.append(']').toString();
        }
        if (value instanceof ErrorType) return ((ErrorType) value).getName();
        if (value instanceof TailorCallable) {
            return "<fun " + ((TailorCallable) value).getName() + ">";
        }
        return String.valueOf(value);
    }

    // ============ 条件 ============

    /**
     * 条件表达式必须是 Boolean
     */
    public static boolean condition(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        throw ErrorType.TYPE.raise("Condition must be a Boolean, not " + typeName(value));
    }

    // ============ 运算 ============

    /**
     * 除短路运算（&& 与 ||）以外的二元运算
     */
    public static Object binary(BinaryOp op, Object left, Object right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUB:
            case MUL:
            case DIV:
            case MOD: return arithmetic(op, left, right);
            case EQ: return valueEquals(left, right);
            case NE: return !valueEquals(left, right);
            case LT:
            case GT:
            case LE:
            case GE: return compare(op, left, right);
            case IN: return contains(right, left);
            default:
                throw new IllegalArgumentException("Not a strict binary operator: " + op);
        }
    }

    public static Object add(Object left, Object right) {
        if (left instanceof String || right instanceof String) {
            return stringify(left) + stringify(right);
        }
        if (left instanceof List && right instanceof List) {
            List<Object> result = new ArrayList<>((List<?>) left);
            result.addAll((List<?>) right);
            return result;
        }
        return arithmetic(BinaryOp.ADD, left, right);
    }

    private static Object arithmetic(BinaryOp op, Object left, Object right) {
        int rank = Math.max(numericRank(left), numericRank(right));
        if (numericRank(left) == 0 || numericRank(right) == 0) {
            throw ErrorType.TYPE.raise("Unsupported operand types for " + op.toSourceString() + ": "
                    + typeName(left) + " and " + typeName(right));
        }
        Number a = (Number) left;
        Number b = (Number) right;
        if (op == BinaryOp.DIV) {
            // 除法总是得到 Double；整数除数为零时报错
            if (rank != RANK_DOUBLE) checkDivisor(b.longValue() != 0, op);
            return a.doubleValue() / b.doubleValue();
        }
        if (rank == RANK_DOUBLE) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            switch (op) {
                case ADD: return x + y;
                case SUB: return x - y;
                case MUL: return x * y;
                default: return x % y;
            }
        }
        if (rank == RANK_LONG) {
            long x = a.longValue();
            long y = b.longValue();
            switch (op) {
                case ADD: return x + y;
                case SUB: return x - y;
                case MUL: return x * y;
                default: checkDivisor(y != 0, op); return x % y;
            }
        }
        int x = a.intValue();
        int y = b.intValue();
        switch (op) {
            case ADD: return x + y;
            case SUB: return x - y;
            case MUL: return x * y;
            default: checkDivisor(y != 0, op); return x % y;
        }
    }

    private static void checkDivisor(boolean nonZero, BinaryOp op) {
        if (!nonZero) {
            throw ErrorType.ARITHMETIC.raise(op == BinaryOp.DIV ? "Division by zero" : "Modulo by zero");
        }
    }

    public static boolean valueEquals(Object left, Object right) {
        if (left == right) return true;
        if (left == null || right == null) return false;
        int lr = numericRank(left);
        int rr = numericRank(right);
        if (lr > 0 && rr > 0) {
            int rank = Math.max(lr, rr);
            if (rank == RANK_DOUBLE) return ((Number) left).doubleValue() == ((Number) right).doubleValue();
            return ((Number) left).longValue() == ((Number) right).longValue();
        }
        if (left instanceof List && right instanceof List) {
            List<?> a = (List<?>) left;
            List<?> b = (List<?>) right;
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!valueEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return left.equals(right);
    }

    public static boolean compare(BinaryOp op, Object left, Object right) {
        int c;
        int lr = numericRank(left);
        int rr = numericRank(right);
        if (lr > 0 && rr > 0) {
            if (Math.max(lr, rr) == RANK_DOUBLE) {
                double x = ((Number) left).doubleValue();
                double y = ((Number) right).doubleValue();
                switch (op) {
                    case LT: return x < y;
                    case GT: return x > y;
                    case LE: return x <= y;
                    default: return x >= y;
                }
            }
            c = Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        } else if (left instanceof String && right instanceof String) {
            c = ((String) left).compareTo((String) right);
        } else {
            throw ErrorType.TYPE.raise("Cannot compare " + typeName(left) + " and " + typeName(right)
                    + " with '" + op.toSourceString() + "'");
        }
        switch (op) {
            case LT: return c < 0;
            case GT: return c > 0;
            case LE: return c <= 0;
            default: return c >= 0;
        }
    }

    public static boolean contains(Object container, Object element) {
        if (container instanceof String) {
            if (!(element instanceof String)) {
                throw ErrorType.TYPE.raise("'in <String>' requires a String operand, not " + typeName(element));
            }
            return ((String) container).contains((String) element);
        }
        if (container instanceof Collection) {
            for (Object item : (Collection<?>) container) {
                if (valueEquals(item, element)) return true;
            }
            return false;
        }
        if (container instanceof Map) {
            return ((Map<?, ?>) container).containsKey(element);
        }
        throw ErrorType.TYPE.raise("Argument of type " + typeName(container) + " is not a container");
    }

    public static Object negate(Object value) {
        switch (numericRank(value)) {
            case RANK_INT: return -((Number) value).intValue();
            case RANK_LONG: return -((Number) value).longValue();
            case RANK_DOUBLE: return -((Number) value).doubleValue();
            default:
                throw ErrorType.TYPE.raise("Bad operand type for unary -: " + typeName(value));
        }
    }

    public static Object plus(Object value) {
        if (!isNumber(value)) {
            throw ErrorType.TYPE.raise("Bad operand type for unary +: " + typeName(value));
        }
        return value;
    }

    public static Object not(Object value) {
        if (!(value instanceof Boolean)) {
            throw ErrorType.TYPE.raise("Bad operand type for !: " + typeName(value));
        }
        return !(Boolean) value;
    }

    // ============ 索引 ============

    public static Object index(Object target, Object index) {
        if (target instanceof List) {
            List<?> list = (List<?>) target;
            return list.get(checkIndex(index, list.size()));
        }
        if (target instanceof String) {
            String s = (String) target;
            int i = checkIndex(index, s.length());
            return s.substring(i, i + 1);
        }
        if (target instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) target;
            if (!map.containsKey(index)) {
                throw ErrorType.KEY.raise("Key not found: " + stringify(index));
            }
            return map.get(index);
        }
        throw ErrorType.TYPE.raise(typeName(target) + " is not indexable");
    }

    @SuppressWarnings("unchecked")
    public static void setIndex(Object target, Object index, Object value) {
        try {
            if (target instanceof List) {
                List<Object> list = (List<Object>) target;
                list.set(checkIndex(index, list.size()), value);
                return;
            }
            if (target instanceof Map) {
                ((Map<Object, Object>) target).put(index, value);
                return;
            }
        } catch (UnsupportedOperationException e) {
            throw ErrorType.TYPE.raise(typeName(target) + " is read-only");
        }
        throw ErrorType.TYPE.raise(typeName(target) + " does not support item assignment");
    }

    private static int checkIndex(Object index, int length) {
        if (numericRank(index) != RANK_INT && numericRank(index) != RANK_LONG) {
            throw ErrorType.TYPE.raise("Indices must be Int, not " + typeName(index));
        }
        long i = ((Number) index).longValue();
        if (i < 0 || i >= length) {
            throw ErrorType.INDEX.raise("Index " + i + " out of bounds for length " + length);
        }
        return (int) i;
    }
}
