package tailor.runtime.guard;

import tailor.runtime.interpreter.Ops;

import java.util.Collection;
import java.util.Map;

/**
 * 常用守卫
 *
 * <p>参数先按关键字名取，再按位置取（默认第 0 个），都没有时使用各守卫自己的默认值。</p>
 */
public final class CommonGuards {

    /** 不指定参数名时使用的名字 */
    public static final String DEFAULT_PARAM = "parameter";

    /** {@link #registerAll} 使用的命名空间 */
    public static final String NAMESPACE = "common";

    private CommonGuards() {
    }

    // ============ notNone ============

    public static Guard notNone(String param) {
        return notNone(param, 0);
    }

    /**
     * 参数不能为 null
     */
    public static Guard notNone(final String param, final int position) {
        return args -> args.extract(param, position, null) != null
                ? GuardResult.pass()
                : GuardResult.fail(param + " cannot be None");
    }

    // ============ notEmpty ============

    public static Guard notEmpty(String param) {
        return notEmpty(param, 0);
    }

    /**
     * 参数不能为空：字符串、列表、Map 不能为空；null、false、数值 0 视为空
     */
    public static Guard notEmpty(final String param, final int position) {
        return args -> isEmpty(args.extract(param, position, ""))
                ? GuardResult.fail(param + " cannot be empty")
                : GuardResult.pass();
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence) return ((CharSequence) value).length() == 0;
        if (value instanceof Collection) return ((Collection<?>) value).isEmpty();
        if (value instanceof Map) return ((Map<?, ?>) value).isEmpty();
        if (value instanceof Boolean) return !(Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() == 0.0;
        return false;
    }

    // ============ positive ============

    public static Guard positive(String param) {
        return positive(param, 0);
    }

    /**
     * 参数必须是大于 0 的数；缺失、null 或非数值都算失败
     */
    public static Guard positive(final String param, final int position) {
        return args -> {
            Object value = args.extract(param, position, 0);
            boolean ok = Ops.isNumber(value) && ((Number) value).doubleValue() > 0;
            return ok ? GuardResult.pass() : GuardResult.fail(param + " must be positive");
        };
    }

    // ============ typeCheck ============

    public static Guard typeCheck(String typeName, String param) {
        return typeCheck(typeName, param, 0);
    }

    /**
     * 参数必须是指定的 Tailor 内置类型（Int、Long、Double、Number、String、Boolean、List、Map、Function ...）
     *
     * @throws IllegalArgumentException 类型名不是内置类型
     */
    public static Guard typeCheck(final String typeName, final String param, final int position) {
        if (Ops.isBuiltinInstance(null, typeName) == null) {
            throw new IllegalArgumentException("Unknown type: " + typeName);
        }
        return args -> Boolean.TRUE.equals(Ops.isBuiltinInstance(args.extract(param, position, null), typeName))
                ? GuardResult.pass()
                : GuardResult.fail(param + " must be of type " + typeName);
    }

    // ============ 注册 ============

    /**
     * 把常用守卫以工厂形式注册到 "common" 命名空间：
     * not_none(param[, position])、not_empty(...)、positive(...)、type_check(type, param[, position])
     */
    public static void registerAll(GuardRegistry registry) {
        registry.register("not_none", config -> notNone(paramOf(config, 0), positionOf(config, 1)), NAMESPACE);
        registry.register("not_empty", config -> notEmpty(paramOf(config, 0), positionOf(config, 1)), NAMESPACE);
        registry.register("positive", config -> positive(paramOf(config, 0), positionOf(config, 1)), NAMESPACE);
        registry.register("type_check", config -> {
            if (config.length == 0 || !(config[0] instanceof String)) {
                throw new IllegalArgumentException("type_check requires a type name");
            }
            return typeCheck((String) config[0], paramOf(config, 1), positionOf(config, 2));
        }, NAMESPACE);
    }

    private static String paramOf(Object[] config, int index) {
        return config.length > index && config[index] != null ? String.valueOf(config[index]) : DEFAULT_PARAM;
    }

    private static int positionOf(Object[] config, int index) {
        if (config.length > index && config[index] instanceof Integer) {
            return (Integer) config[index];
        }
        return 0;
    }
}
