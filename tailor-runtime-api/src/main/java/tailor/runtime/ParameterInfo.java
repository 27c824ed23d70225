package tailor.runtime;

/**
 * 参数元数据：名称、类型注解与默认值（均按源码文本保存）
 */
public final class ParameterInfo {
    private final String name;
    private final String typeName;
    private final String defaultValue;

    public ParameterInfo(String name, String typeName, String defaultValue) {
        this.name = name;
        this.typeName = typeName;
        this.defaultValue = defaultValue;
    }

    public static ParameterInfo of(String name) {
        return new ParameterInfo(name, null, null);
    }

    public String getName() {
        return name;
    }

    /** 类型注解，未标注时为 null */
    public String getTypeName() {
        return typeName;
    }

    /** 默认值表达式的源码，没有默认值时为 null */
    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterInfo)) return false;
        ParameterInfo that = (ParameterInfo) o;
        return name.equals(that.name)
                && java.util.Objects.equals(typeName, that.typeName)
                && java.util.Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(name, typeName, defaultValue);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (typeName != null) sb.append(": ").append(typeName);
        if (defaultValue != null) sb.append(" = ").append(defaultValue);
        return sb.toString();
    }
}
