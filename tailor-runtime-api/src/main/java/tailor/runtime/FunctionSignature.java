package tailor.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数签名：名称、有序参数列表与返回类型注解
 *
 * <p>可变参数的原生函数没有固定参数列表，{@link #getArity()} 返回 -1。</p>
 */
public final class FunctionSignature {
    private final String name;
    private final List<ParameterInfo> parameters;
    private final String returnType;
    private final boolean variadic;

    public FunctionSignature(String name, List<ParameterInfo> parameters, String returnType) {
        this(name, parameters, returnType, false);
    }

    private FunctionSignature(String name, List<ParameterInfo> parameters, String returnType, boolean variadic) {
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnType = returnType;
        this.variadic = variadic;
    }

    /**
     * 只有参数名的签名
     */
    public static FunctionSignature of(String name, String... parameterNames) {
        List<ParameterInfo> params = new ArrayList<>();
        for (String param : parameterNames) {
            params.add(ParameterInfo.of(param));
        }
        return new FunctionSignature(name, params, null);
    }

    /**
     * 接受任意参数的签名
     */
    public static FunctionSignature variadic(String name) {
        return new FunctionSignature(name, Collections.<ParameterInfo>emptyList(), null, true);
    }

    public String getName() {
        return name;
    }

    public List<ParameterInfo> getParameters() {
        return parameters;
    }

    public List<String> getParameterNames() {
        List<String> names = new ArrayList<>(parameters.size());
        for (ParameterInfo param : parameters) {
            names.add(param.getName());
        }
        return names;
    }

    /** 返回类型注解，未标注时为 null */
    public String getReturnType() {
        return returnType;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * 参数数量，-1 表示可变参数
     */
    public int getArity() {
        return variadic ? -1 : parameters.size();
    }

    /**
     * 必需参数数量（没有默认值的参数）
     */
    public int getRequiredArity() {
        int required = 0;
        for (ParameterInfo param : parameters) {
            if (!param.hasDefault()) required++;
        }
        return required;
    }

    /** 按名称查找参数位置，不存在时返回 -1 */
    public int indexOf(String parameterName) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).getName().equals(parameterName)) return i;
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSignature)) return false;
        FunctionSignature that = (FunctionSignature) o;
        return variadic == that.variadic && name.equals(that.name)
                && parameters.equals(that.parameters) && Objects.equals(returnType, that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, returnType, variadic);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        if (variadic) {
            sb.append("...");
        } else {
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(parameters.get(i));
            }
        }
        sb.append(')');
        if (returnType != null) sb.append(": ").append(returnType);
        return sb.toString();
    }
}
