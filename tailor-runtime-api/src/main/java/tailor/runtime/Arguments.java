package tailor.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次调用的完整参数集：有序的位置参数加上按名称传递的关键字参数。
 *
 * <p>不可变。守卫、失败处理器和被包装的函数看到的是同一个实例。</p>
 */
public final class Arguments {

    private static final Arguments EMPTY =
            new Arguments(Collections.emptyList(), Collections.<String, Object>emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private Arguments(List<Object> positional, Map<String, Object> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    public static Arguments empty() {
        return EMPTY;
    }

    /**
     * 只有位置参数（允许 null 元素）
     */
    public static Arguments of(Object... positional) {
        if (positional == null || positional.length == 0) return EMPTY;
        return of(Arrays.asList(positional), Collections.<String, Object>emptyMap());
    }

    public static Arguments of(List<?> positional, Map<String, ?> keywords) {
        List<Object> pos = positional == null || positional.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(positional));
        Map<String, Object> kw = keywords == null || keywords.isEmpty()
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
        return new Arguments(pos, kw);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    /** 位置参数个数 */
    public int size() {
        return positional.size();
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    /**
     * 第 index 个位置参数
     *
     * @throws IndexOutOfBoundsException 越界时
     */
    public Object get(int index) {
        return positional.get(index);
    }

    /** 关键字参数，不存在时返回 null */
    public Object get(String name) {
        return keywords.get(name);
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    /**
     * 按参数名提取参数值：优先取关键字参数，其次取位置参数，都没有时返回 defaultValue。
     *
     * @param position 位置参数下标，负数表示只按名称查找
     */
    public Object extract(String name, int position, Object defaultValue) {
        if (name != null && keywords.containsKey(name)) {
            return keywords.get(name);
        }
        if (position >= 0 && position < positional.size()) {
            return positional.get(position);
        }
        return defaultValue;
    }

    public Object extract(String name, int position) {
        return extract(name, position, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arguments)) return false;
        Arguments that = (Arguments) o;
        return positional.equals(that.positional) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keywords);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (Object value : positional) {
            if (!first) sb.append(", ");
            sb.append(value);
            first = false;
        }
        for (Map.Entry<String, Object> entry : keywords.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey()).append(" = ").append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }

    /**
     * 参数构建器
     */
    public static final class Builder {
        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> keywords = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(Object value) {
            positional.add(value);
            return this;
        }

        public Builder put(String name, Object value) {
            if (keywords.containsKey(name)) {
                throw new TailorException("Duplicate keyword argument '" + name + "'");
            }
            keywords.put(name, value);
            return this;
        }

        public Arguments build() {
            return Arguments.of(positional, keywords);
        }
    }
}
