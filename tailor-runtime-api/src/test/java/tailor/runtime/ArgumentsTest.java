package tailor.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Arguments 测试
 */
class ArgumentsTest {

    @Nested
    @DisplayName("构造")
    class ConstructionTests {

        @Test
        @DisplayName("位置参数允许 null")
        void testNullPositional() {
            Arguments args = Arguments.of(1, null, "x");
            assertThat(args.size()).isEqualTo(3);
            assertThat(args.get(1)).isNull();
            assertThat(args.keywords()).isEmpty();
        }

        @Test
        @DisplayName("空参数共享同一实例")
        void testEmpty() {
            assertThat(Arguments.of()).isSameAs(Arguments.empty());
            assertThat(Arguments.empty().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("复制输入，外部修改不影响参数集")
        void testDefensiveCopy() {
            List<Object> pos = new java.util.ArrayList<>(Arrays.asList(1, 2));
            Map<String, Object> kw = new HashMap<>();
            kw.put("k", 3);
            Arguments args = Arguments.of(pos, kw);
            pos.add(99);
            kw.put("other", 4);
            assertThat(args.positional()).containsExactly(1, 2);
            assertThat(args.keywords()).containsOnlyKeys("k");
            assertThatThrownBy(() -> args.positional().add(5))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("构建器保持关键字顺序并拒绝重复")
        void testBuilder() {
            Arguments args = Arguments.builder().add(1).put("b", 2).put("a", 3).build();
            assertThat(args.keywords().keySet()).containsExactly("b", "a");
            assertThatThrownBy(() -> Arguments.builder().put("a", 1).put("a", 2))
                    .isInstanceOf(TailorException.class)
                    .hasMessageContaining("Duplicate keyword argument 'a'");
        }

        @Test
        @DisplayName("相等性与字符串形式")
        void testEqualityAndToString() {
            Arguments a = Arguments.of(Collections.singletonList(1), Collections.singletonMap("k", "v"));
            Arguments b = Arguments.builder().add(1).put("k", "v").build();
            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
            assertThat(a.toString()).isEqualTo("(1, k = v)");
        }
    }

    @Nested
    @DisplayName("按名称或位置提取")
    class ExtractTests {

        @Test
        @DisplayName("关键字优先于位置")
        void testKeywordFirst() {
            Arguments args = Arguments.builder().add(1).put("x", 42).build();
            assertThat(args.extract("x", 0)).isEqualTo(42);
        }

        @Test
        @DisplayName("没有关键字时取位置参数")
        void testPositionalFallback() {
            assertThat(Arguments.of(7, 8).extract("y", 1)).isEqualTo(8);
        }

        @Test
        @DisplayName("都没有时返回默认值")
        void testDefault() {
            assertThat(Arguments.of(7).extract("y", 3, "none")).isEqualTo("none");
            assertThat(Arguments.of(7).extract("y", -1)).isNull();
        }

        @Test
        @DisplayName("值为 null 的关键字参数也算存在")
        void testNullKeyword() {
            Arguments args = Arguments.builder().add(5).put("x", null).build();
            assertThat(args.hasKeyword("x")).isTrue();
            assertThat(args.extract("x", 0, "default")).isNull();
        }
    }
}
