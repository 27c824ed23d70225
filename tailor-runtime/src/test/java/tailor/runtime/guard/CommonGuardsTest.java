package tailor.runtime.guard;

import tailor.runtime.Arguments;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 常用守卫测试
 */
class CommonGuardsTest {

    @Nested
    @DisplayName("notNone")
    class NotNoneTests {

        @Test
        @DisplayName("按位置取参数")
        void testPositional() {
            Guard guard = CommonGuards.notNone("x");
            assertThat(guard.check(Arguments.of(1)).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of((Object) null)).getMessage()).isEqualTo("x cannot be None");
            assertThat(guard.check(Arguments.empty()).isFailed()).isTrue();
        }

        @Test
        @DisplayName("关键字参数优先")
        void testKeyword() {
            Guard guard = CommonGuards.notNone("y", 1);
            assertThat(guard.check(Arguments.builder().add(1).put("y", 2).build()).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(1, null)).getMessage()).isEqualTo("y cannot be None");
            assertThat(guard.check(Arguments.of(1, 2)).isPassed()).isTrue();
        }
    }

    @Nested
    @DisplayName("notEmpty")
    class NotEmptyTests {

        @Test
        @DisplayName("空值")
        void testEmptyValues() {
            Guard guard = CommonGuards.notEmpty("name");
            assertThat(guard.check(Arguments.of("")).getMessage()).isEqualTo("name cannot be empty");
            assertThat(guard.check(Arguments.of(Collections.emptyList())).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of(Collections.emptyMap())).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of((Object) null)).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of(false)).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of(0)).isFailed()).isTrue();
            assertThat(guard.check(Arguments.empty()).isFailed()).isTrue();
        }

        @Test
        @DisplayName("非空值")
        void testNonEmptyValues() {
            Guard guard = CommonGuards.notEmpty("name");
            assertThat(guard.check(Arguments.of("a")).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(Arrays.asList(1))).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(3)).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(true)).isPassed()).isTrue();
        }
    }

    @Nested
    @DisplayName("positive")
    class PositiveTests {

        @Test
        @DisplayName("数值比较")
        void testNumbers() {
            Guard guard = CommonGuards.positive("x");
            assertThat(guard.check(Arguments.of(5)).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(0.5)).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(5L)).isPassed()).isTrue();
            assertThat(guard.check(Arguments.of(0)).getMessage()).isEqualTo("x must be positive");
            assertThat(guard.check(Arguments.of(-1)).isFailed()).isTrue();
        }

        @Test
        @DisplayName("缺失、null 与非数值都失败")
        void testNonNumbers() {
            Guard guard = CommonGuards.positive("x");
            assertThat(guard.check(Arguments.empty()).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of((Object) null)).isFailed()).isTrue();
            assertThat(guard.check(Arguments.of("5")).isFailed()).isTrue();
        }
    }

    @Nested
    @DisplayName("typeCheck")
    class TypeCheckTests {

        @Test
        @DisplayName("内置类型")
        void testBuiltinTypes() {
            assertThat(CommonGuards.typeCheck("Int", "x").check(Arguments.of(1)).isPassed()).isTrue();
            assertThat(CommonGuards.typeCheck("Int", "x").check(Arguments.of(1.0)).getMessage())
                    .isEqualTo("x must be of type Int");
            assertThat(CommonGuards.typeCheck("Number", "x").check(Arguments.of(1.0)).isPassed()).isTrue();
            assertThat(CommonGuards.typeCheck("String", "s").check(Arguments.of("a")).isPassed()).isTrue();
            assertThat(CommonGuards.typeCheck("List", "xs").check(Arguments.of(Arrays.asList(1))).isPassed()).isTrue();
            assertThat(CommonGuards.typeCheck("Any", "x").check(Arguments.of((Object) null)).isFailed()).isTrue();
        }

        @Test
        @DisplayName("未知类型名")
        void testUnknownType() {
            assertThatThrownBy(() -> CommonGuards.typeCheck("Widget", "x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown type: Widget");
        }
    }

    @Test
    @DisplayName("注册到 common 命名空间")
    void testRegisterAll() {
        GuardRegistry registry = new GuardRegistry();
        CommonGuards.registerAll(registry);

        assertThat(registry.list(CommonGuards.NAMESPACE))
                .containsExactly("not_empty", "not_none", "positive", "type_check");
        assertThat(registry.list()).isEmpty();

        Guard positive = registry.require("positive", CommonGuards.NAMESPACE).create("count");
        assertThat(positive.check(Arguments.of(-1)).getMessage()).isEqualTo("count must be positive");

        Guard second = registry.require("not_none", CommonGuards.NAMESPACE).create("y", 1);
        assertThat(second.check(Arguments.of(1, null)).getMessage()).isEqualTo("y cannot be None");

        Guard unnamed = registry.require("not_none", CommonGuards.NAMESPACE).create();
        assertThat(unnamed.check(Arguments.of((Object) null)).getMessage()).isEqualTo("parameter cannot be None");

        Guard typed = registry.require("type_check", CommonGuards.NAMESPACE).create("String", "name");
        assertThat(typed.check(Arguments.of(1)).getMessage()).isEqualTo("name must be of type String");
        assertThatThrownBy(() -> registry.require("type_check", CommonGuards.NAMESPACE).create())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
