package tailor.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * NativeFunction 与 FunctionSignature 测试
 */
class NativeFunctionTest {

    @Test
    @DisplayName("固定参数的原生函数")
    void testFixedArity() {
        NativeFunction add = NativeFunction.create("add", (a, b) -> (Integer) a + (Integer) b);
        assertThat(add.invoke(2, 3)).isEqualTo(5);
        assertThat(add.getArity()).isEqualTo(2);
        assertThat(add.getSource()).isEmpty();
        assertThat(add.toString()).isEqualTo("<native fun add>");
    }

    @Test
    @DisplayName("参数数量不符")
    void testArityMismatch() {
        NativeFunction neg = NativeFunction.create("neg", x -> -((Integer) x));
        assertThatThrownBy(() -> neg.invoke(1, 2))
                .isInstanceOf(TailorException.class)
                .hasMessage("Function 'neg' expects 1 argument(s) but got 2");
    }

    @Test
    @DisplayName("固定参数函数拒绝关键字参数")
    void testKeywordRejected() {
        NativeFunction zero = NativeFunction.create("zero", () -> 0);
        assertThatThrownBy(() -> zero.call(Arguments.builder().put("x", 1).build()))
                .isInstanceOf(TailorException.class)
                .hasMessageContaining("does not accept keyword arguments");
    }

    @Test
    @DisplayName("可变参数函数看到完整参数集")
    void testVariadic() {
        NativeFunction echo = NativeFunction.of("echo", args -> args);
        Arguments args = Arguments.builder().add(1).put("k", 2).build();
        assertThat(echo.call(args)).isSameAs(args);
        assertThat(echo.getArity()).isEqualTo(-1);
        assertThat(echo.getSignature().toString()).isEqualTo("echo(...)");
    }

    @Test
    @DisplayName("签名的字符串形式与必需参数")
    void testSignature() {
        FunctionSignature sig = new FunctionSignature("area", java.util.Arrays.asList(
                new ParameterInfo("w", "Double", null),
                new ParameterInfo("h", "Double", "1.0")), "Double");
        assertThat(sig.toString()).isEqualTo("area(w: Double, h: Double = 1.0): Double");
        assertThat(sig.getRequiredArity()).isEqualTo(1);
        assertThat(sig.indexOf("h")).isEqualTo(1);
        assertThat(sig.getParameterNames()).containsExactly("w", "h");
    }
}
