package tailor.runtime;

import tailor.runtime.guard.CommonGuards;
import tailor.runtime.guard.FailureBehavior;
import tailor.runtime.guard.GuardClauseError;
import tailor.runtime.interpreter.ScriptModule;
import tailor.runtime.materialize.EngineOptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tailor 入口测试
 */
class TailorTest {

    private static final String SOURCE = "fun safeDivide(x, y) {\n"
            + "    try {\n"
            + "        x / y\n"
            + "    } catch (e: ArithmeticError) {\n"
            + "        Infinity\n"
            + "    }\n"
            + "}\n"
            + "fun process(x) {\n"
            + "    x * 2\n"
            + "}";

    private final Tailor tailor = Tailor.create();

    @Test
    @DisplayName("隐式返回")
    void testImplicitReturn() {
        ScriptModule module = tailor.load(SOURCE, "math_utils.tailor");
        TailorCallable safeDivide = tailor.implicitReturn(tailor.function(module, "safeDivide"));

        assertThat(safeDivide.invoke(10, 0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(safeDivide.invoke(10, 2)).isEqualTo(5.0);
        assertThat(tailor.implicitReturn(safeDivide)).isSameAs(safeDivide);
    }

    @Test
    @DisplayName("守卫使用实例自己的物化器")
    void testGuarded() {
        ScriptModule module = tailor.load(SOURCE, "math_utils.tailor");
        TailorCallable process = tailor.guarded()
                .guards(CommonGuards.notNone("x"), CommonGuards.positive("x"))
                .build()
                .wrap(tailor.function(module, "process"));

        assertThat(process.invoke(5)).isEqualTo(10);
        assertThatThrownBy(() -> process.invoke(-1))
                .isInstanceOf(GuardClauseError.class)
                .hasMessage("x must be positive");
        assertThat(tailor.getCacheStats().getMissCount()).isEqualTo(1);

        TailorCallable lenient = tailor.guarded()
                .guard(CommonGuards.positive("x"))
                .onError(FailureBehavior.sentinel(0))
                .build()
                .wrap(tailor.function(module, "process"));
        assertThat(lenient.invoke(-1)).isEqualTo(0);
        assertThat(tailor.getCacheStats().getHitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("自定义配置")
    void testOptions() {
        Tailor custom = Tailor.create(EngineOptions.builder().cacheSize(8).resultBaseName("__value").build());
        assertThat(custom.getOptions().getCacheSize()).isEqualTo(8);
        assertThat(custom.getCacheStats().getMaximumSize()).isEqualTo(8);
        assertThat(custom.getMaterializer().getOptions().getResultBaseName()).isEqualTo("__value");
    }
}
