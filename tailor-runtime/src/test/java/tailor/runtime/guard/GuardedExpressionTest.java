package tailor.runtime.guard;

import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.parser.Parser;
import com.tailor.compiler.transform.MissingImplicitReturnError;
import com.tailor.compiler.transform.SourceUnavailableError;
import tailor.runtime.Arguments;
import tailor.runtime.NativeFunction;
import tailor.runtime.TailorCallable;
import tailor.runtime.interpreter.Environment;
import tailor.runtime.interpreter.Interpreter;
import tailor.runtime.interpreter.ScriptFunction;
import tailor.runtime.interpreter.ScriptModule;
import tailor.runtime.interpreter.SourceUnit;
import tailor.runtime.materialize.EngineOptions;
import tailor.runtime.materialize.FunctionMaterializer;
import tailor.runtime.materialize.ImplicitReturn;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 守卫表达式测试
 */
class GuardedExpressionTest {

    private static final String PROCESS = "var calls = 0\n"
            + "fun process(x) {\n"
            + "    calls += 1\n"
            + "    x * 2\n"
            + "}";

    private final Interpreter interpreter = new Interpreter();
    private final FunctionMaterializer materializer = new FunctionMaterializer(EngineOptions.defaults(), interpreter);

    private ScriptModule load(String source) {
        SourceUnit unit = new SourceUnit(source, "process.tailor");
        Environment scope = interpreter.newModuleScope(unit);
        interpreter.executeProgram(new Parser(new Lexer(source, "process.tailor"), "process.tailor").parse(), scope);
        return new ScriptModule("process", scope, unit);
    }

    private GuardedExpression.Builder guarded() {
        return GuardedExpression.builder()
                .guards(CommonGuards.notNone("x"), CommonGuards.positive("x"))
                .materializer(materializer);
    }

    @Nested
    @DisplayName("守卫与隐式返回")
    class ScenarioTests {

        @Test
        @DisplayName("失败时抛出 GuardClauseError")
        void testRaise() {
            ScriptModule module = load(PROCESS);
            GuardedFunction process = guarded().build().wrap(module.function("process"));

            assertThatThrownBy(() -> process.invoke((Object) null))
                    .isInstanceOf(GuardClauseError.class)
                    .hasMessage("x cannot be None");
            assertThatThrownBy(() -> process.invoke(-1))
                    .isInstanceOf(GuardClauseError.class)
                    .hasMessage("x must be positive");
            assertThat(module.get("calls")).isEqualTo(0);

            assertThat(process.invoke(5)).isEqualTo(10);
            assertThat(module.get("calls")).isEqualTo(1);
        }

        @Test
        @DisplayName("失败时返回固定值，目标函数不执行")
        void testSentinel() {
            ScriptModule module = load(PROCESS);
            GuardedFunction process = guarded()
                    .onError(FailureBehavior.sentinel(null))
                    .build()
                    .wrap(module.function("process"));

            assertThat(process.invoke(-1)).isNull();
            assertThat(module.get("calls")).isEqualTo(0);
        }

        @Test
        @DisplayName("定义期错误在 wrap 时抛出")
        void testDefinitionErrorAtWrap() {
            TailorCallable bad = load("fun bad(x) {\n    if (x > 0) {\n        x\n    }\n}").function("bad");
            assertThatThrownBy(() -> guarded().build().wrap(bad))
                    .isInstanceOf(MissingImplicitReturnError.class);
        }

        @Test
        @DisplayName("关闭隐式返回时直接包装原函数")
        void testWithoutImplicitReturn() {
            NativeFunction twice = NativeFunction.create("twice", (Object x) -> (Integer) x * 2);
            GuardedFunction guardedTwice = guarded().implicitReturn(false).build().wrap(twice);
            assertThat(guardedTwice.getTarget()).isSameAs(twice);
            assertThat(guardedTwice.invoke(4)).isEqualTo(8);
            assertThatThrownBy(() -> guardedTwice.invoke(0)).isInstanceOf(GuardClauseError.class);
        }

        @Test
        @DisplayName("原生函数开启隐式返回时无法包装")
        void testNativeWithImplicitReturn() {
            NativeFunction twice = NativeFunction.create("twice", (Object x) -> (Integer) x * 2);
            assertThatThrownBy(() -> guarded().build().wrap(twice))
                    .isInstanceOf(SourceUnavailableError.class);
        }

        @Test
        @DisplayName("已改写的函数不会再改写")
        void testAlreadyMaterialized() {
            TailorCallable rewritten = materializer.materialize(load(PROCESS).function("process"));
            GuardedFunction process = guarded().build().wrap(rewritten);
            assertThat(process.getTarget()).isSameAs(rewritten);
        }

        @Test
        @DisplayName("不设置物化器时使用默认物化器")
        void testDefaultMaterializer() {
            GuardedFunction process = GuardedExpression.builder()
                    .guard(CommonGuards.positive("x"))
                    .build()
                    .wrap(load(PROCESS).function("process"));
            assertThat(process.invoke(3)).isEqualTo(6);
            assertThat(ImplicitReturn.defaultMaterializer().getCacheStats().getMaximumSize()).isEqualTo(256);
        }
    }

    @Nested
    @DisplayName("包装后的函数")
    class WrapperTests {

        @Test
        @DisplayName("名称、文档、签名沿用原函数")
        void testMetadata() {
            ScriptModule module = load("/** Doubles x */\nfun process(x) {\n    x * 2\n}");
            ScriptFunction original = (ScriptFunction) module.function("process");
            GuardedFunction process = guarded().build().wrap(original);

            assertThat(process.getName()).isEqualTo("process");
            assertThat(process.getDocumentation()).isEqualTo(original.getDocumentation());
            assertThat(process.getSignature().toString()).isEqualTo("process(x)");
            assertThat(process.getOriginal()).isSameAs(original);
            assertThat(process.toString()).isEqualTo("<guarded fun process>");
        }

        @Test
        @DisplayName("守卫包装没有源码，不能再做隐式返回改写")
        void testNoSource() {
            GuardedFunction process = guarded().build().wrap(load(PROCESS).function("process"));
            assertThat(process.getSource()).isEmpty();
            assertThatThrownBy(() -> materializer.materialize(process))
                    .isInstanceOf(SourceUnavailableError.class);
        }

        @Test
        @DisplayName("关键字参数同样参与检查")
        void testKeywordArguments() {
            GuardedFunction process = guarded().build().wrap(load(PROCESS).function("process"));
            assertThat(process.call(Arguments.builder().put("x", 4).build())).isEqualTo(8);
            assertThatThrownBy(() -> process.call(Arguments.builder().put("x", -4).build()))
                    .isInstanceOf(GuardClauseError.class)
                    .hasMessage("x must be positive");
        }

        @Test
        @DisplayName("守卫与配置")
        void testExpressionAccessors() {
            GuardedExpression expression = guarded().log(true).build();
            assertThat(expression.getGuards()).hasSize(2);
            assertThat(expression.isImplicitReturn()).isTrue();
            assertThat(expression.isLog()).isTrue();
            assertThat(expression.getOnError().getKind()).isEqualTo(FailureBehavior.Kind.RAISE);
        }
    }
}
