package tailor.runtime;

import com.tailor.compiler.parser.ParseException;
import com.tailor.compiler.transform.ExplicitReturnDisallowedError;
import com.tailor.compiler.transform.MissingImplicitReturnError;
import tailor.runtime.interpreter.ScriptFunction;
import tailor.runtime.interpreter.ScriptModule;
import tailor.runtime.materialize.EngineOptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.*;

/**
 * 模块加载测试
 */
class ModuleLoaderTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ModuleLoader loader = new ModuleLoader(
            EngineOptions.builder().output(new PrintStream(out, true)).build());

    @Test
    @DisplayName("模块名取自文件名")
    void testModuleName() {
        assertThat(loader.load("val a = 1", "scripts/shapes.tailor").getName()).isEqualTo("shapes");
        assertThat(ModuleLoader.moduleName("C:\\work\\util.tailor")).isEqualTo("util");
        assertThat(ModuleLoader.moduleName("plain")).isEqualTo("plain");
        assertThat(loader.load("val a = 1").getName()).isEqualTo("<script>");
    }

    @Test
    @DisplayName("执行顶层语句")
    void testTopLevel() {
        ScriptModule module = loader.load("val greeting = \"hi\"\nprint(greeting)", "hello.tailor");
        assertThat(module.get("greeting")).isEqualTo("hi");
        assertThat(out.toString().trim()).isEqualTo("hi");
    }

    @Test
    @DisplayName("@implicitReturn 函数在定义时改写")
    void testAnnotatedFunction() {
        ScriptModule module = loader.load("@implicitReturn\nfun classify(x) {\n    if (x > 0) {\n        \"positive\"\n"
                + "    } else {\n        \"non-positive\"\n    }\n}\nval label = classify(3)", "shapes.tailor");

        assertThat(module.get("label")).isEqualTo("positive");
        ScriptFunction classify = (ScriptFunction) module.function("classify");
        assertThat(classify.isMaterialized()).isTrue();
        assertThat(classify.getAnnotations()).containsExactly(ModuleLoader.IMPLICIT_RETURN_ANNOTATION);
        assertThat(classify.invoke(-1)).isEqualTo("non-positive");
    }

    @Test
    @DisplayName("没有注解的函数保持原样")
    void testPlainFunction() {
        ScriptFunction f = (ScriptFunction) loader.load("fun f(x) {\n    return x\n}").function("f");
        assertThat(f.isMaterialized()).isFalse();
    }

    @Test
    @DisplayName("定义期错误在加载时抛出")
    void testDefinitionErrors() {
        assertThatThrownBy(() -> loader.load("@implicitReturn\nfun bad(x) {\n    if (x > 0) {\n        1\n    }\n}"))
                .isInstanceOf(MissingImplicitReturnError.class);
        assertThatThrownBy(() -> loader.load("@implicitReturn\nfun bad2(x) {\n    if (true) {\n        return 1\n    }\n    2\n}"))
                .isInstanceOf(ExplicitReturnDisallowedError.class);
    }

    @Test
    @DisplayName("语法错误")
    void testParseError() {
        assertThatThrownBy(() -> loader.load("fun f(x) {", "broken.tailor"))
                .isInstanceOf(ParseException.class);
    }

    @Test
    @DisplayName("注册后可被其他模块导入")
    void testRegister() {
        loader.register(loader.load("@implicitReturn\nfun twice(x) {\n    x * 2\n}", "util.tailor"));
        ScriptModule app = loader.load("import util\nval y = util.twice(21)", "app.tailor");
        assertThat(app.get("y")).isEqualTo(42);
    }
}
