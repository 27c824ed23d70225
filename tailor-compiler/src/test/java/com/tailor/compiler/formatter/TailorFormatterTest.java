package com.tailor.compiler.formatter;

import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TailorFormatter 测试
 */
class TailorFormatterTest {

    private final TailorFormatter formatter = new TailorFormatter();

    private FunDecl fun(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseFunctionDefinition();
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneExpression();
    }

    /** 规范格式的源码格式化后保持不变 */
    private void assertStable(String canonical) {
        assertEquals(canonical, formatter.format(fun(canonical)));
    }

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("签名与函数体")
        void testSignature() {
            assertEquals("fun add(a: Int, b: Int = 2): Int {\n    a + b\n}\n",
                    formatter.format(fun("fun add(a:Int,b:Int=2):Int{a+b}")));
        }

        @Test
        @DisplayName("文档注释与注解")
        void testDocAndAnnotations() {
            assertEquals("/**\n * Doc line.\n */\n@implicitReturn\n@tag(\"x\", level = 2)\nfun f() {\n    1\n}\n",
                    formatter.format(fun("/** Doc line. */ @implicitReturn @tag(\"x\", level = 2) fun f() { 1 }")));
        }

        @Test
        @DisplayName("空函数体")
        void testEmptyBody() {
            assertEquals("fun f() {}\n", formatter.format(fun("fun f() {\n}")));
        }

        @Test
        @DisplayName("制表符缩进")
        void testTabIndent() {
            assertEquals("fun f() {\n\t1\n}\n", formatter.format(fun("fun f() { 1 }"), FormatConfig.tabs()));
            assertEquals("fun f() {\n  1\n}\n", formatter.format(fun("fun f() { 1 }"), FormatConfig.spaces(2)));
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("if / else if / else")
        void testIfChain() {
            assertStable("fun f(x) {\n"
                    + "    if (x > 0) {\n"
                    + "        1\n"
                    + "    } else if (x < 0) {\n"
                    + "        -1\n"
                    + "    } else {\n"
                    + "        0\n"
                    + "    }\n"
                    + "}\n");
        }

        @Test
        @DisplayName("单行 if 展开为代码块")
        void testSingleLineIf() {
            assertEquals("fun f(x) {\n    if (x) {\n        \"a\"\n    } else {\n        \"b\"\n    }\n}\n",
                    formatter.format(fun("fun f(x) { if (x) \"a\" else \"b\" }")));
        }

        @Test
        @DisplayName("when 分支")
        void testWhen() {
            assertStable("fun f(x) {\n"
                    + "    when (x) {\n"
                    + "        is Int, !is String -> {\n"
                    + "            \"int\"\n"
                    + "        }\n"
                    + "        1, 2 -> {\n"
                    + "            \"small\"\n"
                    + "        }\n"
                    + "        else -> {\n"
                    + "            \"other\"\n"
                    + "        }\n"
                    + "    }\n"
                    + "}\n");
        }

        @Test
        @DisplayName("try / catch / else / finally")
        void testTry() {
            assertStable("fun f(s) {\n"
                    + "    try {\n"
                    + "        int(s)\n"
                    + "    } catch (e: ValueError) {\n"
                    + "        -1\n"
                    + "    } else {\n"
                    + "        0\n"
                    + "    } finally {\n"
                    + "        print(s)\n"
                    + "    }\n"
                    + "}\n");
        }

        @Test
        @DisplayName("声明、赋值、循环与其他语句")
        void testMiscStatements() {
            assertStable("fun f(xs) {\n"
                    + "    import math as m\n"
                    + "    global total\n"
                    + "    val n: Int = 0\n"
                    + "    var acc = []\n"
                    + "    for (x in xs) {\n"
                    + "        acc += [x]\n"
                    + "    }\n"
                    + "    while (n < 3) {\n"
                    + "        break\n"
                    + "    }\n"
                    + "    use (val r = open()) {\n"
                    + "        r.close()\n"
                    + "    }\n"
                    + "    delete total\n"
                    + "    throw ValueError(\"bad\")\n"
                    + "}\n");
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("只在需要时加括号")
        void testParentheses() {
            assertEquals("(1 + 2) * 3", formatter.format(expr("(1 + 2) * 3")));
            assertEquals("1 + 2 * 3", formatter.format(expr("1 + (2 * 3)")));
            assertEquals("a - (b - c)", formatter.format(expr("a - (b - c)")));
            assertEquals("a - b - c", formatter.format(expr("(a - b) - c")));
            assertEquals("-(x + 1)", formatter.format(expr("-(x + 1)")));
            assertEquals("!(a && b) || c", formatter.format(expr("!(a && b) || c")));
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals("[1, 5L, 2.5, true, null]", formatter.format(expr("[1, 5L, 2.5, true, null]")));
            assertEquals("\"a\\nb \\\"q\\\" \\$x\"", formatter.format(expr("\"a\\nb \\\"q\\\" \\$x\"")));
        }

        @Test
        @DisplayName("字符串插值统一为 ${} 形式")
        void testInterpolation() {
            assertEquals("\"Hi ${name}, ${a + 1}\"", formatter.format(expr("\"Hi $name, ${a + 1}\"")));
        }

        @Test
        @DisplayName("调用、成员、索引与类型检查")
        void testPostfix() {
            assertEquals("f(1, key = 2).items[0]", formatter.format(expr("f(1, key = 2).items[0]")));
            assertEquals("x !is String?", formatter.format(expr("x !is String?")));
            assertEquals("(a + b).size", formatter.format(expr("(a + b).size")));
        }

        @Test
        @DisplayName("lambda")
        void testLambda() {
            assertEquals("{ a, b -> a + b }", formatter.format(expr("{a,b->a+b}")));
            assertEquals("{ it * 2 }", formatter.format(expr("{ it * 2 }")));
        }
    }
}
