package com.tailor.compiler.transform;

import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.expr.Identifier;
import com.tailor.compiler.ast.stmt.*;
import com.tailor.compiler.formatter.TailorFormatter;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 隐式返回改写流水线测试
 */
class ImplicitReturnTransformerTest {

    private final ImplicitReturnTransformer transformer = new ImplicitReturnTransformer();

    private FunDecl parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseFunctionDefinition();
    }

    private TransformResult transform(String source) {
        return transformer.transform(parse(source));
    }

    private String rewrittenSource(String source) {
        return new TailorFormatter().format(transform(source).getRewritten());
    }

    @Nested
    @DisplayName("改写结果")
    class RewriteTests {

        @Test
        @DisplayName("单个尾表达式绑定到结果并追加 return")
        void testSimpleBody() {
            TransformResult result = transform("fun inc(x) { x + 1 }");
            List<Statement> stmts = result.getRewritten().getBody().getStatements();

            assertThat(stmts).hasSize(3);
            PropertyStmt declaration = (PropertyStmt) stmts.get(0);
            assertThat(declaration.getName()).isEqualTo("__implicit_result");
            assertThat(declaration.isMutable()).isTrue();
            assertThat(declaration.getInitializer()).isNull();
            AssignStmt assign = (AssignStmt) stmts.get(1);
            assertThat(((Identifier) assign.getTarget()).getName()).isEqualTo("__implicit_result");
            ReturnStmt ret = (ReturnStmt) stmts.get(2);
            assertThat(((Identifier) ret.getValue()).getName()).isEqualTo("__implicit_result");
            assertThat(result.getResultName()).isEqualTo("__implicit_result");
        }

        @Test
        @DisplayName("改写后的源码")
        void testRewrittenSource() {
            assertThat(rewrittenSource("fun f(x) {\n    val y = x * 2\n    y + 1\n}"))
                    .isEqualTo("fun f(x) {\n"
                            + "    var __implicit_result\n"
                            + "    val y = x * 2\n"
                            + "    __implicit_result = y + 1\n"
                            + "    return __implicit_result\n"
                            + "}\n");
        }

        @Test
        @DisplayName("结果绑定声明在文档字符串之后")
        void testDeclarationAfterDocString() {
            TransformResult result = transform("fun f(x) {\n    \"Doubles x.\"\n    x * 2\n}");
            List<Statement> stmts = result.getRewritten().getBody().getStatements();
            assertThat(stmts).hasSize(4);
            assertThat(stmts.get(0)).isInstanceOf(ExpressionStmt.class);
            assertThat(stmts.get(1)).isInstanceOf(PropertyStmt.class);
            assertThat(result.getRewritten().getDocumentation()).isEqualTo("Doubles x.");
        }

        @Test
        @DisplayName("改写后的源码重新解析得到同样的源码")
        void testRewrittenSourceReparses() {
            String source = "fun f(s) {\n    try {\n        int(s)\n    } catch (e: ValueError) {\n        -1\n    }\n}";
            String rewritten = rewrittenSource(source);
            assertThat(new TailorFormatter().format(parse(rewritten))).isEqualTo(rewritten);
        }

        @Test
        @DisplayName("非尾位置语句按引用保留")
        void testNonTailStatementsShared() {
            TransformResult result = transform("fun f(x) {\n    print(x)\n    val y = 1\n    y\n}");
            List<Statement> before = result.getOriginal().getBody().getStatements();
            List<Statement> after = result.getRewritten().getBody().getStatements();
            assertThat(after.get(1)).isSameAs(before.get(0));
            assertThat(after.get(2)).isSameAs(before.get(1));
        }

        @Test
        @DisplayName("原函数定义不被修改")
        void testOriginalUntouched() {
            FunDecl decl = parse("fun f(x) { if (x) { 1 } else { 2 } }");
            String before = new TailorFormatter().format(decl);
            transformer.transform(decl);
            assertThat(new TailorFormatter().format(decl)).isEqualTo(before);
            assertThat(decl.getBody().getStatements()).hasSize(1);
        }

        @Test
        @DisplayName("同一定义两次改写结果相同")
        void testDeterministic() {
            String source = "fun f(x) {\n    when (x) {\n        1 -> \"one\"\n        else -> \"many\"\n    }\n}";
            assertThat(rewrittenSource(source)).isEqualTo(rewrittenSource(source));
        }

        @Test
        @DisplayName("if / else if / else 每个分支都被改写")
        void testElseIfChain() {
            TransformResult result = transform("fun sign(x) {\n    if (x > 0) {\n        \"pos\"\n    } else if (x < 0) {\n        \"neg\"\n    } else {\n        \"zero\"\n    }\n}");
            assertThat(result.getTailPositions()).hasSize(3)
                    .extracting(TailPosition::getKind)
                    .containsOnly(BranchKind.CONDITIONAL_BRANCH);

            IfStmt top = (IfStmt) result.getRewritten().getBody().getStatements().get(1);
            assertThat(top.getThenBranch().getLast()).isInstanceOf(AssignStmt.class);
            IfStmt elseIf = (IfStmt) top.getElseBranch();
            assertThat(elseIf.getThenBranch().getLast()).isInstanceOf(AssignStmt.class);
            assertThat(((Block) elseIf.getElseBranch()).getLast()).isInstanceOf(AssignStmt.class);
        }

        @Test
        @DisplayName("try / catch / else 改写，finally 保持不变")
        void testTryRewrite() {
            TransformResult result = transform("fun f(s) {\n    try {\n        int(s)\n    } catch (e: ValueError) {\n        -1\n    } else {\n        0\n    } finally {\n        log(s)\n    }\n}");
            assertThat(result.getTailPositions())
                    .extracting(TailPosition::getKind)
                    .containsExactly(BranchKind.TRY_BODY, BranchKind.HANDLER_BODY, BranchKind.HANDLER_ELSE);

            TryStmt original = (TryStmt) result.getOriginal().getBody().getLast();
            TryStmt rewritten = (TryStmt) result.getRewritten().getBody().getStatements().get(1);
            assertThat(rewritten.getFinallyBlock()).isSameAs(original.getFinallyBlock());
            assertThat(rewritten.getFinallyBlock().getLast()).isInstanceOf(ExpressionStmt.class);
        }

        @Test
        @DisplayName("只有 finally 的 try 只改写 try 块")
        void testTryFinallyOnly() {
            TransformResult result = transform("fun f() {\n    try {\n        compute()\n    } finally {\n        cleanup()\n    }\n}");
            assertThat(result.getTailPositions())
                    .extracting(TailPosition::getKind)
                    .containsExactly(BranchKind.TRY_BODY);
        }

        @Test
        @DisplayName("when 的每个分支都被改写")
        void testWhenRewrite() {
            TransformResult result = transform("fun describe(v) {\n    when (v) {\n        is Int -> \"int\"\n        is String -> \"string\"\n        else -> \"other\"\n    }\n}");
            assertThat(result.getTailPositions()).hasSize(3)
                    .extracting(TailPosition::getKind)
                    .containsOnly(BranchKind.MATCH_ARM);
        }

        @Test
        @DisplayName("没有 else 的 when 仍可改写")
        void testWhenWithoutElse() {
            TransformResult result = transform("fun f(v) {\n    when (v) {\n        1 -> \"one\"\n    }\n}");
            assertThat(result.getTailPositions()).hasSize(1);
        }

        @Test
        @DisplayName("throw 结束的分支不需要值")
        void testThrowBranch() {
            TransformResult result = transform("fun check(x) {\n    if (x < 0) {\n        throw ValueError(\"negative\")\n    } else {\n        x\n    }\n}");
            assertThat(result.getTailPositions()).hasSize(1);
            IfStmt rewritten = (IfStmt) result.getRewritten().getBody().getStatements().get(1);
            assertThat(rewritten.getThenBranch().getLast()).isInstanceOf(ThrowStmt.class);
        }

        @Test
        @DisplayName("嵌套代码结构中的尾表达式")
        void testNestedStructures() {
            TransformResult result = transform("fun f(a, b) {\n    if (a) {\n        when {\n            b -> 1\n            else -> 2\n        }\n    } else {\n        try { 3 } catch (e) { 4 }\n    }\n}");
            assertThat(result.getTailPositions())
                    .extracting(TailPosition::getKind)
                    .containsExactly(BranchKind.MATCH_ARM, BranchKind.MATCH_ARM,
                            BranchKind.TRY_BODY, BranchKind.HANDLER_BODY);
        }

        @Test
        @DisplayName("嵌套函数和 lambda 内部的 return 不受限制")
        void testNestedReturnsAllowed() {
            TransformResult result = transform("fun outer(xs) {\n    fun helper(v) { return v * 2 }\n    val g = fun(v) { return v + 1 }\n    xs.map({ v -> return helper(g(v)) })\n}");
            assertThat(result.getTailPositions()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("结果绑定命名")
    class NamingTests {

        @Test
        @DisplayName("与参数同名时追加后缀")
        void testCollisionWithParameter() {
            assertThat(transform("fun f(__implicit_result) { __implicit_result }").getResultName())
                    .isEqualTo("__implicit_result_1");
        }

        @Test
        @DisplayName("后缀也被占用时继续递增")
        void testCollisionWithSuffix() {
            TransformResult result = transform("fun f(__implicit_result) {\n    val __implicit_result_1 = 2\n    __implicit_result + __implicit_result_1\n}");
            assertThat(result.getResultName()).isEqualTo("__implicit_result_2");
        }

        @Test
        @DisplayName("lambda 内部的名字也会避开")
        void testCollisionInsideLambda() {
            assertThat(transform("fun f(xs) { xs.map({ __implicit_result -> __implicit_result }) }").getResultName())
                    .isEqualTo("__implicit_result_1");
        }

        @Test
        @DisplayName("自定义基础名")
        void testCustomBaseName() {
            TransformResult result = new ImplicitReturnTransformer("out").transform(parse("fun f(x) { x }"));
            assertThat(result.getResultName()).isEqualTo("out");
            assertThatIllegalArgumentException().isThrownBy(() -> new ImplicitReturnTransformer(""));
        }
    }

    @Nested
    @DisplayName("定义期错误")
    class ErrorTests {

        @Test
        @DisplayName("任何位置的显式 return 都被拒绝")
        void testExplicitReturn() {
            assertThatThrownBy(() -> transform("fun f(x) {\n    if (x) {\n        return 1\n    }\n    2\n}"))
                    .isInstanceOf(ExplicitReturnDisallowedError.class)
                    .isInstanceOf(TransformationError.class)
                    .hasMessageContaining("Explicit return statements are not allowed in implicit-return function 'f'")
                    .hasMessageContaining("line 3");
        }

        @Test
        @DisplayName("循环中的 return 也被拒绝")
        void testReturnInLoop() {
            assertThatThrownBy(() -> transform("fun f(xs) {\n    for (x in xs) { return x }\n    0\n}"))
                    .isInstanceOf(ExplicitReturnDisallowedError.class);
        }

        @Test
        @DisplayName("缺少 else 的 if")
        void testMissingElse() {
            assertThatThrownBy(() -> transform("fun f(x) {\n    if (x > 0) {\n        \"pos\"\n    }\n}"))
                    .isInstanceOf(MissingImplicitReturnError.class)
                    .hasMessageContaining("Missing else branch for if statement at tail position in function 'f'");
        }

        @Test
        @DisplayName("else if 链末尾缺少 else")
        void testMissingElseInChain() {
            assertThatThrownBy(() -> transform("fun f(x) {\n    if (x > 0) { 1 } else if (x < 0) { -1 }\n}"))
                    .isInstanceOf(MissingImplicitReturnError.class);
        }

        @Test
        @DisplayName("空函数体")
        void testEmptyBody() {
            assertThatThrownBy(() -> transform("fun f() {}"))
                    .isInstanceOf(MissingImplicitReturnError.class)
                    .hasMessageContaining("Empty function body in function 'f' has no value to return");
        }

        @Test
        @DisplayName("空分支体")
        void testEmptyBranch() {
            assertThatThrownBy(() -> transform("fun f(x) { if (x) {} else { 1 } }"))
                    .isInstanceOf(MissingImplicitReturnError.class)
                    .hasMessageContaining("Empty if branch");
        }

        @Test
        @DisplayName("没有分支的 when")
        void testEmptyWhen() {
            assertThatThrownBy(() -> transform("fun f(x) {\n    when (x) {}\n}"))
                    .isInstanceOf(MissingImplicitReturnError.class)
                    .hasMessageContaining("has no branches");
        }

        @Test
        @DisplayName("尾位置的声明无法产生值")
        void testTrailingDeclaration() {
            UnsupportedConstructError e = catchThrowableOfType(
                    () -> transform("fun f(x) {\n    val y = x\n}"), UnsupportedConstructError.class);
            assertThat(e.getConstruct()).isEqualTo("val declaration");
            assertThat(e.getFunctionName()).isEqualTo("f");
            assertThat(e.getLine()).isEqualTo(2);
            assertThat(e.getColumn()).isEqualTo(5);
            assertThat(e.getMessage()).isEqualTo(
                    "Unsupported construct at tail position in function 'f': val declaration cannot produce a value (line 2, column 5)");
        }

        @Test
        @DisplayName("其他无法产生值的结构")
        void testOtherUnsupportedConstructs() {
            assertConstruct("fun f(x) {\n    x = 1\n}", "assignment");
            assertConstruct("fun f(x) {\n    while (x) { x }\n}", "while loop");
            assertConstruct("fun f(xs) {\n    for (x in xs) { x }\n}", "for loop");
            assertConstruct("fun f() {\n    fun g() { return 1 }\n}", "function definition");
            assertConstruct("fun f() {\n    import math\n}", "import statement");
            assertConstruct("fun f() {\n    global a\n}", "global declaration");
            assertConstruct("fun f(a) {\n    delete a\n}", "delete statement");
            assertConstruct("fun f() {\n    use (val r = open()) { r }\n}", "use block");
            assertConstruct("fun f(x) {\n    if (x) { 1 } else { var z = 2 }\n}", "var declaration");
        }

        private void assertConstruct(String source, String construct) {
            UnsupportedConstructError e = catchThrowableOfType(() -> transform(source), UnsupportedConstructError.class);
            assertThat(e).as(source).isNotNull();
            assertThat(e.getConstruct()).isEqualTo(construct);
        }

        @Test
        @DisplayName("错误不产生部分改写")
        void testNoPartialRewrite() {
            FunDecl decl = parse("fun f(x) {\n    if (x) { 1 } else { val y = 2 }\n}");
            assertThatThrownBy(() -> transformer.transform(decl)).isInstanceOf(UnsupportedConstructError.class);
            IfStmt ifStmt = (IfStmt) decl.getBody().getLast();
            assertThat(ifStmt.getThenBranch().getLast()).isInstanceOf(ExpressionStmt.class);
        }
    }
}
