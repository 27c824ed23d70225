package com.tailor.compiler.parser;

import com.tailor.compiler.ast.decl.*;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.ast.stmt.*;
import com.tailor.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        Lexer lexer = new Lexer(source, "<test>");
        Parser parser = new Parser(lexer, "<test>");
        return parser.parse();
    }

    private FunDecl fun(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseFunctionDefinition();
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneExpression();
    }

    /** 解析函数并返回函数体语句 */
    private List<Statement> body(String source) {
        return fun(source).getBody().getStatements();
    }

    // ============ 函数定义 ============

    @Nested
    @DisplayName("函数定义")
    class FunctionDefinitionTests {

        @Test
        @DisplayName("参数、默认值与返回类型")
        void testSignature() {
            FunDecl decl = fun("fun area(w: Double, h: Double = 1.0): Double { w * h }");
            assertEquals("area", decl.getName());
            assertEquals(2, decl.getParams().size());
            assertEquals("Double", decl.getParams().get(0).getType().getName());
            assertTrue(decl.getParams().get(1).hasDefaultValue());
            assertEquals("Double", decl.getReturnType().getName());
            assertEquals(1, decl.getBody().getStatements().size());
        }

        @Test
        @DisplayName("可空类型")
        void testNullableType() {
            FunDecl decl = fun("fun f(x: String?) { x }");
            assertTrue(decl.getParams().get(0).getType().isNullable());
            assertEquals("String?", decl.getParams().get(0).getType().toSourceString());
        }

        @Test
        @DisplayName("文档注释与注解")
        void testDocAndAnnotations() {
            FunDecl decl = fun("/** Greets someone. */\n@implicitReturn\n@guard(name = \"x\", 2)\nfun greet(name) { \"hi\" }");
            assertEquals("Greets someone.", decl.getDocComment());
            assertEquals("Greets someone.", decl.getDocumentation());
            assertEquals(2, decl.getAnnotations().size());
            assertTrue(decl.hasAnnotation("implicitReturn"));
            Annotation guard = decl.getAnnotations().get(1);
            assertEquals(2, guard.getArgs().size());
            assertTrue(guard.getArgs().get(0).isNamed());
            assertEquals("name", guard.getArgs().get(0).getName());
        }

        @Test
        @DisplayName("函数体开头的字符串字面量作为文档")
        void testDocstring() {
            FunDecl decl = fun("fun f() {\n    \"Computes things.\"\n    42\n}");
            assertNull(decl.getDocComment());
            assertEquals("Computes things.", decl.getDocumentation());
        }

        @Test
        @DisplayName("只有一个字符串的函数体不是文档")
        void testSingleStringIsNotDocstring() {
            assertNull(fun("fun f() { \"value\" }").getDocumentation());
        }

        @Test
        @DisplayName("源码区间覆盖注解和整个函数体")
        void testSourceRange() {
            String source = "  @implicitReturn\nfun f() { 1 }\n";
            FunDecl decl = fun(source);
            assertEquals("@implicitReturn\nfun f() { 1 }",
                    source.substring(decl.getSourceStart(), decl.getSourceEnd()));
        }

        @Test
        @DisplayName("函数位置指向 fun 关键字")
        void testLocation() {
            FunDecl decl = fun("@a\nfun f() { 1 }");
            assertEquals(2, decl.getLocation().getLine());
            assertEquals(1, decl.getLocation().getColumn());
        }

        @Test
        @DisplayName("重复参数名报错")
        void testDuplicateParam() {
            ParseException e = assertThrows(ParseException.class, () -> fun("fun f(a, a) { a }"));
            assertTrue(e.getMessage().contains("Duplicate parameter name 'a'"));
        }

        @Test
        @DisplayName("函数定义之后不允许其他内容")
        void testTrailingContent() {
            ParseException e = assertThrows(ParseException.class,
                    () -> fun("fun f() { 1 }\nfun g() { 2 }"));
            assertTrue(e.getMessage().contains("Unexpected content after function definition"));
        }

        @Test
        @DisplayName("不是函数定义")
        void testNotAFunction() {
            assertThrows(ParseException.class, () -> fun("val x = 1"));
        }

        @Test
        @DisplayName("模块中的多个函数")
        void testProgramFunctions() {
            Program program = parse("fun a() { 1 }\n\nval x = 2\n\nfun b() { 3 }\n");
            assertEquals(3, program.getStatements().size());
            assertEquals(2, program.getFunctions().size());
            assertEquals("b", program.getFunctions().get(1).getName());
        }
    }

    // ============ 控制流语句 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / else if / else")
        void testElseIfChain() {
            List<Statement> stmts = body("fun f(x) {\n    if (x > 0) {\n        1\n    } else if (x < 0) {\n        -1\n    } else {\n        0\n    }\n}");
            IfStmt ifStmt = (IfStmt) stmts.get(0);
            assertTrue(ifStmt.getElseBranch() instanceof IfStmt);
            IfStmt nested = (IfStmt) ifStmt.getElseBranch();
            assertTrue(nested.getElseBranch() instanceof Block);
        }

        @Test
        @DisplayName("else 在下一行")
        void testElseOnNextLine() {
            List<Statement> stmts = body("fun f(x) {\n    if (x) {\n        1\n    }\n    else {\n        2\n    }\n}");
            assertEquals(1, stmts.size());
            assertTrue(((IfStmt) stmts.get(0)).hasElse());
        }

        @Test
        @DisplayName("单行 if 表达式形式")
        void testSingleLineIf() {
            IfStmt ifStmt = (IfStmt) body("fun f(x) { if (x) \"a\" else \"b\" }").get(0);
            assertTrue(ifStmt.getThenBranch().getLast() instanceof ExpressionStmt);
            assertTrue(((Block) ifStmt.getElseBranch()).getLast() instanceof ExpressionStmt);
        }

        @Test
        @DisplayName("没有 else 的 if 之后继续解析")
        void testIfWithoutElse() {
            List<Statement> stmts = body("fun f(x) {\n    if (x) { print(x) }\n    2\n}");
            assertEquals(2, stmts.size());
            assertFalse(((IfStmt) stmts.get(0)).hasElse());
        }

        @Test
        @DisplayName("when：类型条件、多值条件与 else")
        void testWhenWithSubject() {
            WhenStmt when = (WhenStmt) body("fun f(x) {\n    when (x) {\n        is Int -> \"int\"\n        !is String, null -> \"other\"\n        1, 2 -> \"small\"\n        else -> { \"default\" }\n    }\n}").get(0);
            assertTrue(when.hasSubject());
            assertEquals(4, when.getBranches().size());

            WhenBranch.WhenCondition isInt = when.getBranches().get(0).getConditions().get(0);
            assertEquals(WhenBranch.ConditionKind.TYPE, isInt.getKind());
            assertFalse(isInt.isNegated());
            assertEquals("Int", isInt.getType().getName());

            List<WhenBranch.WhenCondition> second = when.getBranches().get(1).getConditions();
            assertTrue(second.get(0).isNegated());
            assertEquals(WhenBranch.ConditionKind.VALUE, second.get(1).getKind());

            assertEquals(2, when.getBranches().get(2).getConditions().size());
            assertTrue(when.getBranches().get(3).isElse());
            assertTrue(when.hasElse());
        }

        @Test
        @DisplayName("无主语 when")
        void testWhenWithoutSubject() {
            WhenStmt when = (WhenStmt) body("fun f(x) {\n    when {\n        x > 0 -> 1\n        else -> 0\n    }\n}").get(0);
            assertFalse(when.hasSubject());
            assertTrue(when.getBranches().get(0).getConditions().get(0).getValue() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("try / catch / else / finally")
        void testTryFull() {
            TryStmt tryStmt = (TryStmt) body("fun f() {\n    try {\n        risky()\n    } catch (e: ValueError) {\n        1\n    } catch (e) {\n        2\n    } else {\n        3\n    } finally {\n        cleanup()\n    }\n}").get(0);
            assertEquals(2, tryStmt.getCatchClauses().size());
            assertEquals("ValueError", tryStmt.getCatchClauses().get(0).getParamType().getName());
            assertNull(tryStmt.getCatchClauses().get(1).getParamType());
            assertTrue(tryStmt.hasElse());
            assertTrue(tryStmt.hasFinally());
        }

        @Test
        @DisplayName("try 必须有 catch 或 finally")
        void testTryWithoutHandlers() {
            ParseException e = assertThrows(ParseException.class, () -> fun("fun f() {\n    try { 1 }\n    2\n}"));
            assertTrue(e.getMessage().contains("'try' requires at least one 'catch' or a 'finally' block"));
        }

        @Test
        @DisplayName("for / while / break / continue")
        void testLoops() {
            List<Statement> stmts = body("fun f(xs) {\n    for (x in xs) {\n        if (x) { continue }\n        break\n    }\n    while (true) { break }\n    0\n}");
            assertTrue(stmts.get(0) instanceof ForStmt);
            assertEquals("x", ((ForStmt) stmts.get(0)).getVariable());
            assertTrue(stmts.get(1) instanceof WhileStmt);
        }

        @Test
        @DisplayName("use / import / global / delete")
        void testMiscStatements() {
            List<Statement> stmts = body("fun f() {\n    import math as m\n    import text.format\n    global counter, total\n    delete counter\n    use (val r = open(), val s = open()) { r }\n    0\n}");
            ImportStmt alias = (ImportStmt) stmts.get(0);
            assertEquals("math", alias.getModuleName());
            assertEquals("m", alias.getBoundName());
            assertEquals("format", ((ImportStmt) stmts.get(1)).getBoundName());
            assertEquals(2, ((GlobalStmt) stmts.get(2)).getNames().size());
            assertEquals("counter", ((DeleteStmt) stmts.get(3)).getName());
            assertEquals(2, ((UseStmt) stmts.get(4)).getBindings().size());
        }

        @Test
        @DisplayName("return 与 throw")
        void testReturnAndThrow() {
            List<Statement> stmts = body("fun f(x) {\n    if (x) { return }\n    throw ValueError(\"bad\")\n}");
            IfStmt ifStmt = (IfStmt) stmts.get(0);
            assertNull(((ReturnStmt) ifStmt.getThenBranch().getLast()).getValue());
            assertTrue(stmts.get(1) instanceof ThrowStmt);
        }
    }

    // ============ 声明与赋值 ============

    @Nested
    @DisplayName("声明与赋值")
    class DeclarationTests {

        @Test
        @DisplayName("val / var 声明")
        void testLocalVariables() {
            List<Statement> stmts = body("fun f() {\n    val a: Int = 1\n    var b\n    a\n}");
            PropertyStmt a = (PropertyStmt) stmts.get(0);
            assertFalse(a.isMutable());
            assertEquals("Int", a.getType().getName());
            PropertyStmt b = (PropertyStmt) stmts.get(1);
            assertTrue(b.isMutable());
            assertNull(b.getInitializer());
        }

        @Test
        @DisplayName("val 必须有初始值")
        void testValWithoutInitializer() {
            ParseException e = assertThrows(ParseException.class, () -> fun("fun f() {\n    val a\n    1\n}"));
            assertTrue(e.getMessage().contains("'val' declaration requires an initializer"));
        }

        @Test
        @DisplayName("赋值与复合赋值")
        void testAssignments() {
            List<Statement> stmts = body("fun f(p) {\n    x = 1\n    x += 2\n    p.name = \"n\"\n    p[0] %= 3\n    x\n}");
            assertEquals(AssignStmt.AssignOp.ASSIGN, ((AssignStmt) stmts.get(0)).getOperator());
            assertEquals(AssignStmt.AssignOp.ADD_ASSIGN, ((AssignStmt) stmts.get(1)).getOperator());
            assertTrue(((AssignStmt) stmts.get(2)).getTarget() instanceof MemberExpr);
            assertTrue(((AssignStmt) stmts.get(3)).getTarget() instanceof IndexExpr);
        }

        @Test
        @DisplayName("非法赋值目标")
        void testInvalidAssignmentTarget() {
            ParseException e = assertThrows(ParseException.class, () -> fun("fun f() {\n    1 = 2\n}"));
            assertTrue(e.getMessage().contains("Invalid assignment target"));
        }

        @Test
        @DisplayName("嵌套函数声明")
        void testNestedFunction() {
            List<Statement> stmts = body("fun outer() {\n    fun inner(y) { return y }\n    inner(1)\n}");
            assertTrue(stmts.get(0) instanceof FunDeclStmt);
            assertEquals("inner", ((FunDeclStmt) stmts.get(0)).getDeclaration().getName());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmeticPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("&& 优先于 ||")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) expr("a || b && c");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("括号改变结合")
        void testParentheses() {
            BinaryExpr mul = (BinaryExpr) expr("(1 + 2) * 3");
            assertEquals(BinaryExpr.BinaryOp.MUL, mul.getOperator());
            assertTrue(mul.getLeft() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("一元运算绑定到后缀表达式")
        void testUnary() {
            UnaryExpr neg = (UnaryExpr) expr("-x.size");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertTrue(neg.getOperand() instanceof MemberExpr);
        }

        @Test
        @DisplayName("is / !is / in")
        void testTypeCheckAndIn() {
            TypeCheckExpr check = (TypeCheckExpr) expr("x !is Int");
            assertTrue(check.isNegated());
            assertEquals("Int", check.getTargetType().getName());
            assertEquals(BinaryExpr.BinaryOp.IN, ((BinaryExpr) expr("a in xs")).getOperator());
        }

        @Test
        @DisplayName("命名参数调用")
        void testNamedArguments() {
            CallExpr call = (CallExpr) expr("f(1, key = 2)");
            assertEquals(2, call.getArgs().size());
            assertFalse(call.getArgs().get(0).isNamed());
            assertEquals("key", call.getArgs().get(1).getName());
        }

        @Test
        @DisplayName("跨行的参数列表和方法链")
        void testMultilineContinuation() {
            List<Statement> stmts = body("fun f(s) {\n    g(\n        1,\n        2\n    )\n    s\n        .trim()\n        .size\n}");
            assertEquals(2, stmts.size());
            Expression chain = ((ExpressionStmt) stmts.get(1)).getExpression();
            assertTrue(chain instanceof MemberExpr);
            assertEquals("size", ((MemberExpr) chain).getMember());
        }

        @Test
        @DisplayName("索引与列表字面量")
        void testIndexAndList() {
            IndexExpr index = (IndexExpr) expr("[1, 2,\n 3][0]");
            assertEquals(3, ((ListLiteral) index.getTarget()).getElements().size());
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertEquals("a\tb", ((Literal) expr("\"a\\tb\"")).getValue());
            assertEquals("cost $5", ((Literal) expr("\"cost \\$5\"")).getValue());
        }

        @Test
        @DisplayName("字符串插值")
        void testStringInterpolation() {
            StringInterpolation interp = (StringInterpolation) expr("\"Hi $name, ${a + 1}!\"");
            List<Expression> parts = interp.getParts();
            assertEquals(5, parts.size());
            assertEquals("Hi ", ((Literal) parts.get(0)).getValue());
            assertEquals("name", ((Identifier) parts.get(1)).getName());
            assertTrue(parts.get(3) instanceof BinaryExpr);
            assertEquals("!", ((Literal) parts.get(4)).getValue());
        }

        @Test
        @DisplayName("非法插值表达式")
        void testInvalidInterpolation() {
            ParseException e = assertThrows(ParseException.class, () -> expr("\"${1 +}\""));
            assertTrue(e.getMessage().contains("Invalid expression in string template"));
        }

        @Test
        @DisplayName("lambda 参数")
        void testLambda() {
            LambdaExpr twoParams = (LambdaExpr) expr("{ a, b -> a + b }");
            assertEquals(2, twoParams.getParams().size());
            LambdaExpr typed = (LambdaExpr) expr("{ x: Int -> x }");
            assertEquals("Int", typed.getParams().get(0).getType().getName());
            LambdaExpr noParams = (LambdaExpr) expr("{ it * 2 }");
            assertTrue(noParams.getParams().isEmpty());
            assertEquals(1, noParams.getBody().getStatements().size());
        }

        @Test
        @DisplayName("匿名函数")
        void testFunExpr() {
            FunExpr fn = (FunExpr) expr("fun(x) { return x }");
            assertEquals(1, fn.getParams().size());
            assertTrue(fn.getBody().getLast() instanceof ReturnStmt);
        }

        @Test
        @DisplayName("词法错误以 ParseException 报告")
        void testLexerErrorSurfaces() {
            ParseException e = assertThrows(ParseException.class, () -> expr("a & b"));
            assertTrue(e.getMessage().contains("Lexer error"));
            assertEquals(1, e.getLine());
        }
    }
}
