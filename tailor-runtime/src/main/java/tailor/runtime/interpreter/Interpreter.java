package tailor.runtime.interpreter;

import com.tailor.compiler.ast.ExprVisitor;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.decl.Program;
import com.tailor.compiler.ast.expr.*;
import com.tailor.compiler.ast.stmt.*;
import com.tailor.compiler.ast.type.TypeRef;
import tailor.runtime.Arguments;
import tailor.runtime.TailorCallable;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tailor 树遍历解释器
 *
 * <p>语句访问器以当前作用域为上下文执行语句，表达式访问器求值。
 * 解释器自身不保存调用状态（调用状态全部在 {@link Environment} 帧里），
 * 同一个实例可被多个线程同时使用。</p>
 *
 * <p>脚本错误以 {@link ScriptErrorException} 传播，向外传播时补上出错位置；
 * return / break / continue 以 {@link ControlFlow} 传播，不会被脚本的 catch 捕获。</p>
 */
public final class Interpreter implements StmtVisitor<Void, Environment>, ExprVisitor<Object, Environment> {

    /**
     * 函数定义回调：fun 声明求值后、绑定名字之前调用，返回值作为最终绑定的函数
     */
    public interface DefinitionHook {
        TailorCallable onDefine(ScriptFunction function);
    }

    private final Environment globals;
    private final Map<String, ScriptModule> modules = new ConcurrentHashMap<>();
    private final DefinitionHook definitionHook;

    public Interpreter() {
        this(System.out, null);
    }

    public Interpreter(PrintStream out, DefinitionHook definitionHook) {
        this.globals = Environment.builtins();
        this.definitionHook = definitionHook;
        Builtins.install(globals, out);
        for (ScriptModule module : BuiltinModules.all()) {
            modules.put(module.getName(), module);
        }
    }

    // ============ 模块 ============

    public Environment getGlobals() {
        return globals;
    }

    /**
     * 创建以内置作用域为父作用域的模块作用域
     */
    public Environment newModuleScope(SourceUnit unit) {
        return globals.newModuleScope(unit);
    }

    /**
     * 注册可被 import 的模块
     */
    public void registerModule(ScriptModule module) {
        modules.put(module.getName(), module);
    }

    public ScriptModule findModule(String name) {
        return modules.get(name);
    }

    /**
     * 在模块作用域中执行程序的顶层语句
     */
    public void executeProgram(Program program, Environment scope) {
        try {
            executeStatements(program.getStatements(), scope);
        } catch (ControlFlow flow) {
            throw ErrorType.STATE.raise("'" + flow.keyword() + "' outside of a function");
        }
    }

    // ============ 执行入口 ============

    public void execute(Statement stmt, Environment env) {
        try {
            stmt.accept(this, env);
        } catch (TailorRuntimeException e) {
            e.attachLocation(stmt.getLocation());
            throw e;
        }
    }

    public Object evaluate(Expression expr, Environment env) {
        try {
            return expr.accept(this, env);
        } catch (TailorRuntimeException e) {
            e.attachLocation(expr.getLocation());
            throw e;
        }
    }

    private void executeStatements(List<Statement> statements, Environment env) {
        for (Statement stmt : statements) {
            execute(stmt, env);
        }
    }

    private void executeBlock(Block block, Environment env) {
        executeStatements(block.getStatements(), env.child());
    }

    // ============ 调用 ============

    /**
     * 调用脚本函数：在闭包之上创建函数帧、绑定参数、执行函数体
     */
    Object callFunction(ScriptFunction function, Arguments args) {
        FunDecl decl = function.getDeclaration();
        Environment frame = function.getClosure().newFunctionFrame(function.getSourceUnit());
        bindParameters(function.getName(), decl.getParams(), args, frame);
        try {
            executeStatements(decl.getBody().getStatements(), frame);
            return null;
        } catch (ControlFlow flow) {
            return unwindCall(flow);
        }
    }

    /**
     * 调用 lambda / 匿名函数。无参数 lambda 收到一个实参时绑定为 it。
     */
    Object callLambda(ScriptLambda lambda, Arguments args) {
        Environment frame = lambda.getClosure().newFunctionFrame(null);
        List<Parameter> params = lambda.getParams();
        if (params.isEmpty() && !lambda.isAnonymousFunction()
                && args.size() == 1 && args.keywords().isEmpty()) {
            frame.defineVal("it", args.get(0));
        } else {
            bindParameters(lambda.getName(), params, args, frame);
        }

        List<Statement> statements = lambda.getBody().getStatements();
        try {
            if (lambda.isAnonymousFunction() || statements.isEmpty()) {
                executeStatements(statements, frame);
                return null;
            }
            int last = statements.size() - 1;
            executeStatements(statements.subList(0, last), frame);
            Statement tail = statements.get(last);
            if (tail instanceof ExpressionStmt) {
                return evaluate(((ExpressionStmt) tail).getExpression(), frame);
            }
            execute(tail, frame);
            return null;
        } catch (ControlFlow flow) {
            return unwindCall(flow);
        }
    }

    private static Object unwindCall(ControlFlow flow) {
        if (flow.getType() == ControlFlow.Type.RETURN) {
            return flow.getValue();
        }
        throw ErrorType.STATE.raise("'" + flow.keyword() + "' outside of a loop");
    }

    /**
     * 参数绑定：位置参数 → 关键字参数 → 默认值。默认值在函数帧中求值，可以引用前面的参数。
     */
    private void bindParameters(String functionName, List<Parameter> params, Arguments args, Environment frame) {
        List<Object> positional = args.positional();
        if (positional.size() > params.size()) {
            throw new TailorRuntimeException("Function '" + functionName + "' expects at most "
                    + params.size() + " argument(s) but got " + positional.size());
        }
        Set<String> names = new HashSet<>();
        for (Parameter param : params) {
            names.add(param.getName());
        }
        for (String keyword : args.keywords().keySet()) {
            if (!names.contains(keyword)) {
                throw new TailorRuntimeException("Unknown keyword argument '" + keyword
                        + "' for function '" + functionName + "'");
            }
        }

        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            String name = param.getName();
            Object value;
            if (i < positional.size()) {
                if (args.hasKeyword(name)) {
                    throw new TailorRuntimeException("Argument '" + name + "' of function '" + functionName
                            + "' given both positionally and by keyword");
                }
                value = positional.get(i);
            } else if (args.hasKeyword(name)) {
                value = args.get(name);
            } else if (param.hasDefaultValue()) {
                value = evaluate(param.getDefaultValue(), frame);
            } else {
                throw new TailorRuntimeException("Missing argument '" + name + "' for function '"
                        + functionName + "'");
            }
            frame.defineVal(name, value);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Environment env) {
        executeBlock(node, env);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Environment env) {
        evaluate(node.getExpression(), env);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Environment env) {
        if (Ops.condition(evaluate(node.getCondition(), env))) {
            executeBlock(node.getThenBranch(), env);
        } else if (node.hasElse()) {
            execute(node.getElseBranch(), env);
        }
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, Environment env) {
        try {
            boolean completed = false;
            try {
                executeBlock(node.getTryBlock(), env);
                completed = true;
            } catch (ScriptErrorException e) {
                CatchClause clause = findCatchClause(node.getCatchClauses(), e.getError(), env);
                if (clause == null) {
                    throw e;
                }
                Environment scope = env.child();
                scope.defineVal(clause.getParamName(), e.getError());
                executeBlock(clause.getBody(), scope);
            }
            // else 块不受本 try 的 catch 保护
            if (completed && node.hasElse()) {
                executeBlock(node.getElseBlock(), env);
            }
        } finally {
            if (node.hasFinally()) {
                executeBlock(node.getFinallyBlock(), env);
            }
        }
        return null;
    }

    private CatchClause findCatchClause(List<CatchClause> clauses, ScriptError error, Environment env) {
        for (CatchClause clause : clauses) {
            if (clause.getParamType() == null) return clause;
            ErrorType type = resolveErrorType(clause.getParamType(), env);
            if (error.getType().isSubtypeOf(type)) return clause;
        }
        return null;
    }

    private ErrorType resolveErrorType(TypeRef typeRef, Environment env) {
        String name = typeRef.getName();
        Binding binding = env.lookup(name);
        if (binding == null) {
            throw ErrorType.NAME.raise("Unknown error type: " + name);
        }
        Object value = binding.get();
        if (!(value instanceof ErrorType)) {
            throw ErrorType.TYPE.raise("'" + name + "' is not an error type");
        }
        return (ErrorType) value;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, Environment env) {
        boolean hasSubject = node.hasSubject();
        Object subject = hasSubject ? evaluate(node.getSubject(), env) : null;
        for (WhenBranch branch : node.getBranches()) {
            if (branch.isElse() || branchMatches(branch, hasSubject, subject, env)) {
                executeBlock(branch.getBody(), env);
                return null;
            }
        }
        // 没有分支匹配：什么也不执行
        return null;
    }

    private boolean branchMatches(WhenBranch branch, boolean hasSubject, Object subject, Environment env) {
        for (WhenBranch.WhenCondition condition : branch.getConditions()) {
            boolean matched;
            if (condition.getKind() == WhenBranch.ConditionKind.TYPE) {
                if (!hasSubject) {
                    throw ErrorType.TYPE.raise("Type condition requires a when subject");
                }
                matched = isInstance(subject, condition.getType(), env) != condition.isNegated();
            } else if (hasSubject) {
                matched = Ops.valueEquals(subject, evaluate(condition.getValue(), env));
            } else {
                matched = Ops.condition(evaluate(condition.getValue(), env));
            }
            if (matched) return true;
        }
        return false;
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, Environment env) {
        FunDecl decl = node.getDeclaration();
        ScriptFunction function = new ScriptFunction(decl, env, this, env.getSourceUnit());
        TailorCallable value = definitionHook != null ? definitionHook.onDefine(function) : function;
        env.defineVal(decl.getName(), value);
        return null;
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, Environment env) {
        if (node.getInitializer() == null) {
            env.declareUnassigned(node.getName());
            return null;
        }
        env.define(node.getName(), evaluate(node.getInitializer(), env), node.isMutable());
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Environment env) {
        Expression target = node.getTarget();
        AssignStmt.AssignOp op = node.getOperator();

        if (target instanceof Identifier) {
            String name = ((Identifier) target).getName();
            Object value = evaluate(node.getValue(), env);
            if (op.isCompound()) {
                value = Ops.binary(compoundOperator(op), env.get(name), value);
            }
            env.assign(name, value);
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            Object object = evaluate(member.getTarget(), env);
            Object value = evaluate(node.getValue(), env);
            if (op.isCompound()) {
                value = Ops.binary(compoundOperator(op), MemberResolver.get(object, member.getMember()), value);
            }
            MemberResolver.set(object, member.getMember(), value);
        } else if (target instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) target;
            Object object = evaluate(index.getTarget(), env);
            Object key = evaluate(index.getIndex(), env);
            Object value = evaluate(node.getValue(), env);
            if (op.isCompound()) {
                value = Ops.binary(compoundOperator(op), Ops.index(object, key), value);
            }
            Ops.setIndex(object, key, value);
        } else {
            throw ErrorType.TYPE.raise("Invalid assignment target");
        }
        return null;
    }

    private static BinaryExpr.BinaryOp compoundOperator(AssignStmt.AssignOp op) {
        switch (op) {
            case ADD_ASSIGN: return BinaryExpr.BinaryOp.ADD;
            case SUB_ASSIGN: return BinaryExpr.BinaryOp.SUB;
            case MUL_ASSIGN: return BinaryExpr.BinaryOp.MUL;
            case DIV_ASSIGN: return BinaryExpr.BinaryOp.DIV;
            case MOD_ASSIGN: return BinaryExpr.BinaryOp.MOD;
            default:
                throw new IllegalArgumentException("Not a compound operator: " + op);
        }
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Environment env) {
        while (Ops.condition(evaluate(node.getCondition(), env))) {
            try {
                executeBlock(node.getBody(), env);
            } catch (ControlFlow flow) {
                if (flow.getType() == ControlFlow.Type.BREAK) break;
                if (flow.getType() != ControlFlow.Type.CONTINUE) throw flow;
            }
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Environment env) {
        for (Object item : iterate(evaluate(node.getIterable(), env))) {
            Environment scope = env.child();
            scope.defineVal(node.getVariable(), item);
            try {
                executeStatements(node.getBody().getStatements(), scope);
            } catch (ControlFlow flow) {
                if (flow.getType() == ControlFlow.Type.BREAK) break;
                if (flow.getType() != ControlFlow.Type.CONTINUE) throw flow;
            }
        }
        return null;
    }

    /** 迭代快照，循环体修改原列表不影响本次迭代 */
    private static List<Object> iterate(Object iterable) {
        if (iterable instanceof List) {
            return new ArrayList<>((List<?>) iterable);
        }
        if (iterable instanceof String) {
            String s = (String) iterable;
            List<Object> chars = new ArrayList<>(s.length());
            for (int i = 0; i < s.length(); i++) {
                chars.add(s.substring(i, i + 1));
            }
            return chars;
        }
        if (iterable instanceof Map) {
            return new ArrayList<>(((Map<?, ?>) iterable).keySet());
        }
        throw ErrorType.TYPE.raise("'" + Ops.typeName(iterable) + "' is not iterable");
    }

    @Override
    public Void visitUseStmt(UseStmt node, Environment env) {
        Environment scope = env.child();
        List<AutoCloseable> resources = new ArrayList<>();
        try {
            for (UseStmt.UseBinding binding : node.getBindings()) {
                Object resource = evaluate(binding.getInitializer(), scope);
                if (resource != null && !(resource instanceof AutoCloseable)) {
                    throw ErrorType.TYPE.raise("use requires a closeable resource, not " + Ops.typeName(resource));
                }
                scope.defineVal(binding.getName(), resource);
                if (resource != null) {
                    resources.add((AutoCloseable) resource);
                }
            }
            executeBlock(node.getBody(), scope);
        } finally {
            closeAll(resources);
        }
        return null;
    }

    /** 逆序关闭资源 */
    private static void closeAll(List<AutoCloseable> resources) {
        for (int i = resources.size() - 1; i >= 0; i--) {
            try {
                resources.get(i).close();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw ErrorType.ERROR.raise("Failed to close resource: " + e.getMessage());
            }
        }
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Environment env) {
        throw ControlFlow.breakLoop();
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Environment env) {
        throw ControlFlow.continueLoop();
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, Environment env) {
        env.delete(node.getName());
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, Environment env) {
        ScriptModule module = modules.get(node.getModuleName());
        if (module == null) {
            throw ErrorType.NAME.raise("No module named '" + node.getModuleName() + "'");
        }
        env.defineVal(node.getBoundName(), module);
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, Environment env) {
        for (String name : node.getNames()) {
            env.declareGlobal(name);
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Environment env) {
        Object value = node.getValue() != null ? evaluate(node.getValue(), env) : null;
        throw ControlFlow.returnValue(value);
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, Environment env) {
        Object value = evaluate(node.getException(), env);
        if (value instanceof ScriptError) {
            throw new ScriptErrorException((ScriptError) value, node.getLocation());
        }
        if (value instanceof ErrorType) {
            throw new ScriptErrorException(((ErrorType) value).create(""), node.getLocation());
        }
        throw ErrorType.TYPE.raise("Can only throw error values, not " + Ops.typeName(value));
    }

    // ============ 表达式 ============

    @Override
    public Object visitLiteral(Literal node, Environment env) {
        return node.getValue();
    }

    @Override
    public Object visitIdentifier(Identifier node, Environment env) {
        return env.get(node.getName());
    }

    @Override
    public Object visitUnaryExpr(UnaryExpr node, Environment env) {
        Object operand = evaluate(node.getOperand(), env);
        switch (node.getOperator()) {
            case NEG: return Ops.negate(operand);
            case POS: return Ops.plus(operand);
            default: return Ops.not(operand);
        }
    }

    @Override
    public Object visitBinaryExpr(BinaryExpr node, Environment env) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op == BinaryExpr.BinaryOp.AND) {
            return Ops.condition(evaluate(node.getLeft(), env)) && Ops.condition(evaluate(node.getRight(), env));
        }
        if (op == BinaryExpr.BinaryOp.OR) {
            return Ops.condition(evaluate(node.getLeft(), env)) || Ops.condition(evaluate(node.getRight(), env));
        }
        Object left = evaluate(node.getLeft(), env);
        Object right = evaluate(node.getRight(), env);
        return Ops.binary(op, left, right);
    }

    @Override
    public Object visitTypeCheckExpr(TypeCheckExpr node, Environment env) {
        boolean result = isInstance(evaluate(node.getOperand(), env), node.getTargetType(), env);
        return node.isNegated() != result;
    }

    /**
     * is 判断：内置类型名，或作用域中的错误类型（匹配其子类型）
     */
    private boolean isInstance(Object value, TypeRef type, Environment env) {
        if (value == null && type.isNullable()) return true;
        Boolean builtin = Ops.isBuiltinInstance(value, type.getName());
        if (builtin != null) return builtin;
        ErrorType errorType = resolveErrorType(type, env);
        return value instanceof ScriptError && ((ScriptError) value).getType().isSubtypeOf(errorType);
    }

    @Override
    public Object visitCallExpr(CallExpr node, Environment env) {
        Object callee = evaluate(node.getCallee(), env);
        Arguments.Builder builder = Arguments.builder();
        for (CallExpr.Argument arg : node.getArgs()) {
            Object value = evaluate(arg.getValue(), env);
            if (arg.isNamed()) {
                builder.put(arg.getName(), value);
            } else {
                builder.add(value);
            }
        }
        if (!(callee instanceof TailorCallable)) {
            throw ErrorType.TYPE.raise("'" + Ops.typeName(callee) + "' is not callable");
        }
        return ((TailorCallable) callee).call(builder.build());
    }

    @Override
    public Object visitMemberExpr(MemberExpr node, Environment env) {
        return MemberResolver.get(evaluate(node.getTarget(), env), node.getMember());
    }

    @Override
    public Object visitIndexExpr(IndexExpr node, Environment env) {
        Object target = evaluate(node.getTarget(), env);
        return Ops.index(target, evaluate(node.getIndex(), env));
    }

    @Override
    public Object visitListLiteral(ListLiteral node, Environment env) {
        List<Object> list = new ArrayList<>(node.getElements().size());
        for (Expression element : node.getElements()) {
            list.add(evaluate(element, env));
        }
        return list;
    }

    @Override
    public Object visitStringInterpolation(StringInterpolation node, Environment env) {
        StringBuilder sb = new StringBuilder();
        for (Expression part : node.getParts()) {
            sb.append(Ops.stringify(evaluate(part, env)));
        }
        return sb.toString();
    }

    @Override
    public Object visitLambdaExpr(LambdaExpr node, Environment env) {
        return new ScriptLambda(node.getParams(), node.getBody(), env, this, false);
    }

    @Override
    public Object visitFunExpr(FunExpr node, Environment env) {
        return new ScriptLambda(node.getParams(), node.getBody(), env, this, true);
    }
}
