package tailor.runtime.interpreter;

import com.tailor.compiler.ast.decl.Annotation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.type.TypeRef;
import com.tailor.compiler.formatter.TailorFormatter;
import tailor.runtime.Arguments;
import tailor.runtime.FunctionSignature;
import tailor.runtime.FunctionSource;
import tailor.runtime.ParameterInfo;
import tailor.runtime.TailorCallable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 脚本中用 fun 定义的函数
 *
 * <p>记录自己的定义（AST）、定义处的作用域（闭包）以及定义在源码中的原文片段。
 * 经过隐式返回改写的函数另外记录改写后的源码和结果绑定名。</p>
 *
 * <p>不可变；每次调用创建新的函数帧，可被多个线程同时调用。</p>
 */
public final class ScriptFunction implements TailorCallable {

    private static final TailorFormatter FORMATTER = new TailorFormatter();

    private final FunDecl declaration;
    private final Environment closure;
    private final Interpreter interpreter;
    private final SourceUnit unit;
    private final FunctionSignature signature;
    private final String documentation;
    private final List<String> annotations;
    private final FunctionSource source;  // 可选
    private final String rewrittenSource;  // 仅改写后的函数
    private final String resultName;       // 仅改写后的函数

    public ScriptFunction(FunDecl declaration, Environment closure, Interpreter interpreter, SourceUnit unit) {
        this(declaration, closure, interpreter, unit,
                declaration.getDocumentation(),
                annotationNames(declaration),
                sourceOf(declaration, unit),
                null, null);
    }

    private ScriptFunction(FunDecl declaration, Environment closure, Interpreter interpreter, SourceUnit unit,
                           String documentation, List<String> annotations, FunctionSource source,
                           String rewrittenSource, String resultName) {
        this.declaration = declaration;
        this.closure = closure;
        this.interpreter = interpreter;
        this.unit = unit;
        this.signature = signatureOf(declaration.getName(), declaration.getParams(), declaration.getReturnType());
        this.documentation = documentation;
        this.annotations = annotations;
        this.source = source;
        this.rewrittenSource = rewrittenSource;
        this.resultName = resultName;
    }

    /**
     * 由改写后的定义构造新函数。名称、签名来自改写后的定义（与原定义一致），
     * 文档、注解和原始源码沿用 original。
     *
     * @param rewritten       改写后的定义
     * @param closure         原函数定义处的作用域
     * @param unit            改写时解析的源码（定义自身的片段）
     * @param original        被改写的函数
     * @param rewrittenSource 改写后的源码文本
     * @param resultName      结果绑定名
     */
    public static ScriptFunction materialized(FunDecl rewritten, Environment closure, Interpreter interpreter,
                                              SourceUnit unit, TailorCallable original,
                                              String rewrittenSource, String resultName) {
        return new ScriptFunction(rewritten, closure, interpreter, unit,
                original.getDocumentation(),
                Collections.unmodifiableList(new ArrayList<>(original.getAnnotations())),
                original.getSource().orElse(null),
                rewrittenSource, resultName);
    }

    @Override
    public String getName() {
        return declaration.getName();
    }

    @Override
    public Object call(Arguments args) {
        return interpreter.callFunction(this, args);
    }

    @Override
    public FunctionSignature getSignature() {
        return signature;
    }

    @Override
    public String getDocumentation() {
        return documentation;
    }

    @Override
    public List<String> getAnnotations() {
        return annotations;
    }

    @Override
    public Optional<FunctionSource> getSource() {
        return Optional.ofNullable(source);
    }

    public FunDecl getDeclaration() {
        return declaration;
    }

    public Environment getClosure() {
        return closure;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    SourceUnit getSourceUnit() {
        return unit;
    }

    /**
     * 是否是隐式返回改写的产物
     */
    public boolean isMaterialized() {
        return rewrittenSource != null;
    }

    /**
     * 改写后的源码，未改写时为空
     */
    public Optional<String> getRewrittenSource() {
        return Optional.ofNullable(rewrittenSource);
    }

    /**
     * 结果绑定名，未改写时为空
     */
    public Optional<String> getResultName() {
        return Optional.ofNullable(resultName);
    }

    @Override
    public String toString() {
        return "<fun " + getName() + ">";
    }

    // ============ 元数据 ============

    static FunctionSignature signatureOf(String name, List<Parameter> params, TypeRef returnType) {
        List<ParameterInfo> infos = new ArrayList<>();
        for (Parameter param : params) {
            infos.add(new ParameterInfo(param.getName(),
                    param.getType() != null ? param.getType().toSourceString() : null,
                    param.hasDefaultValue() ? FORMATTER.format(param.getDefaultValue()) : null));
        }
        return new FunctionSignature(name, infos, returnType != null ? returnType.toSourceString() : null);
    }

    private static List<String> annotationNames(FunDecl declaration) {
        List<String> names = new ArrayList<>();
        for (Annotation annotation : declaration.getAnnotations()) {
            names.add(annotation.getName());
        }
        return Collections.unmodifiableList(names);
    }

    /** 从所属源码中截取定义原文；首行号从 fun 关键字所在行倒推 */
    private static FunctionSource sourceOf(FunDecl declaration, SourceUnit unit) {
        if (unit == null) return null;
        int start = declaration.getSourceStart();
        int end = declaration.getSourceEnd();
        if (start < 0 || start >= end || end > unit.getText().length()) return null;
        int funOffset = declaration.getLocation().getOffset();
        int firstLine = declaration.getLocation().getLine() - unit.countNewlines(start, funOffset);
        return new FunctionSource(unit.slice(start, end), unit.getFileName(), firstLine);
    }
}
