package tailor.runtime;

import com.tailor.compiler.ast.decl.Program;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.parser.Parser;
import tailor.runtime.interpreter.Environment;
import tailor.runtime.interpreter.Interpreter;
import tailor.runtime.interpreter.ScriptFunction;
import tailor.runtime.interpreter.ScriptModule;
import tailor.runtime.interpreter.SourceUnit;
import tailor.runtime.materialize.EngineOptions;
import tailor.runtime.materialize.FunctionMaterializer;

import java.util.logging.Logger;

/**
 * 模块加载器：解析源码、在新的模块作用域中执行顶层语句
 *
 * <p>带 {@code @implicitReturn} 注解的函数在定义时立即改写，
 * 定义期错误（显式 return、缺少 else 等）在加载时抛出。</p>
 */
public final class ModuleLoader {
    private static final Logger LOG = Logger.getLogger(ModuleLoader.class.getName());

    /** 触发定义期改写的注解名 */
    public static final String IMPLICIT_RETURN_ANNOTATION = "implicitReturn";

    private final Interpreter interpreter;
    private final FunctionMaterializer materializer;

    public ModuleLoader() {
        this(EngineOptions.defaults());
    }

    public ModuleLoader(EngineOptions options) {
        this.interpreter = new Interpreter(options.getOutput(), this::onDefine);
        this.materializer = new FunctionMaterializer(options, interpreter);
    }

    /**
     * 加载模块
     *
     * @param fileName 用于错误位置；去掉目录和扩展名后作为模块名
     * @throws com.tailor.compiler.parser.ParseException 源码无法解析
     * @throws com.tailor.compiler.transform.TransformationError 隐式返回函数不合法
     */
    public ScriptModule load(String source, String fileName) {
        SourceUnit unit = new SourceUnit(source, fileName);
        Program program = new Parser(new Lexer(source, unit.getFileName()), unit.getFileName()).parse();
        Environment scope = interpreter.newModuleScope(unit);
        ScriptModule module = new ScriptModule(moduleName(unit.getFileName()), scope, unit);
        interpreter.executeProgram(program, scope);
        LOG.fine("Loaded module '" + module.getName() + "' (" + module.names().size() + " definitions)");
        return module;
    }

    public ScriptModule load(String source) {
        return load(source, "<script>");
    }

    /**
     * 让其他模块可以 import 该模块
     */
    public void register(ScriptModule module) {
        interpreter.registerModule(module);
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public FunctionMaterializer getMaterializer() {
        return materializer;
    }

    private TailorCallable onDefine(ScriptFunction function) {
        if (!function.getDeclaration().hasAnnotation(IMPLICIT_RETURN_ANNOTATION)) {
            return function;
        }
        return materializer.materialize(function);
    }

    static String moduleName(String fileName) {
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return name;
    }
}
