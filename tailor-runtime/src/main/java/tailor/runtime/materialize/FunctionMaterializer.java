package tailor.runtime.materialize;

import com.tailor.compiler.ast.decl.Annotation;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.formatter.TailorFormatter;
import com.tailor.compiler.lexer.Lexer;
import com.tailor.compiler.parser.Parser;
import com.tailor.compiler.transform.ImplicitReturnTransformer;
import com.tailor.compiler.transform.SourceUnavailableError;
import com.tailor.compiler.transform.TransformResult;
import tailor.runtime.FunctionSource;
import tailor.runtime.TailorCallable;
import tailor.runtime.cache.BoundedCache;
import tailor.runtime.cache.CacheStats;
import tailor.runtime.cache.CaffeineCache;
import tailor.runtime.interpreter.Environment;
import tailor.runtime.interpreter.Interpreter;
import tailor.runtime.interpreter.ScriptFunction;
import tailor.runtime.interpreter.SourceUnit;

import java.util.Collections;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * 绑定与物化：取回函数的定义源码，解析、去掉注解、做隐式返回改写，
 * 再以原函数定义处的作用域为闭包构造新函数。
 *
 * <p>改写结果按源码缓存。改写是确定性的，相同源码总得到相同的定义；
 * 失败（解析错误、改写错误）不进缓存，下次重新尝试。</p>
 */
public final class FunctionMaterializer {
    private static final Logger LOG = Logger.getLogger(FunctionMaterializer.class.getName());

    private final EngineOptions options;
    private final Interpreter interpreter;
    private final ImplicitReturnTransformer transformer;
    private final TailorFormatter formatter = new TailorFormatter();
    private final BoundedCache<FunctionSource, MaterializedDefinition> cache;  // 缓存大小为 0 时为 null

    /**
     * @param interpreter 没有闭包的函数（宿主直接提供源码的函数）在它的新模块作用域里执行
     */
    public FunctionMaterializer(EngineOptions options, Interpreter interpreter) {
        this.options = options;
        this.interpreter = interpreter;
        this.transformer = new ImplicitReturnTransformer(options.getResultBaseName());
        this.cache = options.getCacheSize() > 0
                ? new CaffeineCache<>(options.getCacheSize())
                : null;
    }

    /**
     * 物化函数。已经物化过的函数原样返回。
     *
     * @throws SourceUnavailableError 函数没有源码（原生函数、lambda、守卫包装）
     * @throws com.tailor.compiler.parser.ParseException 源码无法解析
     * @throws com.tailor.compiler.transform.TransformationError 不满足隐式返回的要求
     */
    public TailorCallable materialize(TailorCallable function) {
        if (function instanceof ScriptFunction && ((ScriptFunction) function).isMaterialized()) {
            LOG.fine("Function '" + function.getName() + "' is already materialized");
            return function;
        }
        Optional<FunctionSource> source = function.getSource();
        if (!source.isPresent()) {
            throw new SourceUnavailableError(function.getName());
        }

        MaterializedDefinition definition = definitionOf(source.get());
        Environment closure;
        Interpreter owner;
        if (function instanceof ScriptFunction) {
            closure = ((ScriptFunction) function).getClosure();
            owner = ((ScriptFunction) function).getInterpreter();
        } else {
            closure = interpreter.newModuleScope(definition.getUnit());
            owner = interpreter;
        }
        return ScriptFunction.materialized(definition.getRewritten(), closure, owner, definition.getUnit(),
                function, definition.getRewrittenSource(), definition.getResultName());
    }

    /**
     * 取得（必要时生成）源码对应的改写结果
     */
    public MaterializedDefinition definitionOf(FunctionSource source) {
        if (cache == null) {
            return compile(source);
        }
        return cache.computeIfAbsent(source, this::compile);
    }

    private MaterializedDefinition compile(FunctionSource source) {
        String file = source.getFileName();
        FunDecl decl = new Parser(new Lexer(source.getText(), file, source.getFirstLine()), file)
                .parseFunctionDefinition();
        if (options.isStripAnnotations()) {
            decl = decl.withAnnotations(Collections.<Annotation>emptyList());
        }
        TransformResult result = transformer.transform(decl);
        String rewritten = formatter.format(result.getRewritten());
        LOG.fine("Materialized '" + decl.getName() + "' from " + source);
        return new MaterializedDefinition(result, rewritten, new SourceUnit(source.getText(), file));
    }

    public CacheStats getCacheStats() {
        return cache != null ? cache.getStats() : CacheStats.disabled();
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    public EngineOptions getOptions() {
        return options;
    }
}
