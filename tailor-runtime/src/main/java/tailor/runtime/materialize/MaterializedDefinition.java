package tailor.runtime.materialize;

import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.transform.TransformResult;
import tailor.runtime.interpreter.SourceUnit;

/**
 * 一次改写的产物：与闭包无关，可在多个函数之间共享缓存
 */
public final class MaterializedDefinition {
    private final TransformResult result;
    private final String rewrittenSource;
    private final SourceUnit unit;

    MaterializedDefinition(TransformResult result, String rewrittenSource, SourceUnit unit) {
        this.result = result;
        this.rewrittenSource = rewrittenSource;
        this.unit = unit;
    }

    public FunDecl getRewritten() {
        return result.getRewritten();
    }

    public String getResultName() {
        return result.getResultName();
    }

    public int getTailPositionCount() {
        return result.getTailPositions().size();
    }

    public String getRewrittenSource() {
        return rewrittenSource;
    }

    /** 被解析的源码片段，改写后定义上的偏移量指向它 */
    public SourceUnit getUnit() {
        return unit;
    }
}
