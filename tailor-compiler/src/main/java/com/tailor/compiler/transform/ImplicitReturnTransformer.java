package com.tailor.compiler.transform;

import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.stmt.Block;

import java.util.List;
import java.util.logging.Logger;

/**
 * 隐式返回改写流水线：
 * 显式 return 检查 → 尾位置解析与完备性校验 → 选择结果绑定名 → 改写。
 *
 * <p>无状态、确定性：同一函数定义总是得到同一棵改写树。任何阶段失败都在定义期抛出，
 * 不会产生部分改写。</p>
 */
public class ImplicitReturnTransformer {
    private static final Logger LOG = Logger.getLogger(ImplicitReturnTransformer.class.getName());

    private final String resultBaseName;

    public ImplicitReturnTransformer() {
        this(ResultBindingNamer.DEFAULT_BASE_NAME);
    }

    public ImplicitReturnTransformer(String resultBaseName) {
        if (resultBaseName == null || resultBaseName.isEmpty()) {
            throw new IllegalArgumentException("resultBaseName must not be empty");
        }
        this.resultBaseName = resultBaseName;
    }

    public TransformResult transform(FunDecl decl) {
        String name = decl.getName();
        Block body = decl.getBody();

        new ExplicitReturnChecker(name).check(body);
        List<TailPosition> positions = new TailPositionResolver(name).resolve(body);
        String resultName = ResultBindingNamer.choose(decl, resultBaseName);
        Block rewrittenBody = new TailRewriter(resultName, positions).rewrite(body);

        LOG.fine("Rewrote function '" + name + "': " + positions.size()
                + " tail position(s) bound to '" + resultName + "'");
        return new TransformResult(decl, decl.withBody(rewrittenBody), resultName, positions);
    }
}
