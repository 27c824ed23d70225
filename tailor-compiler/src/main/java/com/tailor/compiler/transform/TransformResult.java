package com.tailor.compiler.transform;

import com.tailor.compiler.ast.decl.FunDecl;

import java.util.List;

/**
 * 隐式返回改写的结果
 */
public final class TransformResult {
    private final FunDecl original;
    private final FunDecl rewritten;
    private final String resultName;
    private final List<TailPosition> tailPositions;

    TransformResult(FunDecl original, FunDecl rewritten, String resultName, List<TailPosition> tailPositions) {
        this.original = original;
        this.rewritten = rewritten;
        this.resultName = resultName;
        this.tailPositions = tailPositions;
    }

    public FunDecl getOriginal() {
        return original;
    }

    public FunDecl getRewritten() {
        return rewritten;
    }

    /** 合成的结果绑定名 */
    public String getResultName() {
        return resultName;
    }

    /** 被改写的尾位置（按源码顺序） */
    public List<TailPosition> getTailPositions() {
        return tailPositions;
    }
}
