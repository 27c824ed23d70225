package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * When 分支
 *
 * <p>条件列表为空表示 {@code else} 分支。</p>
 */
public class WhenBranch extends AstNode {
    private final List<WhenCondition> conditions;
    private final Block body;

    public WhenBranch(SourceLocation location, List<WhenCondition> conditions, Block body) {
        super(location);
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
        this.body = body;
    }

    public List<WhenCondition> getConditions() {
        return conditions;
    }

    public boolean isElse() {
        return conditions.isEmpty();
    }

    public Block getBody() {
        return body;
    }

    public WhenBranch withBody(Block newBody) {
        return new WhenBranch(location, conditions, newBody);
    }

    /**
     * When 条件
     */
    public static class WhenCondition {
        private final ConditionKind kind;
        private final Expression value;   // VALUE
        private final TypeRef type;       // TYPE
        private final boolean negated;    // !is

        private WhenCondition(ConditionKind kind, Expression value, TypeRef type, boolean negated) {
            this.kind = kind;
            this.value = value;
            this.type = type;
            this.negated = negated;
        }

        public static WhenCondition value(Expression value) {
            return new WhenCondition(ConditionKind.VALUE, value, null, false);
        }

        public static WhenCondition type(TypeRef type, boolean negated) {
            return new WhenCondition(ConditionKind.TYPE, null, type, negated);
        }

        public ConditionKind getKind() {
            return kind;
        }

        public Expression getValue() {
            return value;
        }

        public TypeRef getType() {
            return type;
        }

        public boolean isNegated() {
            return negated;
        }
    }

    public enum ConditionKind {
        /** 值比较（有 subject 时与 subject 相等，没有 subject 时为布尔条件） */
        VALUE,
        /** 类型检查 is Type */
        TYPE
    }
}
