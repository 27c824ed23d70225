package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Use 语句（资源作用域）：use (val r = open()) { ... }
 *
 * <p>块结束时按声明的逆序关闭资源。</p>
 */
public class UseStmt extends Statement {
    private final List<UseBinding> bindings;
    private final Block body;

    public UseStmt(SourceLocation location, List<UseBinding> bindings, Block body) {
        super(location);
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
        this.body = body;
    }

    public List<UseBinding> getBindings() {
        return bindings;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitUseStmt(this, context);
    }

    public static class UseBinding {
        private final SourceLocation location;
        private final String name;
        private final Expression initializer;

        public UseBinding(SourceLocation location, String name, Expression initializer) {
            this.location = location;
            this.name = name;
            this.initializer = initializer;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }

        public Expression getInitializer() {
            return initializer;
        }
    }
}
