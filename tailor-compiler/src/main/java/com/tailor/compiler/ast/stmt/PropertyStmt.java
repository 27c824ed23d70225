package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.type.TypeRef;

/**
 * 变量声明 val / var
 */
public class PropertyStmt extends Statement {
    private final boolean mutable;
    private final String name;
    private final TypeRef type;            // 可选
    private final Expression initializer;  // 可选（仅 var）

    public PropertyStmt(SourceLocation location, boolean mutable, String name, TypeRef type,
                        Expression initializer) {
        super(location);
        this.mutable = mutable;
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public boolean isMutable() {
        return mutable;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyStmt(this, context);
    }
}
