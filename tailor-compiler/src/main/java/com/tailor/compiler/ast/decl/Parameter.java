package com.tailor.compiler.ast.decl;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;             // 可选
    private final Expression defaultValue;  // 可选

    public Parameter(SourceLocation location, String name, TypeRef type, Expression defaultValue) {
        super(location);
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
