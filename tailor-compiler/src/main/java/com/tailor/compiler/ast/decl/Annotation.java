package com.tailor.compiler.ast.decl;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.expr.CallExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 注解：@name 或 @name(args)
 */
public class Annotation extends AstNode {
    private final String name;
    private final List<CallExpr.Argument> args;

    public Annotation(SourceLocation location, String name, List<CallExpr.Argument> args) {
        super(location);
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getName() {
        return name;
    }

    public List<CallExpr.Argument> getArgs() {
        return args;
    }
}
