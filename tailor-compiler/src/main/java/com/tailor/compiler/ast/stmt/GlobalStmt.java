package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Global 语句：声明名字的读写指向模块作用域
 */
public class GlobalStmt extends Statement {
    private final List<String> names;

    public GlobalStmt(SourceLocation location, List<String> names) {
        super(location);
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalStmt(this, context);
    }
}
