package com.tailor.compiler.ast.stmt;

import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.StmtVisitor;

/**
 * Import 语句：import math / import strings as s
 */
public class ImportStmt extends Statement {
    private final String moduleName;
    private final String alias;  // 可选

    public ImportStmt(SourceLocation location, String moduleName, String alias) {
        super(location);
        this.moduleName = moduleName;
        this.alias = alias;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getAlias() {
        return alias;
    }

    /** 导入后在作用域中绑定的名字 */
    public String getBoundName() {
        if (alias != null) return alias;
        int dot = moduleName.lastIndexOf('.');
        return dot >= 0 ? moduleName.substring(dot + 1) : moduleName;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}
