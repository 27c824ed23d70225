package com.tailor.compiler.ast.decl;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.stmt.FunDeclStmt;
import com.tailor.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（模块）根节点
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<Statement> statements;

    public Program(SourceLocation location, String fileName, List<Statement> statements) {
        super(location);
        this.fileName = fileName;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /** 所有顶层函数声明 */
    public List<FunDecl> getFunctions() {
        List<FunDecl> result = new ArrayList<>();
        for (Statement stmt : statements) {
            if (stmt instanceof FunDeclStmt) {
                result.add(((FunDeclStmt) stmt).getDeclaration());
            }
        }
        return result;
    }
}
