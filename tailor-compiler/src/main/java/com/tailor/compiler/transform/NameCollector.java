package com.tailor.compiler.transform;

import com.tailor.compiler.ast.TreeScanner;
import com.tailor.compiler.ast.decl.FunDecl;
import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.expr.Identifier;
import com.tailor.compiler.ast.stmt.*;

import java.util.HashSet;
import java.util.Set;

/**
 * 收集函数中用到的所有名字：参数、标识符、声明、循环变量、catch 参数，
 * 以及嵌套函数和 lambda 内部的名字。
 */
class NameCollector extends TreeScanner<Set<String>> {

    static Set<String> collect(FunDecl decl) {
        Set<String> names = new HashSet<>();
        names.add(decl.getName());
        new NameCollector().scanFunction(decl, names);
        return names;
    }

    @Override
    protected void scanParameter(Parameter param, Set<String> names) {
        names.add(param.getName());
        super.scanParameter(param, names);
    }

    @Override
    public Void visitIdentifier(Identifier node, Set<String> names) {
        names.add(node.getName());
        return null;
    }

    @Override
    public Void visitPropertyStmt(PropertyStmt node, Set<String> names) {
        names.add(node.getName());
        return super.visitPropertyStmt(node, names);
    }

    @Override
    public Void visitFunDeclStmt(FunDeclStmt node, Set<String> names) {
        names.add(node.getDeclaration().getName());
        return super.visitFunDeclStmt(node, names);
    }

    @Override
    public Void visitForStmt(ForStmt node, Set<String> names) {
        names.add(node.getVariable());
        return super.visitForStmt(node, names);
    }

    @Override
    public Void visitTryStmt(TryStmt node, Set<String> names) {
        for (CatchClause clause : node.getCatchClauses()) {
            names.add(clause.getParamName());
        }
        return super.visitTryStmt(node, names);
    }

    @Override
    public Void visitUseStmt(UseStmt node, Set<String> names) {
        for (UseStmt.UseBinding binding : node.getBindings()) {
            names.add(binding.getName());
        }
        return super.visitUseStmt(node, names);
    }

    @Override
    public Void visitImportStmt(ImportStmt node, Set<String> names) {
        names.add(node.getBoundName());
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, Set<String> names) {
        names.addAll(node.getNames());
        return null;
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, Set<String> names) {
        names.add(node.getName());
        return null;
    }
}
