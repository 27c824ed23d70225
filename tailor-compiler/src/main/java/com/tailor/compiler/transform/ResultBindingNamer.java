package com.tailor.compiler.transform;

import com.tailor.compiler.ast.decl.FunDecl;

import java.util.Set;

/**
 * 为结果绑定选择一个函数中未使用的名字
 */
public final class ResultBindingNamer {

    public static final String DEFAULT_BASE_NAME = "__implicit_result";

    private ResultBindingNamer() {}

    /**
     * 基础名未被使用时直接返回，否则依次尝试 base_1、base_2 ...
     */
    public static String choose(FunDecl decl, String baseName) {
        Set<String> used = NameCollector.collect(decl);
        if (!used.contains(baseName)) {
            return baseName;
        }
        int suffix = 1;
        while (used.contains(baseName + "_" + suffix)) {
            suffix++;
        }
        return baseName + "_" + suffix;
    }
}
