package com.tailor.compiler.transform;

/**
 * 尾位置所属的分支种类
 */
public enum BranchKind {
    /** 函数体本身的最后一条语句 */
    FUNCTION_BODY,
    /** if / else if / else 分支 */
    CONDITIONAL_BRANCH,
    /** try 块 */
    TRY_BODY,
    /** catch 子句 */
    HANDLER_BODY,
    /** try 的 else 块 */
    HANDLER_ELSE,
    /** when 分支 */
    MATCH_ARM
}
