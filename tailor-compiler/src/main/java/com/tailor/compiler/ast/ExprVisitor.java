package com.tailor.compiler.ast;

import com.tailor.compiler.ast.expr.*;

/**
 * 表达式访问者
 */
public interface ExprVisitor<R, C> {

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitTypeCheckExpr(TypeCheckExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitListLiteral(ListLiteral node, C ctx);

    R visitStringInterpolation(StringInterpolation node, C ctx);

    R visitLambdaExpr(LambdaExpr node, C ctx);

    R visitFunExpr(FunExpr node, C ctx);
}
