package com.tailor.compiler.ast.decl;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;
import com.tailor.compiler.ast.expr.Expression;
import com.tailor.compiler.ast.expr.Literal;
import com.tailor.compiler.ast.stmt.Block;
import com.tailor.compiler.ast.stmt.ExpressionStmt;
import com.tailor.compiler.ast.stmt.Statement;
import com.tailor.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 *
 * <p>{@code sourceStart} / {@code sourceEnd} 是整个定义（包括注解和文档注释）
 * 在所属源码中的字符区间，用于取回函数的原始定义文本。</p>
 */
public class FunDecl extends AstNode {
    private final List<Annotation> annotations;
    private final String docComment;  // 可选
    private final String name;
    private final List<Parameter> params;
    private final TypeRef returnType;  // 可选
    private final Block body;
    private final int sourceStart;
    private final int sourceEnd;

    public FunDecl(SourceLocation location, List<Annotation> annotations, String docComment,
                   String name, List<Parameter> params, TypeRef returnType, Block body,
                   int sourceStart, int sourceEnd) {
        super(location);
        this.annotations = Collections.unmodifiableList(new ArrayList<>(annotations));
        this.docComment = docComment;
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
        this.body = body;
        this.sourceStart = sourceStart;
        this.sourceEnd = sourceEnd;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public boolean hasAnnotation(String annotationName) {
        for (Annotation annotation : annotations) {
            if (annotation.getName().equals(annotationName)) return true;
        }
        return false;
    }

    public String getDocComment() {
        return docComment;
    }

    /**
     * 函数文档：优先使用文档注释；否则若函数体以字符串字面量开头且后面还有语句，
     * 该字符串视为文档字符串。
     */
    public String getDocumentation() {
        if (docComment != null) return docComment;
        List<Statement> statements = body.getStatements();
        if (statements.size() > 1 && statements.get(0) instanceof ExpressionStmt) {
            Expression first = ((ExpressionStmt) statements.get(0)).getExpression();
            if (first instanceof Literal && ((Literal) first).getKind() == Literal.LiteralKind.STRING) {
                return (String) ((Literal) first).getValue();
            }
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public int getSourceStart() {
        return sourceStart;
    }

    public int getSourceEnd() {
        return sourceEnd;
    }

    public FunDecl withAnnotations(List<Annotation> newAnnotations) {
        return new FunDecl(location, newAnnotations, docComment, name, params, returnType, body,
                sourceStart, sourceEnd);
    }

    public FunDecl withBody(Block newBody) {
        return new FunDecl(location, annotations, docComment, name, params, returnType, newBody,
                sourceStart, sourceEnd);
    }
}
