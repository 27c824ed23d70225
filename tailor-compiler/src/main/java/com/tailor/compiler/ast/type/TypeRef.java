package com.tailor.compiler.ast.type;

import com.tailor.compiler.ast.AstNode;
import com.tailor.compiler.ast.SourceLocation;

/**
 * 类型引用（如 Int、String?、ValueError）
 *
 * <p>Tailor 是动态类型语言，类型注解只用于 catch / is 匹配和签名元数据。</p>
 */
public class TypeRef extends AstNode {
    private final String name;
    private final boolean nullable;

    public TypeRef(SourceLocation location, String name, boolean nullable) {
        super(location);
        this.name = name;
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public boolean isNullable() {
        return nullable;
    }

    /** 返回源码形式 */
    public String toSourceString() {
        return nullable ? name + "?" : name;
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
