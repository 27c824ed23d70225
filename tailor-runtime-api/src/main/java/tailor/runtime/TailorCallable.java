package tailor.runtime;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tailor 可调用对象接口
 *
 * <p>所有可调用的 Tailor 值（脚本函数、Lambda、原生函数、守卫包装后的函数）都实现此接口，
 * 提供统一的调用契约和元数据。</p>
 *
 * <p>实现类：</p>
 * <ul>
 *   <li>NativeFunction - 原生 Java 函数，没有源码</li>
 *   <li>ScriptFunction - 脚本中用 fun 定义的函数</li>
 *   <li>ScriptLambda - lambda 与匿名函数</li>
 *   <li>GuardedFunction - 带守卫检查的包装函数</li>
 * </ul>
 */
public interface TailorCallable {

    /**
     * 获取函数名称
     */
    String getName();

    /**
     * 调用函数
     *
     * @param args 位置参数与关键字参数
     * @return 返回值，可能为 null
     */
    Object call(Arguments args);

    /**
     * 只用位置参数调用
     */
    default Object invoke(Object... positional) {
        return call(Arguments.of(positional));
    }

    // ============ 元数据 ============

    /**
     * 参数签名
     */
    default FunctionSignature getSignature() {
        return FunctionSignature.variadic(getName());
    }

    /**
     * 参数数量，-1 表示可变参数
     */
    default int getArity() {
        return getSignature().getArity();
    }

    /**
     * 文档字符串，没有时为 null
     */
    default String getDocumentation() {
        return null;
    }

    /**
     * 定义上的注解名称（不含 @）
     */
    default List<String> getAnnotations() {
        return Collections.emptyList();
    }

    /**
     * 原始定义的源码。原生函数和动态构造的函数没有源码。
     */
    default Optional<FunctionSource> getSource() {
        return Optional.empty();
    }
}
