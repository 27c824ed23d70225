package tailor.runtime.interpreter;

import tailor.runtime.TailorCallable;

import java.util.Set;

/**
 * 已加载的模块：名字、源码以及顶层定义所在的模块作用域
 */
public final class ScriptModule {
    private final String name;
    private final Environment scope;
    private final SourceUnit source;  // 内置模块为 null

    public ScriptModule(String name, Environment scope, SourceUnit source) {
        this.name = name;
        this.scope = scope;
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public String getFileName() {
        return source != null ? source.getFileName() : "<builtin>";
    }

    public SourceUnit getSource() {
        return source;
    }

    public Environment getScope() {
        return scope;
    }

    public boolean has(String member) {
        return scope.containsLocal(member);
    }

    /**
     * 读取模块成员
     */
    public Object get(String member) {
        Binding binding = scope.containsLocal(member) ? scope.lookup(member) : null;
        if (binding == null) {
            throw ErrorType.NAME.raise("Module '" + name + "' has no member '" + member + "'");
        }
        return binding.get();
    }

    void set(String member, Object value) {
        if (!scope.containsLocal(member)) {
            throw ErrorType.NAME.raise("Module '" + name + "' has no member '" + member + "'");
        }
        scope.assign(member, value);
    }

    /**
     * 取出模块中的函数
     *
     * @throws TailorRuntimeException 不存在或不是函数
     */
    public TailorCallable function(String member) {
        if (!scope.containsLocal(member)) {
            throw new TailorRuntimeException("No function '" + member + "' in module '" + name + "'");
        }
        Object value = scope.lookup(member).get();
        if (!(value instanceof TailorCallable)) {
            throw new TailorRuntimeException("'" + member + "' in module '" + name + "' is not a function ("
                    + Ops.typeName(value) + ")");
        }
        return (TailorCallable) value;
    }

    /**
     * 模块顶层定义的名字
     */
    public Set<String> names() {
        return scope.localNames();
    }

    @Override
    public String toString() {
        return "<module " + name + ">";
    }
}
