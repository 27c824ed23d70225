package tailor.runtime.interpreter;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 运行时环境（作用域）
 *
 * <p>管理变量绑定，支持嵌套作用域。作用域链自内向外为：
 * 代码块 → 函数帧 → 定义处的作用域 → ... → 模块 → 内置。</p>
 *
 * <p>模块作用域在加载后会被多个线程同时读取（每次调用都以它为闭包），
 * 因此使用并发 Map；函数帧和代码块只属于一次调用。</p>
 */
public final class Environment {

    public enum Kind {
        BUILTIN,
        MODULE,
        FUNCTION,
        BLOCK
    }

    private final Environment parent;
    private final Kind kind;
    private final SourceUnit unit;
    private final Map<String, Binding> bindings;
    private Set<String> globalNames;  // 仅函数帧，延迟分配

    private Environment(Environment parent, Kind kind, SourceUnit unit) {
        this.parent = parent;
        this.kind = kind;
        this.unit = unit;
        this.bindings = kind == Kind.MODULE || kind == Kind.BUILTIN
                ? new ConcurrentHashMap<>()
                : new HashMap<>();
    }

    /**
     * 创建内置作用域（作用域链的根）
     */
    public static Environment builtins() {
        return new Environment(null, Kind.BUILTIN, null);
    }

    /**
     * 创建模块作用域
     *
     * @param unit 模块源码，模块内定义的函数从中截取自己的源码片段
     */
    public Environment newModuleScope(SourceUnit unit) {
        return new Environment(this, Kind.MODULE, unit);
    }

    /**
     * 创建函数调用帧
     *
     * @param unit 函数定义所在的源码，null 表示沿用外层
     */
    public Environment newFunctionFrame(SourceUnit unit) {
        return new Environment(this, Kind.FUNCTION, unit);
    }

    /**
     * 创建代码块作用域
     */
    public Environment child() {
        return new Environment(this, Kind.BLOCK, null);
    }

    public Environment getParent() {
        return parent;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 当前代码所属的源码
     */
    public SourceUnit getSourceUnit() {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.unit != null) return env.unit;
        }
        return null;
    }

    // ============ 定义 ============

    /**
     * 在当前作用域定义新变量。允许遮蔽外层同名变量，同一作用域内不允许重复定义。
     */
    public void define(String name, Object value, boolean mutable) {
        if (bindings.containsKey(name)) {
            throw ErrorType.NAME.raise("Variable already defined: " + name);
        }
        bindings.put(name, new Binding(value, mutable));
    }

    public void defineVal(String name, Object value) {
        define(name, value, false);
    }

    public void defineVar(String name, Object value) {
        define(name, value, true);
    }

    /**
     * 覆盖当前作用域的定义（不检查重复）
     */
    public void redefine(String name, Object value, boolean mutable) {
        bindings.put(name, new Binding(value, mutable));
    }

    /**
     * 声明没有初始值的 var，赋值之前读取抛出 NameError
     */
    public void declareUnassigned(String name) {
        if (bindings.containsKey(name)) {
            throw ErrorType.NAME.raise("Variable already defined: " + name);
        }
        bindings.put(name, Binding.unassigned());
    }

    // ============ 读写 ============

    /**
     * 获取变量值
     */
    public Object get(String name) {
        Binding binding = lookup(name);
        if (binding == null) {
            throw ErrorType.NAME.raise("Undefined variable: " + name);
        }
        if (!binding.isAssigned()) {
            throw ErrorType.NAME.raise("Uninitialized variable: " + name);
        }
        return binding.get();
    }

    /**
     * 检查变量是否存在（含外层）
     */
    public boolean contains(String name) {
        return lookup(name) != null;
    }

    /**
     * 检查变量是否在当前作用域中定义
     */
    public boolean containsLocal(String name) {
        return bindings.containsKey(name);
    }

    Binding lookup(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            Binding binding = env.bindings.get(name);
            if (binding != null) return binding;
        }
        return null;
    }

    /**
     * 给已有变量赋值。函数帧中声明为 global 的名字改为写入模块作用域，
     * 模块中尚不存在时新建为 var。
     */
    public void assign(String name, Object value) {
        if (isDeclaredGlobal(name)) {
            Environment module = moduleScope();
            Binding binding = module.bindings.get(name);
            if (binding == null) {
                module.bindings.put(name, new Binding(value, true));
                return;
            }
            checkMutable(binding, name);
            binding.set(value);
            return;
        }
        Binding binding = lookup(name);
        if (binding == null) {
            throw ErrorType.NAME.raise("Undefined variable: " + name);
        }
        checkMutable(binding, name);
        binding.set(value);
    }

    private static void checkMutable(Binding binding, String name) {
        if (!binding.isMutable()) {
            throw ErrorType.STATE.raise("Cannot reassign val: " + name);
        }
    }

    /**
     * 删除变量。只在当前函数帧之内（或模块顶层的模块作用域）查找，
     * 声明为 global 的名字从模块作用域删除。
     */
    public void delete(String name) {
        if (isDeclaredGlobal(name)) {
            if (moduleScope().bindings.remove(name) == null) {
                throw ErrorType.NAME.raise("Cannot delete undefined variable: " + name);
            }
            return;
        }
        for (Environment env = this; env != null; env = env.parent) {
            if (env.bindings.remove(name) != null) return;
            if (env.kind != Kind.BLOCK) break;
        }
        throw ErrorType.NAME.raise("Cannot delete undefined variable: " + name);
    }

    // ============ global ============

    /**
     * 在所属函数帧中声明 global。模块顶层的 global 没有效果。
     */
    public void declareGlobal(String name) {
        Environment frame = functionFrame();
        if (frame == null) return;
        if (frame.globalNames == null) {
            frame.globalNames = new HashSet<>();
        }
        frame.globalNames.add(name);
    }

    private boolean isDeclaredGlobal(String name) {
        Environment frame = functionFrame();
        return frame != null && frame.globalNames != null && frame.globalNames.contains(name);
    }

    /** 最近的函数帧；处在模块顶层时返回 null */
    private Environment functionFrame() {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.kind == Kind.FUNCTION) return env;
            if (env.kind != Kind.BLOCK) return null;
        }
        return null;
    }

    private Environment moduleScope() {
        Environment env = this;
        while (env.kind != Kind.MODULE && env.parent != null) {
            env = env.parent;
        }
        return env;
    }

    /**
     * 当前作用域内定义的名字（排序后）
     */
    public Set<String> localNames() {
        return Collections.unmodifiableSet(new TreeSet<>(bindings.keySet()));
    }
}
