package tailor.runtime.guard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 守卫工厂注册表
 *
 * <p>按 (名字, 命名空间) 存放 {@link GuardFactory}；命名空间为 null 表示全局命名空间。
 * 普通对象，按需创建，不是全局单例。线程安全。</p>
 */
public final class GuardRegistry {

    private final Map<String, GuardFactory> globals = new ConcurrentHashMap<>();
    private final Map<String, Map<String, GuardFactory>> namespaces =
            new ConcurrentHashMap<>();

    /**
     * 注册到全局命名空间
     *
     * @throws IllegalArgumentException 名字已被注册
     */
    public void register(String name, GuardFactory factory) {
        register(name, factory, null);
    }

    /**
     * 注册到指定命名空间
     *
     * @throws IllegalArgumentException 名字已被注册
     */
    public void register(String name, GuardFactory factory, String namespace) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Guard name must not be empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Guard factory must not be null");
        }
        GuardFactory previous = scope(namespace, true).putIfAbsent(name, factory);
        if (previous != null) {
            throw new IllegalArgumentException(namespace == null
                    ? "Guard '" + name + "' is already registered in global namespace"
                    : "Guard '" + name + "' is already registered in namespace '" + namespace + "'");
        }
    }

    public Optional<GuardFactory> get(String name) {
        return get(name, null);
    }

    public Optional<GuardFactory> get(String name, String namespace) {
        Map<String, GuardFactory> scope = scope(namespace, false);
        return scope != null ? Optional.ofNullable(scope.get(name)) : Optional.<GuardFactory>empty();
    }

    /**
     * @throws GuardNotFoundException 未注册
     */
    public GuardFactory require(String name) {
        return require(name, null);
    }

    public GuardFactory require(String name, String namespace) {
        Optional<GuardFactory> factory = get(name, namespace);
        if (!factory.isPresent()) {
            throw new GuardNotFoundException(name, namespace);
        }
        return factory.get();
    }

    public boolean has(String name) {
        return get(name, null).isPresent();
    }

    public boolean has(String name, String namespace) {
        return get(name, namespace).isPresent();
    }

    /**
     * @return 是否确实移除了
     */
    public boolean unregister(String name) {
        return unregister(name, null);
    }

    public boolean unregister(String name, String namespace) {
        Map<String, GuardFactory> scope = scope(namespace, false);
        return scope != null && scope.remove(name) != null;
    }

    /**
     * 全局命名空间中的守卫名（排序后）
     */
    public List<String> list() {
        return list(null);
    }

    public List<String> list(String namespace) {
        Map<String, GuardFactory> scope = scope(namespace, false);
        if (scope == null) return Collections.emptyList();
        List<String> names = new ArrayList<>(scope.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * 已注册过守卫的命名空间（排序后）
     */
    public List<String> namespaces() {
        List<String> names = new ArrayList<>(namespaces.keySet());
        Collections.sort(names);
        return names;
    }

    public void clear() {
        globals.clear();
        namespaces.clear();
    }

    private Map<String, GuardFactory> scope(String namespace, boolean create) {
        if (namespace == null) return globals;
        if (create) {
            return namespaces.computeIfAbsent(namespace, k -> new ConcurrentHashMap<>());
        }
        return namespaces.get(namespace);
    }
}
