package tailor.runtime.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>改写结果按源码缓存，实现必须线程安全。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 不存在时计算并缓存。计算抛出异常时不缓存，异常原样传播。
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    /**
     * 移除单个条目
     */
    void invalidate(K key);

    long size();

    void clear();

    CacheStats getStats();
}
