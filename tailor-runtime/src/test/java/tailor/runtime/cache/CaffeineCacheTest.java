package tailor.runtime.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * CaffeineCache 测试
 */
class CaffeineCacheTest {

    @Test
    @DisplayName("命中时不重复计算")
    void testComputeOnce() {
        CaffeineCache<String, Integer> cache = new CaffeineCache<>(16);
        AtomicInteger loads = new AtomicInteger();

        assertThat(cache.computeIfAbsent("a", k -> loads.incrementAndGet())).isEqualTo(1);
        assertThat(cache.computeIfAbsent("a", k -> loads.incrementAndGet())).isEqualTo(1);
        assertThat(loads.get()).isEqualTo(1);

        CacheStats stats = cache.getStats();
        assertThat(stats.getHitCount()).isEqualTo(1);
        assertThat(stats.getMissCount()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(0.5);
        assertThat(stats.getMaximumSize()).isEqualTo(16);
    }

    @Test
    @DisplayName("计算失败不进缓存")
    void testFailureNotCached() {
        CaffeineCache<String, Integer> cache = new CaffeineCache<>(16);
        assertThatThrownBy(() -> cache.computeIfAbsent("bad", k -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.get("bad")).isNull();
        assertThat(cache.size()).isZero();
        assertThat(cache.computeIfAbsent("bad", k -> 7)).isEqualTo(7);
    }

    @Test
    @DisplayName("invalidate 与 clear")
    void testInvalidate() {
        CaffeineCache<String, Integer> cache = new CaffeineCache<>(16);
        cache.computeIfAbsent("a", k -> 1);
        cache.computeIfAbsent("b", k -> 2);
        cache.invalidate("a");
        assertThat(cache.get("a")).isNull();
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("容量必须为正")
    void testInvalidSize() {
        assertThatThrownBy(() -> new CaffeineCache<>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("关闭缓存时的统计")
    void testDisabledStats() {
        CacheStats stats = CacheStats.disabled();
        assertThat(stats.getMaximumSize()).isZero();
        assertThat(stats.getHitRate()).isZero();
    }
}
