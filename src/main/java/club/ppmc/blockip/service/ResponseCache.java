/**
 * 此文件定义了只读查询结果的进程内缓存。
 *
 * 主要职责:
 * - 基于Caffeine，以写入后固定TTL过期的方式缓存查询结果，首次未命中时调用加载函数填充。
 * - 写入方（数据集刷新）不感知此缓存，也不主动失效；TTL内允许读到旧数据。
 * - 可以以禁用模式创建，此时每次都直接调用加载函数，便于在测试中关闭缓存。
 *
 * 关联:
 * - `CoreConfig`: 根据`blockip.cache`配置创建此Bean。
 * - `BlockIpQueryService`: 通过此缓存读取数据集。
 */
package club.ppmc.blockip.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.function.Supplier;

public final class ResponseCache {

    // 禁用模式下为null
    private final Cache<String, Object> cache;

    private ResponseCache(Cache<String, Object> cache) {
        this.cache = cache;
    }

    public static ResponseCache expiring(Duration ttl, long maximumSize) {
        return new ResponseCache(Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build());
    }

    public static ResponseCache disabled() {
        return new ResponseCache(null);
    }

    public boolean isEnabled() {
        return cache != null;
    }

    /**
     * 读取缓存，未命中时调用`loader`并缓存其结果。`loader`抛出的异常会原样传播，且不会被缓存。
     */
    @SuppressWarnings("unchecked")
    public <V> V get(String key, Supplier<V> loader) {
        if (cache == null) {
            return loader.get();
        }
        return (V) cache.get(key, k -> loader.get());
    }
}
