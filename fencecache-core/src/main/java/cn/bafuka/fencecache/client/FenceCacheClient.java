package cn.bafuka.fencecache.client;

import cn.bafuka.fencecache.codec.ValueCodec;
import cn.bafuka.fencecache.core.CacheLoader;
import cn.bafuka.fencecache.core.CacheStats;
import cn.bafuka.fencecache.core.FenceCacheOptions;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * FenceCache 客户端
 * <p>
 * 读穿透缓存：查缓存 -> 未命中时只有锁主回源 -> 回写。
 * 使用示例：
 * <pre>
 * {@code
 * Optional<Product> product = client.fetch("product:" + id, Duration.ofMinutes(10), Product.class,
 *         () -> Optional.ofNullable(productMapper.selectById(id)));
 *
 * productMapper.updateById(product);
 * client.tagAsDeleted("product:" + id);
 * }
 * </pre>
 */
public interface FenceCacheClient {

    /**
     * 读取缓存，未命中时回源（使用 JSON 编解码）
     *
     * @param key    缓存键
     * @param ttl    值的逻辑有效期
     * @param type   值类型
     * @param loader 回源函数
     * @param <V>    值类型
     * @return 值，数据源确认不存在时为空
     * @throws cn.bafuka.fencecache.exception.FenceCacheException 存储不可用或回源失败
     */
    <V> Optional<V> fetch(String key, Duration ttl, Class<V> type, CacheLoader<V> loader);

    /**
     * 读取缓存，支持泛型类型
     *
     * @see #fetch(String, Duration, Class, CacheLoader)
     */
    <V> Optional<V> fetch(String key, Duration ttl, Type type, CacheLoader<V> loader);

    /**
     * 读取缓存，使用指定的编解码器
     *
     * @see #fetch(String, Duration, Class, CacheLoader)
     */
    <V> Optional<V> fetch(String key, Duration ttl, ValueCodec<V> codec, CacheLoader<V> loader);

    /**
     * 异步读取，在客户端的工作线程上执行 {@link #fetch(String, Duration, ValueCodec, CacheLoader)}
     */
    <V> CompletableFuture<Optional<V>> fetchAsync(String key, Duration ttl, ValueCodec<V> codec, CacheLoader<V> loader);

    /**
     * 标记删除：数据更新后调用，旧值逻辑过期，下一次读取触发刷新
     * 不会调用回源函数，幂等
     *
     * @param key 缓存键
     * @throws cn.bafuka.fencecache.exception.FenceCacheException 存储不可用
     */
    void tagAsDeleted(String key);

    /**
     * 获取配置
     */
    FenceCacheOptions getOptions();

    /**
     * 获取统计信息快照
     */
    CacheStats getStats();

    /**
     * 关闭客户端，等待后台刷新完成
     */
    void shutdown();
}
