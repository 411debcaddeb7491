package cn.bafuka.fencecache.core;

import java.util.Optional;

/**
 * 回源加载函数
 * <p>
 * 返回 {@link Optional#empty()}（或 null）表示数据源确认不存在，会以空结果缓存 emptyExpire；
 * 抛出异常表示加载失败，锁会被立即释放以便其他调用方重试。
 * 每次获得锁最多调用一次，缓存命中时不会调用。
 *
 * @param <V> 值类型
 */
@FunctionalInterface
public interface CacheLoader<V> {

    /**
     * 从数据源加载
     *
     * @return 加载结果
     * @throws Exception 加载失败
     */
    Optional<V> load() throws Exception;
}
