package cn.bafuka.fencecache.client.impl;

import cn.bafuka.fencecache.client.FenceCacheClient;
import cn.bafuka.fencecache.codec.ValueCodec;
import cn.bafuka.fencecache.codec.impl.FastjsonValueCodec;
import cn.bafuka.fencecache.core.CacheLoader;
import cn.bafuka.fencecache.core.CacheStats;
import cn.bafuka.fencecache.core.FenceCacheOptions;
import cn.bafuka.fencecache.core.JitterSource;
import cn.bafuka.fencecache.exception.FenceCacheException;
import cn.bafuka.fencecache.lock.LockCoordinator;
import cn.bafuka.fencecache.lock.LockDecision;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.WriteOutcome;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 读取流程编排
 * <p>
 * 每次 fetch 是一个独立的状态机：决策 -> 命中返回 / 作为锁主回源并回写 / 退避后重新决策。
 * 进程内不加任何互斥锁，所有协调都依赖存储端脚本的原子性。
 * <ul>
 *     <li>弱一致：有旧值立即返回，锁主在后台刷新；他人持锁且有旧值时直接返回旧值，没有任何旧值时与强一致一样等待</li>
 *     <li>强一致：锁主同步回源；他人持锁时带抖动轮询，重试耗尽返回最后看到的值</li>
 * </ul>
 */
@Slf4j
public class FetchOrchestrator implements FenceCacheClient {

    private static final byte[] EMPTY = new byte[0];

    private static final int REFRESH_QUEUE_CAPACITY = 10_000;

    private final FenceCacheOptions options;

    private final LockCoordinator coordinator;

    private final Clock clock;

    private final JitterSource jitter;

    /**
     * 后台刷新 / 异步读取线程池
     */
    private final ExecutorService refreshExecutor;

    /**
     * 编解码器缓存
     */
    private final Map<Type, ValueCodec<?>> codecCache = new ConcurrentHashMap<>();

    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder staleServedCount = new LongAdder();
    private final LongAdder loadSuccessCount = new LongAdder();
    private final LongAdder loadFailureCount = new LongAdder();
    private final LongAdder staleWriteDiscardedCount = new LongAdder();
    private final LongAdder retriesExhaustedCount = new LongAdder();
    private final LongAdder backgroundRefreshCount = new LongAdder();

    public FetchOrchestrator(StoreAdapter store, FenceCacheOptions options) {
        this(store, options, Clock.systemUTC(), JitterSource.RANDOM);
    }

    public FetchOrchestrator(StoreAdapter store, FenceCacheOptions options, Clock clock, JitterSource jitter) {
        options.validate();
        this.options = options;
        this.clock = clock;
        this.jitter = jitter;
        this.coordinator = new LockCoordinator(store, options, jitter);
        this.refreshExecutor = new ThreadPoolExecutor(
                options.getRefreshThreads(), options.getRefreshThreads(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(REFRESH_QUEUE_CAPACITY),
                new DaemonThreadFactory("fencecache-refresh"));

        log.info("FenceCache 客户端初始化: strongConsistency={}, lockExpire={}, emptyExpire={}, delay={}",
                options.isStrongConsistency(), options.getLockExpire(), options.getEmptyExpire(), options.getDelay());
    }

    @Override
    public <V> Optional<V> fetch(String key, Duration ttl, Class<V> type, CacheLoader<V> loader) {
        return fetch(key, ttl, this.<V>codecFor(type), loader);
    }

    @Override
    public <V> Optional<V> fetch(String key, Duration ttl, Type type, CacheLoader<V> loader) {
        return fetch(key, ttl, this.<V>codecFor(type), loader);
    }

    @Override
    public <V> Optional<V> fetch(String key, Duration ttl, ValueCodec<V> codec, CacheLoader<V> loader) {
        checkArguments(key, ttl, loader);

        if (options.isDisableCacheRead()) {
            log.debug("读缓存已降级，直接回源: key={}", key);
            return invokeLoader(key, loader);
        }

        LockDecision decision = coordinator.decide(key, clock.millis());

        int retries = 0;
        while (shouldWait(decision)) {
            if (retries >= options.getMaxRetries()) {
                retriesExhaustedCount.increment();
                log.warn("等待锁超时，返回最后看到的值: key={}, retries={}, stale={}",
                        key, retries, decision.hasValue());
                return decode(key, codec, decision.getValue());
            }
            if (!backoff(key)) {
                return decode(key, codec, decision.getValue());
            }
            retries++;
            decision = coordinator.decide(key, clock.millis());
        }

        switch (decision.getType()) {
            case HIT:
                hitCount.increment();
                log.debug("缓存命中: key={}", key);
                return decode(key, codec, decision.getValue());

            case LOCKED_BY_OTHER:
                // 只剩弱一致且有旧值的情况
                staleServedCount.increment();
                log.debug("他人回源中，返回旧值: key={}", key);
                return decode(key, codec, decision.getValue());

            case NEEDS_FETCH_AS_OWNER:
                if (!options.isStrongConsistency() && decision.hasValue()) {
                    staleServedCount.increment();
                    scheduleRefresh(key, ttl, codec, loader, decision.getOwner());
                    return decode(key, codec, decision.getValue());
                }
                missCount.increment();
                return loadAndWrite(key, ttl, codec, loader, decision.getOwner());

            case MISS:
            default:
                missCount.increment();
                return loadAndWrite(key, ttl, codec, loader, decision.getOwner());
        }
    }

    @Override
    public <V> CompletableFuture<Optional<V>> fetchAsync(String key, Duration ttl, ValueCodec<V> codec,
                                                         CacheLoader<V> loader) {
        return CompletableFuture.supplyAsync(() -> fetch(key, ttl, codec, loader), refreshExecutor);
    }

    @Override
    public void tagAsDeleted(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (options.isDisableCacheDelete()) {
            log.debug("标记删除已降级，跳过: key={}", key);
            return;
        }

        boolean tagged = coordinator.tagAsDeleted(key, clock.millis());
        log.debug("标记删除: key={}, existed={}", key, tagged);
    }

    @Override
    public FenceCacheOptions getOptions() {
        return options;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.builder()
                .hitCount(hitCount.sum())
                .missCount(missCount.sum())
                .staleServedCount(staleServedCount.sum())
                .loadSuccessCount(loadSuccessCount.sum())
                .loadFailureCount(loadFailureCount.sum())
                .staleWriteDiscardedCount(staleWriteDiscardedCount.sum())
                .retriesExhaustedCount(retriesExhaustedCount.sum())
                .backgroundRefreshCount(backgroundRefreshCount.sum())
                .build();
    }

    /**
     * 回源并回写
     * 除写回成功（或因锁主变更被丢弃）外，任何退出路径都会释放锁
     */
    private <V> Optional<V> loadAndWrite(String key, Duration ttl, ValueCodec<V> codec,
                                         CacheLoader<V> loader, String owner) {
        boolean settled = false;
        try {
            Optional<V> result = invokeLoader(key, loader);

            if (!result.isPresent() && options.getEmptyExpire().isZero()) {
                // 不缓存空结果：删除记录，下一次读取同步回源
                WriteOutcome outcome = coordinator.clear(key, owner);
                settled = true;
                if (outcome == WriteOutcome.STALE) {
                    staleWriteDiscardedCount.increment();
                    log.debug("锁主已变更，跳过删除: key={}, owner={}", key, owner);
                } else {
                    log.debug("空结果不缓存，记录已删除: key={}", key);
                }
                return result;
            }

            byte[] bytes;
            long logicalTtl;
            if (result.isPresent()) {
                bytes = encode(key, codec, result.get());
                logicalTtl = adjustedTtl(ttl);
            } else {
                bytes = EMPTY;
                logicalTtl = options.getEmptyExpire().toMillis();
            }
            long physicalTtl = logicalTtl + options.maxLockDuration().plus(options.getDelay()).toMillis();

            WriteOutcome outcome = coordinator.writeResult(key, owner, bytes, clock.millis() + logicalTtl, physicalTtl);
            settled = true;
            if (outcome == WriteOutcome.STALE) {
                staleWriteDiscardedCount.increment();
                log.debug("锁主已变更，丢弃本次写回: key={}, owner={}", key, owner);
            } else {
                log.debug("回源写回成功: key={}, empty={}, ttl={}ms", key, !result.isPresent(), logicalTtl);
            }
            return result;
        } finally {
            if (!settled) {
                releaseQuietly(key, owner);
            }
        }
    }

    private <V> Optional<V> invokeLoader(String key, CacheLoader<V> loader) {
        try {
            long startTime = System.currentTimeMillis();
            Optional<V> result = loader.load();
            loadSuccessCount.increment();
            log.debug("回源成功: key={}, duration={}ms", key, System.currentTimeMillis() - startTime);
            return result == null ? Optional.empty() : result;
        } catch (FenceCacheException e) {
            loadFailureCount.increment();
            throw e;
        } catch (Exception e) {
            loadFailureCount.increment();
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("回源失败: key={}, error={}", key, e.getMessage());
            throw FenceCacheException.loaderFailed(key, e);
        }
    }

    /**
     * 弱一致后台刷新，调用方已拿到旧值，失败只记录日志
     */
    private <V> void scheduleRefresh(String key, Duration ttl, ValueCodec<V> codec,
                                     CacheLoader<V> loader, String owner) {
        backgroundRefreshCount.increment();
        try {
            refreshExecutor.execute(() -> {
                try {
                    loadAndWrite(key, ttl, codec, loader, owner);
                    log.debug("后台刷新完成: key={}", key);
                } catch (RuntimeException e) {
                    log.error("后台刷新失败: key={}", key, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("后台刷新任务被拒绝，释放锁: key={}", key, e);
            releaseQuietly(key, owner);
        }
    }

    private void releaseQuietly(String key, String owner) {
        try {
            coordinator.release(key, owner, clock.millis());
        } catch (RuntimeException e) {
            log.warn("释放锁失败，等待锁自然过期: key={}, owner={}", key, owner, e);
        }
    }

    /**
     * 他人持锁时是否需要等待：强一致总是等待；弱一致只在没有任何旧值可返回时等待
     */
    private boolean shouldWait(LockDecision decision) {
        return decision.getType() == LockDecision.Type.LOCKED_BY_OTHER
                && (options.isStrongConsistency() || !decision.hasValue());
    }

    /**
     * 退避等待，被中断时恢复中断标记并返回 false
     */
    private boolean backoff(String key) {
        long sleepMs = options.getLockSleep().toMillis() + jitter.nextLong(options.getLockSleepJitter().toMillis());
        try {
            TimeUnit.MILLISECONDS.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            log.warn("等待锁时被中断，返回最后看到的值: key={}", key);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 逻辑过期时间随机缩短 [0, randomExpireAdjustment)，避免同时过期
     */
    private long adjustedTtl(Duration ttl) {
        long ms = ttl.toMillis();
        return ms - (long) (ms * options.getRandomExpireAdjustment() * jitter.nextDouble());
    }

    private <V> Optional<V> decode(String key, ValueCodec<V> codec, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(codec.decode(bytes));
        } catch (RuntimeException e) {
            throw FenceCacheException.codecError(key, e);
        }
    }

    private <V> byte[] encode(String key, ValueCodec<V> codec, V value) {
        byte[] bytes;
        try {
            bytes = codec.encode(value);
        } catch (RuntimeException e) {
            throw FenceCacheException.codecError(key, e);
        }
        if (bytes == null || bytes.length == 0) {
            throw FenceCacheException.codecError(key,
                    new IllegalStateException("Codec produced empty bytes for a present value"));
        }
        return bytes;
    }

    @SuppressWarnings("unchecked")
    private <V> ValueCodec<V> codecFor(Type type) {
        return (ValueCodec<V>) codecCache.computeIfAbsent(type, FastjsonValueCodec::new);
    }

    private static void checkArguments(String key, Duration ttl, CacheLoader<?> loader) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader must not be null");
        }
    }

    @Override
    public void shutdown() {
        try {
            refreshExecutor.shutdown();

            long shutdownTimeoutSeconds = 30;
            log.info("等待后台刷新线程池关闭，超时时间: {} 秒", shutdownTimeoutSeconds);

            if (!refreshExecutor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                List<Runnable> pendingTasks = refreshExecutor.shutdownNow();
                log.warn("后台刷新未在 {} 秒内完成，强制关闭，丢弃 {} 个任务",
                        shutdownTimeoutSeconds, pendingTasks.size());
            } else {
                log.info("后台刷新线程池已正常关闭");
            }
        } catch (InterruptedException e) {
            log.error("关闭被中断", e);
            List<Runnable> pendingTasks = refreshExecutor.shutdownNow();
            if (!pendingTasks.isEmpty()) {
                log.warn("强制关闭，丢弃了 {} 个任务", pendingTasks.size());
            }
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 守护线程工厂
     */
    private static final class DaemonThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
