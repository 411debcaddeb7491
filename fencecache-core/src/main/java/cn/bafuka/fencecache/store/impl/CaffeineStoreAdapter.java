package cn.bafuka.fencecache.store.impl;

import cn.bafuka.fencecache.core.CacheRecord;
import cn.bafuka.fencecache.store.ReadResult;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.WriteOutcome;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于 Caffeine 的进程内存储适配器
 * <p>
 * 单节点部署或测试使用，语义与 Redis 脚本一致：
 * 每个操作是一次 {@code asMap().compute}，物理 TTL 由可变过期策略实现。
 */
@Slf4j
public class CaffeineStoreAdapter implements StoreAdapter {

    /**
     * 默认最大容量
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 100_000L;

    private final Cache<String, Entry> cache;

    private final Ticker ticker;

    public CaffeineStoreAdapter() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    public CaffeineStoreAdapter(long maximumSize, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PhysicalExpiry())
                .ticker(ticker)
                .build();

        log.info("构建本地存储，配置: maximumSize={}", maximumSize);
    }

    @Override
    public ReadResult readAndLock(String key, long now, String newOwner, long newLockUntil, long lockPhysicalTtl) {
        AtomicReference<ReadResult> result = new AtomicReference<>();
        cache.asMap().compute(key, (k, old) -> {
            CacheRecord record = old == null ? CacheRecord.ABSENT : old.toRecord();
            boolean absent = record.getValue() == null && record.getLockUntil() == null;
            boolean expired = record.getLockUntil() != null && record.getLockUntil() <= now;
            if (!absent && !expired) {
                result.set(ReadResult.of(record, false));
                return old;
            }

            long deadline = ticker.read() + TimeUnit.MILLISECONDS.toNanos(lockPhysicalTtl);
            if (old != null && old.deadlineNanos > deadline) {
                deadline = old.deadlineNanos;
            }
            result.set(ReadResult.of(record, true));
            return new Entry(record.getValue(), newLockUntil, newOwner, false, deadline);
        });
        return result.get();
    }

    @Override
    public WriteOutcome writeResult(String key, String owner, byte[] value, long lockUntil, long physicalTtl) {
        AtomicReference<WriteOutcome> result = new AtomicReference<>(WriteOutcome.STALE);
        cache.asMap().computeIfPresent(key, (k, old) -> {
            if (!owner.equals(old.lockOwner)) {
                return old;
            }
            result.set(WriteOutcome.SUCCESS);
            long effectiveLockUntil = old.dirty ? 0L : lockUntil;
            return new Entry(value, effectiveLockUntil, null, false,
                    ticker.read() + TimeUnit.MILLISECONDS.toNanos(physicalTtl));
        });
        return result.get();
    }

    @Override
    public WriteOutcome release(String key, String owner, long now) {
        AtomicReference<WriteOutcome> result = new AtomicReference<>(WriteOutcome.STALE);
        cache.asMap().computeIfPresent(key, (k, old) -> {
            if (!owner.equals(old.lockOwner)) {
                return old;
            }
            result.set(WriteOutcome.SUCCESS);
            return new Entry(old.value, now, null, false, old.deadlineNanos);
        });
        return result.get();
    }

    @Override
    public WriteOutcome clear(String key, String owner) {
        AtomicReference<WriteOutcome> result = new AtomicReference<>(WriteOutcome.STALE);
        cache.asMap().computeIfPresent(key, (k, old) -> {
            if (!owner.equals(old.lockOwner)) {
                return old;
            }
            result.set(WriteOutcome.SUCCESS);
            return null;
        });
        return result.get();
    }

    @Override
    public boolean tagAsDeleted(String key, long now, long delay) {
        AtomicReference<Boolean> tagged = new AtomicReference<>(Boolean.FALSE);
        cache.asMap().computeIfPresent(key, (k, old) -> {
            tagged.set(Boolean.TRUE);
            if (old.toRecord().isLockedAt(now)) {
                // 不覆盖正在进行的回源，只标记写回值立即过期
                return new Entry(old.value, old.lockUntil, old.lockOwner, true, old.deadlineNanos);
            }
            return new Entry(old.value, now, null, false,
                    ticker.read() + TimeUnit.MILLISECONDS.toNanos(delay));
        });
        return tagged.get();
    }

    /**
     * 读取记录（诊断用，不加锁）
     *
     * @param key 缓存键
     * @return 记录快照，不存在返回 {@link CacheRecord#ABSENT}
     */
    public CacheRecord peek(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? CacheRecord.ABSENT : entry.toRecord();
    }

    /**
     * 当前记录数
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * 存储条目，不可变
     */
    private static final class Entry {

        private final byte[] value;
        private final Long lockUntil;
        private final String lockOwner;
        private final boolean dirty;
        private final long deadlineNanos;

        private Entry(byte[] value, Long lockUntil, String lockOwner, boolean dirty, long deadlineNanos) {
            this.value = value;
            this.lockUntil = lockUntil;
            this.lockOwner = lockOwner;
            this.dirty = dirty;
            this.deadlineNanos = deadlineNanos;
        }

        private CacheRecord toRecord() {
            return CacheRecord.builder()
                    .value(value)
                    .lockUntil(lockUntil)
                    .lockOwner(lockOwner)
                    .build();
        }
    }

    /**
     * 物理过期：每个条目携带自己的绝对截止时间
     */
    private static final class PhysicalExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return Math.max(0L, entry.deadlineNanos - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return Math.max(0L, entry.deadlineNanos - currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
