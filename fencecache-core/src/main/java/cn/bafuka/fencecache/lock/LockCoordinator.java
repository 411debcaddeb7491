package cn.bafuka.fencecache.lock;

import cn.bafuka.fencecache.core.CacheRecord;
import cn.bafuka.fencecache.core.FenceCacheOptions;
import cn.bafuka.fencecache.core.JitterSource;
import cn.bafuka.fencecache.store.ReadResult;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.WriteOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 锁协调器
 * <p>
 * 把存储适配器的原子读取结果翻译为四种决策之一。
 * 是否成为新锁主只看原子操作返回的 acquired 标记，不做二次读取。
 */
@Slf4j
public class LockCoordinator {

    /**
     * 存储适配器
     */
    private final StoreAdapter store;

    /**
     * 客户端配置
     */
    private final FenceCacheOptions options;

    /**
     * 随机抖动来源
     */
    private final JitterSource jitter;

    public LockCoordinator(StoreAdapter store, FenceCacheOptions options, JitterSource jitter) {
        this.store = store;
        this.options = options;
        this.jitter = jitter;
    }

    /**
     * 读取记录并尝试加锁，给出决策
     *
     * @param key 缓存键
     * @param now 当前时间（毫秒）
     * @return 决策
     */
    public LockDecision decide(String key, long now) {
        String owner = newOwner();
        long lockUntil = now + lockDuration();
        long lockPhysicalTtl = options.maxLockDuration().plus(options.getDelay()).toMillis();

        ReadResult result = store.readAndLock(key, now, owner, lockUntil, lockPhysicalTtl);
        CacheRecord record = result.getRecord();

        if (result.isAcquired()) {
            if (!record.exists()) {
                log.debug("冷启动，获得锁: key={}, owner={}", key, owner);
                return LockDecision.miss(owner);
            }
            log.debug("记录已过期，获得锁: key={}, owner={}, stale={}", key, owner, record.hasValue());
            return LockDecision.needsFetchAsOwner(owner, record.getValue());
        }

        if (record.isLockedAt(now)) {
            log.debug("他人持锁中: key={}, lockUntil={}, stale={}", key, record.getLockUntil(), record.hasValue());
            return LockDecision.lockedByOther(record.getValue());
        }

        return LockDecision.hit(record.getValue());
    }

    /**
     * 回源失败后释放锁（尽力而为，锁主不匹配说明已有新锁主，忽略）
     *
     * @param key   缓存键
     * @param owner 锁主 token
     * @param now   当前时间
     */
    public void release(String key, String owner, long now) {
        WriteOutcome outcome = store.release(key, owner, now);
        if (outcome == WriteOutcome.STALE) {
            log.debug("释放锁时锁主已变更，跳过: key={}, owner={}", key, owner);
        } else {
            log.debug("锁已释放: key={}, owner={}", key, owner);
        }
    }

    /**
     * 写回结果，锁主不匹配时返回 STALE 且不做修改
     */
    public WriteOutcome writeResult(String key, String owner, byte[] value, long lockUntil, long physicalTtl) {
        return store.writeResult(key, owner, value, lockUntil, physicalTtl);
    }

    /**
     * 锁主删除整条记录，锁主不匹配时返回 STALE 且不做修改
     */
    public WriteOutcome clear(String key, String owner) {
        return store.clear(key, owner);
    }

    /**
     * 标记删除，不覆盖正在持有的锁，幂等
     *
     * @param key 缓存键
     * @param now 当前时间
     * @return 记录是否存在并被标记
     */
    public boolean tagAsDeleted(String key, long now) {
        return store.tagAsDeleted(key, now, options.getDelay().toMillis());
    }

    /**
     * 本次加锁时长：基础时长 + [0, jitter)
     */
    long lockDuration() {
        return options.getLockExpire().toMillis() + jitter.nextLong(options.getLockExpireJitter().toMillis());
    }

    private String newOwner() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
