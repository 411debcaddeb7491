package cn.bafuka.fencecache.store;

/**
 * 共享存储适配器
 * <p>
 * 每个操作对其他调用方都必须是单次往返的原子操作（Redis 下为一次 Lua 脚本执行），
 * 这是整个锁协议正确性的基础。时间参数统一为毫秒时间戳，由调用方提供。
 */
public interface StoreAdapter {

    /**
     * 原子地读取记录并在未被锁定时加锁
     * <p>
     * 记录不存在，或 lockUntil &lt;= now 时，写入 lockOwner = newOwner、lockUntil = newLockUntil；
     * 被他人有效持锁或值仍有效时不做任何修改。
     *
     * @param key             缓存键
     * @param now             当前时间
     * @param newOwner        新锁主的 fencing token
     * @param newLockUntil    锁截止时间
     * @param lockPhysicalTtl 加锁后记录至少保留的物理时长（毫秒）
     * @return 加锁前的记录以及是否加锁成功
     */
    ReadResult readAndLock(String key, long now, String newOwner, long newLockUntil, long lockPhysicalTtl);

    /**
     * 仅当 owner 仍是当前锁主时写入新值并释放锁
     *
     * @param key         缓存键
     * @param owner       写入方的 fencing token
     * @param value       编码后的值，空数组表示空结果
     * @param lockUntil   值的逻辑截止时间
     * @param physicalTtl 物理 TTL（毫秒）
     * @return SUCCESS 或 STALE（未修改）
     */
    WriteOutcome writeResult(String key, String owner, byte[] value, long lockUntil, long physicalTtl);

    /**
     * 仅当 owner 仍是当前锁主时释放锁（lockUntil = now），用于回源失败
     *
     * @param key   缓存键
     * @param owner 锁主的 fencing token
     * @param now   当前时间
     * @return SUCCESS 或 STALE（未修改）
     */
    WriteOutcome release(String key, String owner, long now);

    /**
     * 仅当 owner 仍是当前锁主时删除整条记录，用于不缓存空结果（emptyExpire = 0）
     * 删除后下一次读取是冷启动，会同步回源
     *
     * @param key   缓存键
     * @param owner 锁主的 fencing token
     * @return SUCCESS 或 STALE（未修改）
     */
    WriteOutcome clear(String key, String owner);

    /**
     * 标记删除：lockUntil = now，保留旧值
     * 有效锁正在被持有时不覆盖锁，只打上 dirty 标记，锁主写回的值会立即过期。幂等。
     *
     * @param key   缓存键
     * @param now   当前时间
     * @param delay 标记后记录的物理保留时长（毫秒）
     * @return 记录是否存在并被标记
     */
    boolean tagAsDeleted(String key, long now, long delay);
}
