package cn.bafuka.fencecache.core;

import lombok.Builder;
import lombok.Value;

/**
 * 单个键在共享存储中的记录快照
 * <p>
 * 逻辑有效性只由 lockUntil 与当前时间（以及 lockOwner 是否存在）决定，物理 TTL 只负责回收。
 * <ul>
 *     <li>lockOwner 存在且 lockUntil &gt; now：已加锁，正在回源计算</li>
 *     <li>lockOwner 不存在且 lockUntil &gt; now：值有效，直接命中</li>
 *     <li>lockUntil &lt;= now：逻辑过期或已标记删除，弱一致性下可返回旧值，下一次读取会抢锁刷新</li>
 * </ul>
 */
@Value
@Builder
public class CacheRecord {

    /**
     * 空记录（键不存在）
     */
    public static final CacheRecord ABSENT = CacheRecord.builder().build();

    /**
     * 原始字节：null 表示从未写入值，空数组表示缓存的空结果
     */
    byte[] value;

    /**
     * 逻辑截止时间（毫秒时间戳），null 表示字段不存在
     */
    Long lockUntil;

    /**
     * 当前锁持有者的 fencing token
     */
    String lockOwner;

    /**
     * 记录是否存在
     */
    public boolean exists() {
        return value != null || lockUntil != null || lockOwner != null;
    }

    /**
     * 是否写入过值（包括空结果）
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * 是否为缓存的空结果（确认不存在）
     */
    public boolean isNegative() {
        return value != null && value.length == 0;
    }

    /**
     * 在给定时刻是否被他人持锁
     */
    public boolean isLockedAt(long now) {
        return lockOwner != null && lockUntil != null && lockUntil > now;
    }

    /**
     * 在给定时刻是否为有效命中
     */
    public boolean isValidAt(long now) {
        if (lockOwner != null || value == null) {
            return false;
        }
        // 没有 lockUntil 的旧记录视为一直有效，直到物理过期
        return lockUntil == null || lockUntil > now;
    }
}
