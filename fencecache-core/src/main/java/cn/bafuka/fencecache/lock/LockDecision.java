package cn.bafuka.fencecache.lock;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 锁协调的决策结果
 * value 为原始字节：null 表示没有可用的值，空数组表示缓存的空结果
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LockDecision {

    Type type;

    /**
     * 本次获得的锁主 token，仅 NEEDS_FETCH_AS_OWNER / MISS 时存在
     */
    String owner;

    byte[] value;

    public static LockDecision hit(byte[] value) {
        return new LockDecision(Type.HIT, null, value);
    }

    public static LockDecision needsFetchAsOwner(String owner, byte[] staleValue) {
        return new LockDecision(Type.NEEDS_FETCH_AS_OWNER, owner, staleValue);
    }

    public static LockDecision lockedByOther(byte[] staleValue) {
        return new LockDecision(Type.LOCKED_BY_OTHER, null, staleValue);
    }

    public static LockDecision miss(String owner) {
        return new LockDecision(Type.MISS, owner, null);
    }

    /**
     * 是否带有可返回的值（包括空结果）
     */
    public boolean hasValue() {
        return value != null;
    }

    public enum Type {
        /**
         * 值有效，直接返回
         */
        HIT,

        /**
         * 本次调用成为锁主，需要回源；可能带有旧值
         */
        NEEDS_FETCH_AS_OWNER,

        /**
         * 他人正在回源；可能带有旧值
         */
        LOCKED_BY_OTHER,

        /**
         * 记录不存在，本次调用成为锁主（冷启动）
         */
        MISS
    }
}
