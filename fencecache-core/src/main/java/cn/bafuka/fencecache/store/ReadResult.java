package cn.bafuka.fencecache.store;

import cn.bafuka.fencecache.core.CacheRecord;
import lombok.Value;

/**
 * 读取并尝试加锁的结果
 * record 是加锁前的状态，acquired 表示本次调用是否成为新的锁主
 */
@Value
public class ReadResult {

    CacheRecord record;

    boolean acquired;

    public static ReadResult of(CacheRecord record, boolean acquired) {
        return new ReadResult(record, acquired);
    }
}
