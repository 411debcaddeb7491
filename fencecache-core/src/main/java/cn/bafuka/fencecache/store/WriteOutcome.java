package cn.bafuka.fencecache.store;

/**
 * 受 fencing token 保护的写操作结果
 */
public enum WriteOutcome {

    /**
     * 持有者匹配，写入成功
     */
    SUCCESS,

    /**
     * 持有者已不是当前锁主，未做任何修改
     */
    STALE
}
