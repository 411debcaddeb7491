package cn.bafuka.fencecache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hitCount;
    private long missCount;
    private long staleServedCount;
    private long loadSuccessCount;
    private long loadFailureCount;
    private long staleWriteDiscardedCount;
    private long retriesExhaustedCount;
    private long backgroundRefreshCount;

    /**
     * 计算命中率，返回旧值也算命中
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double hitRate() {
        long hits = hitCount + staleServedCount;
        long requestCount = hits + missCount;
        return requestCount == 0 ? 1.0 : (double) hits / requestCount;
    }
}
