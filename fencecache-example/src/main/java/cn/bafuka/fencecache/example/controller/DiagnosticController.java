package cn.bafuka.fencecache.example.controller;

import cn.bafuka.fencecache.client.FenceCacheClient;
import cn.bafuka.fencecache.core.CacheStats;
import cn.bafuka.fencecache.store.StoreAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看 FenceCache 的运行状态和配置
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private FenceCacheClient fenceCacheClient;

    @Autowired
    private StoreAdapter storeAdapter;

    /**
     * 查看统计信息
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = fenceCacheClient.getStats();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("stats", stats);
        result.put("hitRate", String.format("%.2f%%", stats.hitRate() * 100));
        return result;
    }

    /**
     * 查看客户端配置
     */
    @GetMapping("/options")
    public Map<String, Object> getOptions() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("options", fenceCacheClient.getOptions());
        result.put("store", storeAdapter.getClass().getSimpleName());
        return result;
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);

        CacheStats stats = fenceCacheClient.getStats();
        boolean degraded = fenceCacheClient.getOptions().isDisableCacheRead()
                || fenceCacheClient.getOptions().isDisableCacheDelete();
        result.put("store", storeAdapter.getClass().getSimpleName());
        result.put("degraded", degraded);
        result.put("loadFailures", stats.getLoadFailureCount());
        result.put("message", degraded ? "警告：缓存已降级" : "FenceCache 运行正常");
        return result;
    }
}
