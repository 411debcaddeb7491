package cn.bafuka.fencecache.config;

import cn.bafuka.fencecache.core.FenceCacheOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * FenceCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "fencecache")
public class FenceCacheProperties {

    /**
     * 是否启用 FenceCache
     */
    private boolean enabled = true;

    /**
     * 注解缓存键前缀，为空时不加前缀
     */
    private String keyPrefix = "";

    private boolean strongConsistency = false;

    private Duration lockExpire = Duration.ofSeconds(3);

    private Duration lockExpireJitter = Duration.ofSeconds(1);

    private Duration lockSleep = Duration.ofMillis(100);

    private Duration lockSleepJitter = Duration.ofMillis(50);

    private int maxRetries = 30;

    /**
     * 空结果缓存时间
     */
    private Duration emptyExpire = Duration.ofSeconds(60);

    /**
     * 标记删除后旧值的保留时间
     */
    private Duration delay = Duration.ofSeconds(10);

    private double randomExpireAdjustment = 0.1;

    /**
     * 降级开关
     */
    private boolean disableCacheRead = false;

    private boolean disableCacheDelete = false;

    private int refreshThreads = 4;

    /**
     * 本地存储最大容量（未配置 Redis 时使用）
     */
    private long localMaximumSize = 100_000L;

    /**
     * 转换为客户端配置
     */
    public FenceCacheOptions toOptions() {
        return FenceCacheOptions.builder()
                .strongConsistency(strongConsistency)
                .lockExpire(lockExpire)
                .lockExpireJitter(lockExpireJitter)
                .lockSleep(lockSleep)
                .lockSleepJitter(lockSleepJitter)
                .maxRetries(maxRetries)
                .emptyExpire(emptyExpire)
                .delay(delay)
                .randomExpireAdjustment(randomExpireAdjustment)
                .disableCacheRead(disableCacheRead)
                .disableCacheDelete(disableCacheDelete)
                .refreshThreads(refreshThreads)
                .build();
    }
}
