package cn.bafuka.fencecache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 客户端配置（不可变）
 * 同一个客户端的所有调用共享一份
 */
@Value
@Builder(toBuilder = true)
public class FenceCacheOptions {

    /**
     * 是否强一致性
     * false（弱一致）：有旧值就立即返回，后台刷新；true（强一致）：等待新值或重试耗尽
     */
    @Builder.Default
    boolean strongConsistency = false;

    /**
     * 锁的基础时长，应不小于回源计算的最长耗时
     */
    @Builder.Default
    Duration lockExpire = Duration.ofSeconds(3);

    /**
     * 锁时长的随机附加范围 [0, jitter)
     */
    @Builder.Default
    Duration lockExpireJitter = Duration.ofSeconds(1);

    /**
     * 强一致性下抢锁失败后的轮询间隔
     */
    @Builder.Default
    Duration lockSleep = Duration.ofMillis(100);

    /**
     * 轮询间隔的随机附加范围 [0, jitter)
     */
    @Builder.Default
    Duration lockSleepJitter = Duration.ofMillis(50);

    /**
     * 强一致性下最大轮询次数，耗尽后返回最后看到的值
     */
    @Builder.Default
    int maxRetries = 30;

    /**
     * 空结果的逻辑过期时间，为 0 时不缓存空结果（回源得到空结果后删除记录）
     */
    @Builder.Default
    Duration emptyExpire = Duration.ofSeconds(60);

    /**
     * 标记删除或逻辑过期后记录的物理保留时间，期间旧值可被弱一致读取返回
     */
    @Builder.Default
    Duration delay = Duration.ofSeconds(10);

    /**
     * 过期时间的随机缩短比例，0.1 表示 600s 实际为 540s ~ 600s，防止缓存雪崩
     */
    @Builder.Default
    double randomExpireAdjustment = 0.1;

    /**
     * 降级开关：关闭读缓存，直接回源（Redis 故障时使用）
     */
    @Builder.Default
    boolean disableCacheRead = false;

    /**
     * 降级开关：关闭标记删除（Redis 故障时使用）
     */
    @Builder.Default
    boolean disableCacheDelete = false;

    /**
     * 后台刷新线程数
     */
    @Builder.Default
    int refreshThreads = 4;

    /**
     * 默认配置
     */
    public static FenceCacheOptions defaults() {
        return FenceCacheOptions.builder().build();
    }

    /**
     * 锁的最长持有时间（基础时长 + 抖动上限）
     */
    public Duration maxLockDuration() {
        return lockExpire.plus(lockExpireJitter);
    }

    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 配置非法
     */
    public void validate() {
        requireNonNegative("lockExpire", lockExpire);
        if (lockExpire.isZero()) {
            throw new IllegalArgumentException("lockExpire must be positive");
        }
        requireNonNegative("lockExpireJitter", lockExpireJitter);
        requireNonNegative("lockSleep", lockSleep);
        requireNonNegative("lockSleepJitter", lockSleepJitter);
        requireNonNegative("emptyExpire", emptyExpire);
        requireNonNegative("delay", delay);
        if (delay.isZero()) {
            // delay 为 0 时标记删除等同于物理删除
            throw new IllegalArgumentException("delay must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (randomExpireAdjustment < 0 || randomExpireAdjustment >= 1) {
            throw new IllegalArgumentException(
                    "randomExpireAdjustment must be in [0, 1): " + randomExpireAdjustment);
        }
        if (refreshThreads <= 0) {
            throw new IllegalArgumentException("refreshThreads must be positive: " + refreshThreads);
        }
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be null or negative: " + value);
        }
    }
}
