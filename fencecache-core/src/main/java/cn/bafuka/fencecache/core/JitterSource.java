package cn.bafuka.fencecache.core;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 随机抖动来源
 * 锁时长、重试间隔、过期时间的随机量都从这里取，测试时可以替换为固定值
 */
public interface JitterSource {

    /**
     * 默认实现，基于 ThreadLocalRandom
     */
    JitterSource RANDOM = new JitterSource() {
        @Override
        public long nextLong(long bound) {
            return bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound);
        }

        @Override
        public double nextDouble() {
            return ThreadLocalRandom.current().nextDouble();
        }
    };

    /**
     * 返回 [0, bound) 内的随机数，bound &lt;= 0 时返回 0
     */
    long nextLong(long bound);

    /**
     * 返回 [0, 1) 内的随机数
     */
    double nextDouble();
}
