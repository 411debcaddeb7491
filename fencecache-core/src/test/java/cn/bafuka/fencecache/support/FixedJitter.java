package cn.bafuka.fencecache.support;

import cn.bafuka.fencecache.core.JitterSource;

/**
 * 固定抖动：nextLong 总是返回 0，nextDouble 返回构造时给定的值
 */
public class FixedJitter implements JitterSource {

    private final double fraction;

    public FixedJitter() {
        this(0.0);
    }

    public FixedJitter(double fraction) {
        this.fraction = fraction;
    }

    @Override
    public long nextLong(long bound) {
        return 0L;
    }

    @Override
    public double nextDouble() {
        return fraction;
    }
}
