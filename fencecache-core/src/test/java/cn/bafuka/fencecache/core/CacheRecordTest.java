package cn.bafuka.fencecache.core;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * CacheRecord 单元测试
 * 记录状态机的四种状态判定
 */
public class CacheRecordTest {

    private static final long NOW = 1_000_000L;

    @Test
    public void testAbsent() {
        assertFalse(CacheRecord.ABSENT.exists());
        assertFalse(CacheRecord.ABSENT.hasValue());
        assertFalse(CacheRecord.ABSENT.isLockedAt(NOW));
        assertFalse(CacheRecord.ABSENT.isValidAt(NOW));
    }

    /**
     * 测试加锁计算中
     */
    @Test
    public void testLocked() {
        CacheRecord record = CacheRecord.builder().lockUntil(NOW + 1).lockOwner("a").build();

        assertTrue(record.exists());
        assertTrue(record.isLockedAt(NOW));
        assertFalse(record.isValidAt(NOW));
        assertFalse(record.isLockedAt(NOW + 1));
    }

    /**
     * 测试有效值
     */
    @Test
    public void testValid() {
        CacheRecord record = CacheRecord.builder().value(new byte[]{1}).lockUntil(NOW + 1).build();

        assertTrue(record.isValidAt(NOW));
        assertFalse(record.isLockedAt(NOW));
        assertFalse(record.isNegative());
    }

    /**
     * 测试逻辑删除
     */
    @Test
    public void testLogicallyDeleted() {
        CacheRecord record = CacheRecord.builder().value(new byte[]{1}).lockUntil(NOW).build();

        assertTrue(record.hasValue());
        assertFalse(record.isValidAt(NOW));
        assertFalse(record.isLockedAt(NOW));
    }

    /**
     * 测试空结果
     */
    @Test
    public void testNegative() {
        CacheRecord record = CacheRecord.builder().value(new byte[0]).lockUntil(NOW + 1).build();

        assertTrue(record.isNegative());
        assertTrue(record.isValidAt(NOW));
    }
}
