package cn.bafuka.fencecache.store;

import cn.bafuka.fencecache.core.CacheRecord;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.Assert.*;

/**
 * 存储适配器的公共行为
 * <p>
 * 三个适配器（Redisson / RedisTemplate 执行同一组 Lua 脚本，Caffeine 为进程内实现）跑同一组用例，
 * 时间全部显式传入；物理 TTL 取足够大的值，用例执行期间不会过期。
 */
public abstract class StoreAdapterContract {

    protected static final long NOW = 1_700_000_000_000L;
    protected static final long LOCK_TTL = 3_000L;
    protected static final long PHYSICAL_LOCK_TTL = 60_000L;
    protected static final long PHYSICAL_TTL = 120_000L;
    protected static final long DELAY = 60_000L;

    private String key;

    /**
     * 被测适配器
     */
    protected abstract StoreAdapter store();

    @Before
    public void newKey() {
        // 共享 Redis 中每个用例使用独立的键
        key = "contract:" + UUID.randomUUID();
    }

    /**
     * 测试记录不存在时获得锁
     */
    @Test
    public void testReadAndLock_AcquireOnAbsent() {
        ReadResult result = store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertTrue(result.isAcquired());
        assertFalse(result.getRecord().exists());
    }

    /**
     * 测试他人持锁时不能加锁，返回当前锁主
     */
    @Test
    public void testReadAndLock_LockedByOther() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        ReadResult result = store().readAndLock(key, NOW + 1, "owner-b", NOW + 1 + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertFalse(result.isAcquired());
        CacheRecord record = result.getRecord();
        assertNull(record.getValue());
        assertEquals("owner-a", record.getLockOwner());
        assertEquals(Long.valueOf(NOW + LOCK_TTL), record.getLockUntil());
        assertTrue(record.isLockedAt(NOW + 1));
    }

    /**
     * 测试锁过期后被新调用方接管
     */
    @Test
    public void testReadAndLock_TakeOverExpiredLock() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        ReadResult result = store().readAndLock(key, NOW + LOCK_TTL, "owner-b",
                NOW + 2 * LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertTrue(result.isAcquired());
        assertEquals("owner-a", result.getRecord().getLockOwner());

        ReadResult next = store().readAndLock(key, NOW + LOCK_TTL + 1, "owner-c",
                NOW + 3 * LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(next.isAcquired());
        assertEquals("owner-b", next.getRecord().getLockOwner());
    }

    /**
     * 测试锁主写回后记录有效，锁被清除
     */
    @Test
    public void testWriteResult_OwnerWriteIsReadable() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertEquals(WriteOutcome.SUCCESS,
                store().writeResult(key, "owner-a", bytes("v1"), NOW + 60_000, PHYSICAL_TTL));

        ReadResult result = store().readAndLock(key, NOW + 1, "owner-b", NOW + 1 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(result.isAcquired());
        CacheRecord record = result.getRecord();
        assertArrayEquals(bytes("v1"), record.getValue());
        assertNull(record.getLockOwner());
        assertEquals(Long.valueOf(NOW + 60_000), record.getLockUntil());
        assertTrue(record.isValidAt(NOW + 1));
    }

    /**
     * 测试 fencing：锁被接管后原锁主的写回不生效
     */
    @Test
    public void testWriteResult_StaleOwnerIsNoop() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);
        store().readAndLock(key, NOW + LOCK_TTL, "owner-b", NOW + 2 * LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertEquals(WriteOutcome.SUCCESS,
                store().writeResult(key, "owner-b", bytes("from-b"), NOW + 60_000, PHYSICAL_TTL));
        assertEquals(WriteOutcome.STALE,
                store().writeResult(key, "owner-a", bytes("from-a"), NOW + 60_000, PHYSICAL_TTL));

        ReadResult result = store().readAndLock(key, NOW + LOCK_TTL + 1, "owner-c",
                NOW + 3 * LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(result.isAcquired());
        assertArrayEquals(bytes("from-b"), result.getRecord().getValue());
    }

    /**
     * 测试释放：只有锁主能释放，释放后立即可被重新加锁
     */
    @Test
    public void testRelease() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertEquals(WriteOutcome.STALE, store().release(key, "owner-x", NOW + 10));
        assertEquals(WriteOutcome.SUCCESS, store().release(key, "owner-a", NOW + 10));

        ReadResult result = store().readAndLock(key, NOW + 10, "owner-b", NOW + 10 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertTrue(result.isAcquired());
        assertNull(result.getRecord().getLockOwner());
    }

    /**
     * 测试标记删除幂等：标记两次与一次效果相同，旧值保留
     */
    @Test
    public void testTagAsDeleted_Idempotent() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);
        store().writeResult(key, "owner-a", bytes("v1"), NOW + 60_000, PHYSICAL_TTL);

        assertTrue(store().tagAsDeleted(key, NOW + 5, DELAY));
        assertTrue(store().tagAsDeleted(key, NOW + 5, DELAY));

        ReadResult result = store().readAndLock(key, NOW + 5, "owner-b", NOW + 5 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertTrue(result.isAcquired());
        assertArrayEquals(bytes("v1"), result.getRecord().getValue());
        assertEquals(Long.valueOf(NOW + 5), result.getRecord().getLockUntil());
    }

    /**
     * 测试标记删除不存在的键：不创建记录
     */
    @Test
    public void testTagAsDeleted_Absent() {
        assertFalse(store().tagAsDeleted(key, NOW, DELAY));

        ReadResult result = store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(result.getRecord().exists());
    }

    /**
     * 测试回源中标记删除：锁不被覆盖，锁主写回的值立即过期
     */
    @Test
    public void testTagAsDeleted_DuringLiveLock() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertTrue(store().tagAsDeleted(key, NOW + 10, DELAY));

        ReadResult during = store().readAndLock(key, NOW + 20, "owner-b", NOW + 20 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(during.isAcquired());
        assertEquals("owner-a", during.getRecord().getLockOwner());

        assertEquals(WriteOutcome.SUCCESS,
                store().writeResult(key, "owner-a", bytes("v2"), NOW + 60_000, PHYSICAL_TTL));

        ReadResult after = store().readAndLock(key, NOW + 30, "owner-c", NOW + 30 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertTrue(after.isAcquired());
        assertArrayEquals(bytes("v2"), after.getRecord().getValue());
        assertEquals(Long.valueOf(0L), after.getRecord().getLockUntil());
    }

    /**
     * 测试空结果：空字符串作为值保存，读回为空数组而不是不存在
     */
    @Test
    public void testWriteResult_NegativeValue() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);
        store().writeResult(key, "owner-a", new byte[0], NOW + 5_000, PHYSICAL_TTL);

        ReadResult hit = store().readAndLock(key, NOW + 1, "owner-b", NOW + 1 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertFalse(hit.isAcquired());
        assertTrue(hit.getRecord().isNegative());

        ReadResult expired = store().readAndLock(key, NOW + 5_000, "owner-c",
                NOW + 5_000 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertTrue(expired.isAcquired());
        assertTrue(expired.getRecord().isNegative());
    }

    /**
     * 测试按锁主删除记录：非锁主无效，删除后回到冷启动
     */
    @Test
    public void testClear() {
        store().readAndLock(key, NOW, "owner-a", NOW + LOCK_TTL, PHYSICAL_LOCK_TTL);

        assertEquals(WriteOutcome.STALE, store().clear(key, "owner-x"));
        assertEquals(WriteOutcome.SUCCESS, store().clear(key, "owner-a"));

        ReadResult result = store().readAndLock(key, NOW + 1, "owner-b", NOW + 1 + LOCK_TTL, PHYSICAL_LOCK_TTL);
        assertTrue(result.isAcquired());
        assertFalse(result.getRecord().exists());
    }

    protected static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
