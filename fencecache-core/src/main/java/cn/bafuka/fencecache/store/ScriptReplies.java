package cn.bafuka.fencecache.store;

import cn.bafuka.fencecache.core.CacheRecord;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Lua 脚本返回值与参数的转换工具
 * 两个 Redis 适配器共用
 */
public final class ScriptReplies {

    private ScriptReplies() {
    }

    /**
     * 解析 READ_AND_LOCK 的返回值
     *
     * @param reply {value, lockUntil, lockOwner, flag}
     * @return 读取结果
     */
    public static ReadResult toReadResult(List<?> reply) {
        if (reply == null || reply.size() < 4) {
            throw new IllegalStateException("Unexpected readAndLock reply: " + reply);
        }
        byte[] value = toBytes(reply.get(0));
        String lockUntil = toText(reply.get(1));
        String lockOwner = toText(reply.get(2));
        CacheRecord record = CacheRecord.builder()
                .value(value)
                .lockUntil(lockUntil == null ? null : parseMillis(lockUntil))
                .lockOwner(lockOwner)
                .build();
        return ReadResult.of(record, LuaScript.LOCKED.equals(toText(reply.get(3))));
    }

    /**
     * 解析 1 / 0 形式的写操作返回值
     */
    public static WriteOutcome toWriteOutcome(Object reply) {
        return toLong(reply) == 1L ? WriteOutcome.SUCCESS : WriteOutcome.STALE;
    }

    /**
     * 解析整数返回值
     */
    public static long toLong(Object reply) {
        if (reply instanceof Number) {
            return ((Number) reply).longValue();
        }
        String text = toText(reply);
        return text == null ? 0L : Long.parseLong(text);
    }

    /**
     * 脚本参数统一按 UTF-8 字节传递
     */
    public static byte[] arg(Object value) {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
    }

    private static long parseMillis(String text) {
        // Lua 里 tonumber 后写回的值可能带小数部分
        int dot = text.indexOf('.');
        return Long.parseLong(dot >= 0 ? text.substring(0, dot) : text);
    }

    private static byte[] toBytes(Object element) {
        if (element == null) {
            return null;
        }
        if (element instanceof byte[]) {
            return (byte[]) element;
        }
        return element.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String toText(Object element) {
        if (element == null) {
            return null;
        }
        if (element instanceof byte[]) {
            return new String((byte[]) element, StandardCharsets.UTF_8);
        }
        return element.toString();
    }
}
