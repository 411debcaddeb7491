package cn.bafuka.fencecache.store;

/**
 * 记录读写使用的 Lua 脚本
 * <p>
 * 记录是一个 Hash：value / lockUntil / lockOwner / dirty，时间单位为毫秒。
 * 所有脚本只有一个 KEY。
 */
public enum LuaScript {

    /**
     * ARGV: now, newLockUntil, newOwner, lockPhysicalTtl
     * 返回 {value, lockUntil, lockOwner, 'LOCKED' 或 ''}，前三项为加锁前的状态
     */
    READ_AND_LOCK("readAndLock",
            "local v = redis.call('HGET', KEYS[1], 'value')\n" +
            "local lu = redis.call('HGET', KEYS[1], 'lockUntil')\n" +
            "local lo = redis.call('HGET', KEYS[1], 'lockOwner')\n" +
            "if (lu == false and v == false) or (lu ~= false and tonumber(lu) <= tonumber(ARGV[1])) then\n" +
            "    redis.call('HSET', KEYS[1], 'lockUntil', ARGV[2])\n" +
            "    redis.call('HSET', KEYS[1], 'lockOwner', ARGV[3])\n" +
            "    redis.call('HDEL', KEYS[1], 'dirty')\n" +
            "    if redis.call('PTTL', KEYS[1]) < tonumber(ARGV[4]) then\n" +
            "        redis.call('PEXPIRE', KEYS[1], ARGV[4])\n" +
            "    end\n" +
            "    return {v, lu, lo, 'LOCKED'}\n" +
            "end\n" +
            "return {v, lu, lo, ''}"),

    /**
     * ARGV: value, owner, lockUntil, physicalTtl
     * 返回 1 写入成功，0 锁主不匹配
     */
    WRITE_RESULT("writeResult",
            "if redis.call('HGET', KEYS[1], 'lockOwner') ~= ARGV[2] then\n" +
            "    return 0\n" +
            "end\n" +
            "local lu = ARGV[3]\n" +
            "if redis.call('HEXISTS', KEYS[1], 'dirty') == 1 then\n" +
            "    lu = '0'\n" +
            "end\n" +
            "redis.call('HSET', KEYS[1], 'value', ARGV[1])\n" +
            "redis.call('HSET', KEYS[1], 'lockUntil', lu)\n" +
            "redis.call('HDEL', KEYS[1], 'lockOwner', 'dirty')\n" +
            "redis.call('PEXPIRE', KEYS[1], ARGV[4])\n" +
            "return 1"),

    /**
     * ARGV: owner, now
     * 返回 1 释放成功，0 锁主不匹配
     */
    RELEASE("release",
            "if redis.call('HGET', KEYS[1], 'lockOwner') ~= ARGV[1] then\n" +
            "    return 0\n" +
            "end\n" +
            "redis.call('HSET', KEYS[1], 'lockUntil', ARGV[2])\n" +
            "redis.call('HDEL', KEYS[1], 'lockOwner', 'dirty')\n" +
            "return 1"),

    /**
     * ARGV: owner
     * 返回 1 已删除，0 锁主不匹配
     */
    CLEAR("clear",
            "if redis.call('HGET', KEYS[1], 'lockOwner') ~= ARGV[1] then\n" +
            "    return 0\n" +
            "end\n" +
            "redis.call('DEL', KEYS[1])\n" +
            "return 1"),

    /**
     * ARGV: now, delay
     * 返回 1 已标记，0 记录不存在
     */
    TAG_AS_DELETED("tagAsDeleted",
            "if redis.call('EXISTS', KEYS[1]) == 0 then\n" +
            "    return 0\n" +
            "end\n" +
            "local lo = redis.call('HGET', KEYS[1], 'lockOwner')\n" +
            "local lu = redis.call('HGET', KEYS[1], 'lockUntil')\n" +
            "if lo ~= false and lu ~= false and tonumber(lu) > tonumber(ARGV[1]) then\n" +
            "    redis.call('HSET', KEYS[1], 'dirty', '1')\n" +
            "    return 1\n" +
            "end\n" +
            "redis.call('HSET', KEYS[1], 'lockUntil', ARGV[1])\n" +
            "redis.call('HDEL', KEYS[1], 'lockOwner')\n" +
            "redis.call('PEXPIRE', KEYS[1], ARGV[2])\n" +
            "return 1");

    /**
     * 返回值中表示加锁成功的标记
     */
    public static final String LOCKED = "LOCKED";

    private final String name;

    private final String source;

    LuaScript(String name, String source) {
        this.name = name;
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }
}
