package cn.bafuka.fencecache.store.impl;

import cn.bafuka.fencecache.exception.FenceCacheException;
import cn.bafuka.fencecache.store.LuaScript;
import cn.bafuka.fencecache.store.ReadResult;
import cn.bafuka.fencecache.store.ScriptReplies;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.WriteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Spring Data Redis 的存储适配器
 * <p>
 * 没有 Redisson 时使用。参数与返回值都按原始字节处理，
 * 执行时走 EVALSHA，NOSCRIPT 时回退为 EVAL（EVAL 会顺带把脚本缓存到服务端）。
 */
@Slf4j
public class RedisTemplateStoreAdapter implements StoreAdapter {

    private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

    /**
     * Redis 模板
     */
    private final StringRedisTemplate redisTemplate;

    /**
     * 预构建的脚本（SHA 在首次使用时计算）
     */
    private final Map<LuaScript, RedisScript<?>> scripts = new EnumMap<>(LuaScript.class);

    public RedisTemplateStoreAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        for (LuaScript script : LuaScript.values()) {
            scripts.put(script, RedisScript.of(script.getSource()));
        }
    }

    @Override
    public ReadResult readAndLock(String key, long now, String newOwner, long newLockUntil, long lockPhysicalTtl) {
        List<Object> reply = eval(key, LuaScript.READ_AND_LOCK, ReturnType.MULTI,
                now, newLockUntil, newOwner, lockPhysicalTtl);
        return ScriptReplies.toReadResult(reply);
    }

    @Override
    public WriteOutcome writeResult(String key, String owner, byte[] value, long lockUntil, long physicalTtl) {
        Long reply = eval(key, LuaScript.WRITE_RESULT, ReturnType.INTEGER, value, owner, lockUntil, physicalTtl);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public WriteOutcome release(String key, String owner, long now) {
        Long reply = eval(key, LuaScript.RELEASE, ReturnType.INTEGER, owner, now);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public WriteOutcome clear(String key, String owner) {
        Long reply = eval(key, LuaScript.CLEAR, ReturnType.INTEGER, owner);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public boolean tagAsDeleted(String key, long now, long delay) {
        Long reply = eval(key, LuaScript.TAG_AS_DELETED, ReturnType.INTEGER, now, delay);
        return ScriptReplies.toLong(reply) == 1L;
    }

    private <R> R eval(String key, LuaScript script, ReturnType returnType, Object... args) {
        byte[][] keysAndArgs = new byte[args.length + 1][];
        keysAndArgs[0] = key.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < args.length; i++) {
            keysAndArgs[i + 1] = ScriptReplies.arg(args[i]);
        }
        RedisScript<?> redisScript = scripts.get(script);

        try {
            return redisTemplate.execute((RedisCallback<R>) connection ->
                    evalSha(connection, redisScript, returnType, keysAndArgs));
        } catch (DataAccessException e) {
            log.error("Redis 脚本执行失败: script={}, key={}", script.getName(), key, e);
            throw FenceCacheException.storeUnavailable(key, script.getName(), e);
        }
    }

    private <R> R evalSha(RedisConnection connection, RedisScript<?> script, ReturnType returnType,
                          byte[][] keysAndArgs) {
        try {
            return connection.scriptingCommands().evalSha(script.getSha1(), returnType, 1, keysAndArgs);
        } catch (DataAccessException e) {
            if (!isNoscriptError(e)) {
                throw e;
            }
            log.warn("[NOSCRIPT] 脚本未缓存，改用 EVAL: sha={}", script.getSha1());
            return connection.scriptingCommands().eval(
                    script.getScriptAsString().getBytes(StandardCharsets.UTF_8), returnType, 1, keysAndArgs);
        }
    }

    private boolean isNoscriptError(Throwable e) {
        String message = e.getMessage();
        if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) {
            return true;
        }
        Throwable cause = e.getCause();
        return cause != null && cause != e && isNoscriptError(cause);
    }
}
