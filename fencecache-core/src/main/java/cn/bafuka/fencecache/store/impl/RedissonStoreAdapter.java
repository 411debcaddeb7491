package cn.bafuka.fencecache.store.impl;

import cn.bafuka.fencecache.exception.FenceCacheException;
import cn.bafuka.fencecache.store.LuaScript;
import cn.bafuka.fencecache.store.ReadResult;
import cn.bafuka.fencecache.store.ScriptReplies;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.WriteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Redisson 的存储适配器
 * <p>
 * 脚本通过 SCRIPT LOAD 预加载并缓存 SHA，执行时走 EVALSHA；
 * Redis 重启等原因导致 NOSCRIPT 时重新加载并重试一次。
 */
@Slf4j
public class RedissonStoreAdapter implements StoreAdapter {

    private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

    /**
     * Redisson 客户端
     */
    private final RedissonClient redissonClient;

    /**
     * 脚本 SHA 缓存
     */
    private final Map<LuaScript, String> shaCache = new ConcurrentHashMap<>();

    public RedissonStoreAdapter(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    /**
     * 预加载全部脚本
     * Redis 暂时不可用时不影响启动，首次调用时再加载
     */
    public void loadScripts() {
        for (LuaScript script : LuaScript.values()) {
            try {
                sha(script);
            } catch (RuntimeException e) {
                log.warn("预加载 Lua 脚本失败，首次调用时重试: script={}", script.getName(), e);
                return;
            }
        }
        log.info("Lua 脚本预加载完成: {}", shaCache);
    }

    @Override
    public ReadResult readAndLock(String key, long now, String newOwner, long newLockUntil, long lockPhysicalTtl) {
        List<Object> reply = eval(key, LuaScript.READ_AND_LOCK, RScript.ReturnType.MULTI,
                now, newLockUntil, newOwner, lockPhysicalTtl);
        return ScriptReplies.toReadResult(reply);
    }

    @Override
    public WriteOutcome writeResult(String key, String owner, byte[] value, long lockUntil, long physicalTtl) {
        Object reply = eval(key, LuaScript.WRITE_RESULT, RScript.ReturnType.INTEGER,
                value, owner, lockUntil, physicalTtl);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public WriteOutcome release(String key, String owner, long now) {
        Object reply = eval(key, LuaScript.RELEASE, RScript.ReturnType.INTEGER, owner, now);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public WriteOutcome clear(String key, String owner) {
        Object reply = eval(key, LuaScript.CLEAR, RScript.ReturnType.INTEGER, owner);
        return ScriptReplies.toWriteOutcome(reply);
    }

    @Override
    public boolean tagAsDeleted(String key, long now, long delay) {
        Object reply = eval(key, LuaScript.TAG_AS_DELETED, RScript.ReturnType.INTEGER, now, delay);
        return ScriptReplies.toLong(reply) == 1L;
    }

    /**
     * 执行脚本，NOSCRIPT 时重新加载后重试一次
     */
    private <R> R eval(String key, LuaScript script, RScript.ReturnType returnType, Object... args) {
        Object[] values = Arrays.stream(args).map(ScriptReplies::arg).toArray();
        List<Object> keys = Collections.singletonList(key);
        RScript rScript = redissonClient.getScript(ByteArrayCodec.INSTANCE);

        try {
            return rScript.evalSha(RScript.Mode.READ_WRITE, sha(script), returnType, keys, values);
        } catch (RuntimeException e) {
            if (!isNoscriptError(e)) {
                throw FenceCacheException.storeUnavailable(key, script.getName(), e);
            }
            log.warn("[NOSCRIPT] 脚本需要重新加载: script={}", script.getName());
            shaCache.remove(script);
        }

        try {
            return rScript.evalSha(RScript.Mode.READ_WRITE, sha(script), returnType, keys, values);
        } catch (RuntimeException e) {
            throw FenceCacheException.storeUnavailable(key, script.getName(), e);
        }
    }

    private String sha(LuaScript script) {
        return shaCache.computeIfAbsent(script,
                s -> redissonClient.getScript(StringCodec.INSTANCE).scriptLoad(s.getSource()));
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
