package cn.bafuka.fencecache.aspect.impl;

import cn.bafuka.fencecache.aspect.FenceCacheAspectHandler;
import cn.bafuka.fencecache.client.FenceCacheClient;
import cn.bafuka.fencecache.core.CacheLoader;
import cn.bafuka.fencecache.core.FenceCacheContext;
import cn.bafuka.fencecache.exception.FenceCacheException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Optional;

/**
 * FenceCache 切面处理器默认实现
 * <p>
 * 原方法作为回源函数交给 {@link FenceCacheClient}：返回 null 视为数据不存在，
 * 返回类型为 {@link Optional} 时按内部类型编解码并重新包装。
 * 回源失败时抛出原方法的原始异常。
 */
@Slf4j
public class DefaultFenceCacheAspectHandler implements FenceCacheAspectHandler {

    private final FenceCacheClient fenceCacheClient;

    public DefaultFenceCacheAspectHandler(FenceCacheClient fenceCacheClient) {
        this.fenceCacheClient = fenceCacheClient;
    }

    @Override
    public Object handleCache(ProceedingJoinPoint joinPoint, FenceCacheContext context) throws Throwable {
        if (context == null || context.getKey() == null) {
            return joinPoint.proceed();
        }

        boolean optionalReturn = isOptional(context.getReturnType());
        Type valueType = optionalReturn ? optionalValueType(context.getReturnType()) : context.getReturnType();

        log.debug("处理缓存: key={}, method={}", context.getKey(), context.getMethodName());

        CacheLoader<Object> loader = () -> invokeOriginal(joinPoint, context, optionalReturn);

        Optional<Object> value;
        try {
            value = fenceCacheClient.fetch(context.getKey(), context.getTtl(), valueType, loader);
        } catch (FenceCacheException e) {
            if (e.getReason() == FenceCacheException.Reason.LOADER_FAILED && e.getCause() != null) {
                throw unwrap(e.getCause());
            }
            throw e;
        }

        return optionalReturn ? value : value.orElse(null);
    }

    @Override
    public Object handleEvict(ProceedingJoinPoint joinPoint, FenceCacheContext context,
                              boolean beforeInvocation) throws Throwable {
        if (context == null || context.getKey() == null) {
            return joinPoint.proceed();
        }

        log.info("处理标记删除: key={}, beforeInvocation={}", context.getKey(), beforeInvocation);

        try {
            if (beforeInvocation) {
                fenceCacheClient.tagAsDeleted(context.getKey());
                return joinPoint.proceed();
            }
            Object result = joinPoint.proceed();
            fenceCacheClient.tagAsDeleted(context.getKey());
            return result;
        } catch (Throwable e) {
            log.error("标记删除处理失败: key={}, method={}", context.getKey(), context.getMethodName(), e);
            throw e;
        }
    }

    /**
     * 调用原方法作为回源
     */
    @SuppressWarnings("unchecked")
    private Optional<Object> invokeOriginal(ProceedingJoinPoint joinPoint, FenceCacheContext context,
                                            boolean optionalReturn) throws Exception {
        long startTime = System.currentTimeMillis();
        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new UndeclaredThrowableException(e);
        }

        log.debug("原方法回源完成: key={}, method={}.{}, duration={}ms",
                context.getKey(),
                context.getTargetClass() != null ? context.getTargetClass().getSimpleName() : "Unknown",
                context.getMethodName(),
                System.currentTimeMillis() - startTime);

        if (optionalReturn) {
            return result == null ? Optional.empty() : (Optional<Object>) result;
        }
        return Optional.ofNullable(result);
    }

    private static boolean isOptional(Type type) {
        if (type == Optional.class) {
            return true;
        }
        return type instanceof ParameterizedType && ((ParameterizedType) type).getRawType() == Optional.class;
    }

    /**
     * Optional&lt;T&gt; 的 T，原始类型 Optional 退化为 Object
     */
    private static Type optionalValueType(Type type) {
        if (type instanceof ParameterizedType) {
            return ((ParameterizedType) type).getActualTypeArguments()[0];
        }
        return Object.class;
    }

    private static Throwable unwrap(Throwable cause) {
        if (cause instanceof UndeclaredThrowableException && cause.getCause() != null) {
            return cause.getCause();
        }
        return cause;
    }
}
