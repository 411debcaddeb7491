package cn.bafuka.fencecache.aspect;

import cn.bafuka.fencecache.annotation.FenceCacheEvict;
import cn.bafuka.fencecache.annotation.FenceCacheable;
import cn.bafuka.fencecache.core.FenceCacheContext;
import cn.bafuka.fencecache.spel.SpelExpressionParser;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import java.lang.reflect.Method;
import java.time.Duration;

/**
 * FenceCache AOP 切面
 * 拦截 @FenceCacheable 和 @FenceCacheEvict 注解
 */
@Slf4j
@Aspect
public class FenceCacheAspect {

    /**
     * SpEL 表达式解析器
     */
    private final SpelExpressionParser spelParser;

    /**
     * 切面处理器
     */
    private final FenceCacheAspectHandler aspectHandler;

    /**
     * 缓存键前缀
     */
    private final String keyPrefix;

    public FenceCacheAspect(SpelExpressionParser spelParser, FenceCacheAspectHandler aspectHandler, String keyPrefix) {
        this.spelParser = spelParser;
        this.aspectHandler = aspectHandler;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    /**
     * 拦截 @FenceCacheable 注解
     */
    @Around("@annotation(fenceCacheable)")
    public Object aroundCache(ProceedingJoinPoint joinPoint, FenceCacheable fenceCacheable) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        if (method.getReturnType() == void.class) {
            log.warn("@FenceCacheable 标注在无返回值方法上，忽略: method={}", method.getName());
            return joinPoint.proceed();
        }

        if (!spelParser.parseCondition(fenceCacheable.condition(), joinPoint)) {
            log.debug("Condition not met, skipping cache: method={}", method.getName());
            return joinPoint.proceed();
        }

        String key = spelParser.parseKey(fenceCacheable.key(), joinPoint);
        if (key == null) {
            log.warn("Failed to parse cache key, skipping: method={}, expression={}",
                    method.getName(), fenceCacheable.key());
            return joinPoint.proceed();
        }

        FenceCacheContext context = FenceCacheContext.builder()
                .key(keyPrefix + key)
                .ttl(Duration.ofMillis(fenceCacheable.timeUnit().toMillis(fenceCacheable.ttl())))
                .returnType(method.getGenericReturnType())
                .targetClass(joinPoint.getTarget().getClass())
                .methodName(method.getName())
                .build();

        return aspectHandler.handleCache(joinPoint, context);
    }

    /**
     * 拦截 @FenceCacheEvict 注解
     */
    @Around("@annotation(fenceCacheEvict)")
    public Object aroundEvict(ProceedingJoinPoint joinPoint, FenceCacheEvict fenceCacheEvict) throws Throwable {
        String key = spelParser.parseKey(fenceCacheEvict.key(), joinPoint);
        if (key == null) {
            log.warn("Failed to parse cache key for evict, skipping: method={}, expression={}",
                    joinPoint.getSignature().getName(), fenceCacheEvict.key());
            return joinPoint.proceed();
        }

        FenceCacheContext context = FenceCacheContext.builder()
                .key(keyPrefix + key)
                .targetClass(joinPoint.getTarget().getClass())
                .methodName(joinPoint.getSignature().getName())
                .build();

        return aspectHandler.handleEvict(joinPoint, context, fenceCacheEvict.beforeInvocation());
    }
}
