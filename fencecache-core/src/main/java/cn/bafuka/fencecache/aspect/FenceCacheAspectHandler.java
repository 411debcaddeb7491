package cn.bafuka.fencecache.aspect;

import cn.bafuka.fencecache.core.FenceCacheContext;
import org.aspectj.lang.ProceedingJoinPoint;

/**
 * FenceCache 切面处理器接口
 * 负责把注解方法接入读穿透缓存
 */
public interface FenceCacheAspectHandler {

    /**
     * 处理 @FenceCacheable 注解的方法调用，原方法作为回源函数
     *
     * @param joinPoint 切点
     * @param context   上下文信息
     * @return 方法返回值
     * @throws Throwable 原方法抛出的异常
     */
    Object handleCache(ProceedingJoinPoint joinPoint, FenceCacheContext context) throws Throwable;

    /**
     * 处理 @FenceCacheEvict 注解的方法调用
     *
     * @param joinPoint        切点
     * @param context          上下文信息
     * @param beforeInvocation 是否在方法执行前标记删除
     * @return 方法返回值
     * @throws Throwable 异常
     */
    Object handleEvict(ProceedingJoinPoint joinPoint, FenceCacheContext context,
                       boolean beforeInvocation) throws Throwable;
}
