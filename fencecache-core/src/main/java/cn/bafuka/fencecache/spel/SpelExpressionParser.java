package cn.bafuka.fencecache.spel;

import org.aspectj.lang.ProceedingJoinPoint;

/**
 * SpEL 表达式解析器接口
 * 用于解析注解中的缓存键和条件
 */
public interface SpelExpressionParser {

    /**
     * 解析缓存键
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return 缓存键，表达式为空、求值失败或结果为 null 时返回 null
     */
    String parseKey(String expression, ProceedingJoinPoint joinPoint);

    /**
     * 解析条件表达式
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return true 表示条件满足，空表达式视为满足
     */
    boolean parseCondition(String expression, ProceedingJoinPoint joinPoint);
}
