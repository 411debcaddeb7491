package cn.bafuka.fencecache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * FenceCache 读缓存注解
 * 标注在查询方法上，方法本身作为回源函数；返回 null 视为数据不存在（缓存空结果）
 *
 * 使用示例：
 * <pre>
 * {@code
 * @FenceCacheable(key = "'product:' + #id", ttl = 10, timeUnit = TimeUnit.MINUTES)
 * public Product getProduct(Long id) {
 *     return productMapper.selectById(id);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FenceCacheable {

    /**
     * 缓存键表达式（支持 SpEL）
     * 例如：'user:' + #userId, #user.id, #p0
     *
     * @return SpEL 表达式
     */
    String key();

    /**
     * 值的逻辑有效期
     *
     * @return 默认 600
     */
    long ttl() default 600;

    /**
     * 有效期单位
     *
     * @return 默认秒
     */
    TimeUnit timeUnit() default TimeUnit.SECONDS;

    /**
     * 条件表达式（可选）
     * 只有满足条件时才走缓存，例如：#userId > 0
     *
     * @return SpEL 表达式，默认为空表示总是启用
     */
    String condition() default "";
}
