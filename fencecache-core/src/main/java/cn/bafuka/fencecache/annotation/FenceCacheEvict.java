package cn.bafuka.fencecache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * FenceCache 标记删除注解
 * 标注在更新方法上，方法执行后对缓存键做标记删除
 *
 * 使用示例：
 * <pre>
 * {@code
 * @FenceCacheEvict(key = "'product:' + #product.id")
 * public void updateProduct(Product product) {
 *     productMapper.updateById(product);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FenceCacheEvict {

    /**
     * 缓存键表达式（支持 SpEL）
     *
     * @return SpEL 表达式
     */
    String key();

    /**
     * 是否在方法执行前标记删除
     * false（默认）：数据库更新成功后再标记，方法抛异常时不标记
     *
     * @return 默认 false
     */
    boolean beforeInvocation() default false;
}
