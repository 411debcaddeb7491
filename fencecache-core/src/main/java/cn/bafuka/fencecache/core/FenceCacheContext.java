package cn.bafuka.fencecache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.lang.reflect.Type;
import java.time.Duration;

/**
 * 注解调用上下文
 * 在切面和处理器之间传递解析后的缓存键等信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FenceCacheContext {

    /**
     * 缓存键（已加前缀）
     */
    private String key;

    /**
     * 逻辑有效期，标记删除时为空
     */
    private Duration ttl;

    /**
     * 方法的泛型返回类型
     */
    private Type returnType;

    /**
     * 目标方法类
     */
    private Class<?> targetClass;

    /**
     * 目标方法名
     */
    private String methodName;
}
