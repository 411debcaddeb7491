package cn.bafuka.fencecache.autoconfigure;

import cn.bafuka.fencecache.aspect.FenceCacheAspect;
import cn.bafuka.fencecache.aspect.FenceCacheAspectHandler;
import cn.bafuka.fencecache.aspect.impl.DefaultFenceCacheAspectHandler;
import cn.bafuka.fencecache.client.FenceCacheClient;
import cn.bafuka.fencecache.client.impl.FetchOrchestrator;
import cn.bafuka.fencecache.config.FenceCacheProperties;
import cn.bafuka.fencecache.spel.DefaultSpelExpressionParser;
import cn.bafuka.fencecache.spel.SpelExpressionParser;
import cn.bafuka.fencecache.store.StoreAdapter;
import cn.bafuka.fencecache.store.impl.CaffeineStoreAdapter;
import cn.bafuka.fencecache.store.impl.RedisTemplateStoreAdapter;
import cn.bafuka.fencecache.store.impl.RedissonStoreAdapter;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * FenceCache 自动配置类
 * <p>
 * 存储选择顺序：RedissonClient -> StringRedisTemplate -> 本地 Caffeine，
 * 用户自定义的 {@link StoreAdapter} / {@link FenceCacheClient} 优先。
 */
@Slf4j
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(FenceCacheProperties.class)
@ConditionalOnProperty(prefix = "fencecache", name = "enabled", havingValue = "true", matchIfMissing = true)
@AutoConfigureAfter(name = {
        "org.redisson.spring.starter.RedissonAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration"
})
@Import({
        FenceCacheAutoConfiguration.RedissonStoreConfiguration.class,
        FenceCacheAutoConfiguration.RedisTemplateStoreConfiguration.class,
        FenceCacheAutoConfiguration.LocalStoreConfiguration.class
})
public class FenceCacheAutoConfiguration {

    public FenceCacheAutoConfiguration() {
        log.info("FenceCache auto-configuration initializing...");
    }

    /**
     * FenceCache 客户端，容器关闭时等待后台刷新完成
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public FenceCacheClient fenceCacheClient(StoreAdapter storeAdapter, FenceCacheProperties properties) {
        return new FetchOrchestrator(storeAdapter, properties.toOptions());
    }

    /**
     * SpEL 表达式解析器
     */
    @Bean
    @ConditionalOnMissingBean
    public SpelExpressionParser spelExpressionParser() {
        return new DefaultSpelExpressionParser();
    }

    /**
     * 切面处理器
     */
    @Bean
    @ConditionalOnMissingBean
    public FenceCacheAspectHandler fenceCacheAspectHandler(FenceCacheClient fenceCacheClient) {
        return new DefaultFenceCacheAspectHandler(fenceCacheClient);
    }

    /**
     * AOP 切面
     */
    @Bean
    @ConditionalOnMissingBean
    public FenceCacheAspect fenceCacheAspect(SpelExpressionParser spelParser,
                                             FenceCacheAspectHandler aspectHandler,
                                             FenceCacheProperties properties) {
        return new FenceCacheAspect(spelParser, aspectHandler, properties.getKeyPrefix());
    }

    /**
     * Redisson 存储（存在 RedissonClient 时）
     */
    @Configuration
    @ConditionalOnClass(RedissonClient.class)
    static class RedissonStoreConfiguration {

        @Bean
        @ConditionalOnBean(RedissonClient.class)
        @ConditionalOnMissingBean(StoreAdapter.class)
        public RedissonStoreAdapter redissonStoreAdapter(RedissonClient redissonClient) {
            RedissonStoreAdapter adapter = new RedissonStoreAdapter(redissonClient);
            adapter.loadScripts();
            return adapter;
        }
    }

    /**
     * Spring Data Redis 存储（存在 StringRedisTemplate 时）
     */
    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    static class RedisTemplateStoreConfiguration {

        @Bean
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnMissingBean(StoreAdapter.class)
        public RedisTemplateStoreAdapter redisTemplateStoreAdapter(StringRedisTemplate stringRedisTemplate) {
            return new RedisTemplateStoreAdapter(stringRedisTemplate);
        }
    }

    /**
     * 本地存储（未配置 Redis 时兜底）
     */
    @Configuration
    static class LocalStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(StoreAdapter.class)
        public CaffeineStoreAdapter caffeineStoreAdapter(FenceCacheProperties properties) {
            log.warn("未发现 Redis 客户端，使用进程内存储，仅适用于单节点部署");
            return new CaffeineStoreAdapter(properties.getLocalMaximumSize(), Ticker.systemTicker());
        }
    }
}
