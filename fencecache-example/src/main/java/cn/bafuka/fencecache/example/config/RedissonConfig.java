package cn.bafuka.fencecache.example.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson 客户端配置
 * 存在 RedissonClient 时 FenceCache 使用 Redisson 执行脚本；关闭后退回 StringRedisTemplate
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "example.redisson", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(@Value("${spring.redis.host:localhost}") String host,
                                         @Value("${spring.redis.port:6379}") int port,
                                         @Value("${spring.redis.password:}") String password,
                                         @Value("${spring.redis.database:0}") int database) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setPassword(StringUtils.hasText(password) ? password : null);

        log.info("创建 RedissonClient: address={}:{}, database={}", host, port, database);
        return Redisson.create(config);
    }
}
