package cn.bafuka.fencecache.support;

import org.junit.Assume;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * 脚本集成测试共用的 Redis 容器
 * <p>
 * 整个 JVM 只启动一次；Docker 不可用时通过 Assume 跳过测试，而不是失败。
 */
public final class RedisContainerSupport {

    private static final DockerImageName IMAGE = DockerImageName.parse("redis:7-alpine");

    private static final int REDIS_PORT = 6379;

    private static GenericContainer<?> redis;

    private RedisContainerSupport() {
    }

    /**
     * 获取已启动的容器，Docker 不可用时跳过当前测试类
     */
    public static synchronized GenericContainer<?> redis() {
        Assume.assumeTrue("Docker 不可用，跳过 Redis 脚本集成测试", dockerAvailable());
        if (redis == null) {
            GenericContainer<?> container = new GenericContainer<>(IMAGE).withExposedPorts(REDIS_PORT);
            container.start();
            redis = container;
        }
        return redis;
    }

    public static String host() {
        return redis().getHost();
    }

    public static int port() {
        return redis().getMappedPort(REDIS_PORT);
    }

    private static boolean dockerAvailable() {
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (RuntimeException e) {
            return false;
        }
    }
}
