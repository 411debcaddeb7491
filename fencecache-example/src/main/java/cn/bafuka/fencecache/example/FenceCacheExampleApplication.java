package cn.bafuka.fencecache.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FenceCache 示例应用启动类
 */
@SpringBootApplication
public class FenceCacheExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(FenceCacheExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  FenceCache Example Application Started!");
        System.out.println("  Try: curl http://localhost:8080/api/products/1");
        System.out.println("========================================\n");
    }
}
