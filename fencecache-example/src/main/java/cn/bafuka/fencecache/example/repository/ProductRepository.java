package cn.bafuka.fencecache.example.repository;

import cn.bafuka.fencecache.example.entity.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 商品仓库（内存实现，模拟数据库延迟）
 * 统计查询次数，用于观察缓存击穿保护的效果
 */
@Slf4j
@Repository
public class ProductRepository {

    private final Map<Long, Product> table = new ConcurrentHashMap<>();

    private final AtomicLong idGenerator = new AtomicLong();

    private final AtomicLong queryCount = new AtomicLong();

    /**
     * 模拟的查询延迟（毫秒）
     */
    private final long queryLatencyMs;

    public ProductRepository(@Value("${example.db.query-latency-ms:50}") long queryLatencyMs) {
        this.queryLatencyMs = queryLatencyMs;
        insert(Product.builder().name("iPhone 15").price(new BigDecimal("5999.00")).stock(100).build());
        insert(Product.builder().name("MacBook Pro").price(new BigDecimal("14999.00")).stock(20).build());
        insert(Product.builder().name("AirPods").price(new BigDecimal("1299.00")).stock(500).build());
    }

    public Product selectById(Long id) {
        queryCount.incrementAndGet();
        simulateLatency();
        Product product = table.get(id);
        return product == null ? null : copy(product);
    }

    public List<Product> selectAll() {
        queryCount.incrementAndGet();
        simulateLatency();
        List<Product> products = new ArrayList<>();
        table.values().forEach(p -> products.add(copy(p)));
        return products;
    }

    public Product insert(Product product) {
        product.setId(idGenerator.incrementAndGet());
        product.setCreateTime(LocalDateTime.now());
        product.setUpdateTime(product.getCreateTime());
        table.put(product.getId(), copy(product));
        return product;
    }

    public boolean updateById(Product product) {
        Product existing = table.get(product.getId());
        if (existing == null) {
            return false;
        }
        product.setCreateTime(existing.getCreateTime());
        product.setUpdateTime(LocalDateTime.now());
        table.put(product.getId(), copy(product));
        return true;
    }

    public boolean deleteById(Long id) {
        return table.remove(id) != null;
    }

    public long getQueryCount() {
        return queryCount.get();
    }

    private void simulateLatency() {
        if (queryLatencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(queryLatencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Product copy(Product product) {
        return Product.builder()
                .id(product.getId())
                .name(product.getName())
                .price(product.getPrice())
                .stock(product.getStock())
                .createTime(product.getCreateTime())
                .updateTime(product.getUpdateTime())
                .build();
    }
}
