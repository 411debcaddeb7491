package cn.bafuka.fencecache.example.service;

import cn.bafuka.fencecache.annotation.FenceCacheEvict;
import cn.bafuka.fencecache.annotation.FenceCacheable;
import cn.bafuka.fencecache.client.FenceCacheClient;
import cn.bafuka.fencecache.example.entity.Product;
import cn.bafuka.fencecache.example.repository.ProductRepository;
import com.alibaba.fastjson.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 商品服务
 * 演示注解方式和编程方式两种用法
 */
@Slf4j
@Service
public class ProductService {

    /**
     * 商品列表缓存键
     */
    public static final String PRODUCT_LIST_KEY = "product:list";

    private static final Type PRODUCT_LIST_TYPE = new TypeReference<List<Product>>() {}.getType();

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private FenceCacheClient fenceCacheClient;

    /**
     * 根据ID查询商品，不存在的商品也会被缓存（防穿透）
     *
     * @param productId 商品ID
     * @return 商品信息，不存在返回 null
     */
    @FenceCacheable(key = "'product:' + #productId", ttl = 10, timeUnit = TimeUnit.MINUTES, condition = "#productId > 0")
    public Product getProductById(Long productId) {
        log.info("从数据库查询商品: productId={}", productId);
        return productRepository.selectById(productId);
    }

    /**
     * 查询所有商品（编程方式）
     *
     * @return 商品列表
     */
    public List<Product> getAllProducts() {
        Optional<List<Product>> products = fenceCacheClient.fetch(PRODUCT_LIST_KEY, Duration.ofMinutes(1),
                PRODUCT_LIST_TYPE, () -> {
                    log.info("从数据库查询商品列表");
                    return Optional.of(productRepository.selectAll());
                });
        return products.orElse(Collections.emptyList());
    }

    /**
     * 创建商品
     *
     * @param product 商品信息
     * @return 创建的商品
     */
    public Product createProduct(Product product) {
        productRepository.insert(product);
        fenceCacheClient.tagAsDeleted(PRODUCT_LIST_KEY);
        log.info("商品创建成功: productId={}", product.getId());
        return product;
    }

    /**
     * 更新商品（更新成功后标记删除）
     *
     * @param product 商品信息
     * @return 是否更新成功
     */
    @FenceCacheEvict(key = "'product:' + #product.id")
    public boolean updateProduct(Product product) {
        boolean updated = productRepository.updateById(product);
        if (updated) {
            fenceCacheClient.tagAsDeleted(PRODUCT_LIST_KEY);
        }
        log.info("商品更新: productId={}, updated={}", product.getId(), updated);
        return updated;
    }

    /**
     * 删除商品
     *
     * @param productId 商品ID
     * @return 是否删除成功
     */
    @FenceCacheEvict(key = "'product:' + #productId")
    public boolean deleteProduct(Long productId) {
        boolean deleted = productRepository.deleteById(productId);
        if (deleted) {
            fenceCacheClient.tagAsDeleted(PRODUCT_LIST_KEY);
        }
        log.info("商品删除: productId={}, deleted={}", productId, deleted);
        return deleted;
    }
}
