package cn.bafuka.fencecache.example.controller;

import cn.bafuka.fencecache.example.entity.Product;
import cn.bafuka.fencecache.example.repository.ProductRepository;
import cn.bafuka.fencecache.example.service.ProductService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 商品控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/products")
public class ProductController {

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductRepository productRepository;

    /**
     * 根据ID查询商品
     */
    @GetMapping("/{id}")
    public Map<String, Object> getProductById(@PathVariable Long id) {
        Product product = productService.getProductById(id);
        Map<String, Object> result = new HashMap<>();
        result.put("success", product != null);
        result.put("data", product);
        if (product == null) {
            result.put("message", "商品不存在");
        }
        return result;
    }

    /**
     * 查询所有商品
     */
    @GetMapping("/list")
    public Map<String, Object> getAllProducts() {
        List<Product> products = productService.getAllProducts();
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", products);
        result.put("total", products.size());
        return result;
    }

    /**
     * 创建商品
     */
    @PostMapping
    public Map<String, Object> createProduct(@RequestBody Product product) {
        Product created = productService.createProduct(product);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", created);
        result.put("message", "商品创建成功");
        return result;
    }

    /**
     * 更新商品
     */
    @PutMapping("/{id}")
    public Map<String, Object> updateProduct(@PathVariable Long id, @RequestBody Product product) {
        product.setId(id);
        boolean updated = productService.updateProduct(product);
        Map<String, Object> result = new HashMap<>();
        result.put("success", updated);
        result.put("message", updated ? "商品更新成功" : "商品不存在");
        return result;
    }

    /**
     * 删除商品
     */
    @DeleteMapping("/{id}")
    public Map<String, Object> deleteProduct(@PathVariable Long id) {
        boolean deleted = productService.deleteProduct(id);
        Map<String, Object> result = new HashMap<>();
        result.put("success", deleted);
        result.put("message", deleted ? "商品删除成功" : "商品不存在");
        return result;
    }

    /**
     * 压测接口：并发查询同一个商品，观察数据库实际查询次数
     */
    @GetMapping("/benchmark/{id}")
    public Map<String, Object> benchmark(@PathVariable Long id,
                                         @RequestParam(defaultValue = "100") int concurrency) throws InterruptedException {
        long queriesBefore = productRepository.getQueryCount();
        long startTime = System.currentTimeMillis();

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(concurrency, 200)));
        int failures = 0;
        try {
            List<Future<Product>> futures = new ArrayList<>();
            for (int i = 0; i < concurrency; i++) {
                futures.add(executor.submit(() -> productService.getProductById(id)));
            }
            for (Future<Product> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    failures++;
                    log.warn("压测请求失败: productId={}", id, e.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }

        long duration = System.currentTimeMillis() - startTime;

        Map<String, Object> result = new HashMap<>();
        result.put("success", failures == 0);
        result.put("concurrency", concurrency);
        result.put("failures", failures);
        result.put("dbQueries", productRepository.getQueryCount() - queriesBefore);
        result.put("duration", duration + "ms");
        return result;
    }
}
