package cn.bafuka.fencecache.aspect;

import cn.bafuka.fencecache.annotation.FenceCacheEvict;
import cn.bafuka.fencecache.annotation.FenceCacheable;
import cn.bafuka.fencecache.core.FenceCacheContext;
import cn.bafuka.fencecache.spel.SpelExpressionParser;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * FenceCacheAspect 单元测试
 * 注解解析、条件判断、键前缀拼接
 */
public class FenceCacheAspectTest {

    private FenceCacheAspect aspect;

    @Mock
    private SpelExpressionParser spelParser;

    @Mock
    private FenceCacheAspectHandler aspectHandler;

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private MethodSignature methodSignature;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        aspect = new FenceCacheAspect(spelParser, aspectHandler, "app:");
        when(joinPoint.getSignature()).thenReturn(methodSignature);
        when(joinPoint.getTarget()).thenReturn(new TestService());
    }

    /**
     * 测试构建上下文：键加前缀，ttl 按注解单位换算
     */
    @Test
    public void testAroundCache_BuildsContext() throws Throwable {
        Method method = mockMethod("getProduct", Long.class);
        FenceCacheable annotation = method.getAnnotation(FenceCacheable.class);
        when(spelParser.parseCondition("#id > 0", joinPoint)).thenReturn(true);
        when(spelParser.parseKey("'product:' + #id", joinPoint)).thenReturn("product:1");
        when(aspectHandler.handleCache(eq(joinPoint), any(FenceCacheContext.class))).thenReturn("cached");

        Object result = aspect.aroundCache(joinPoint, annotation);

        assertEquals("cached", result);
        ArgumentCaptor<FenceCacheContext> captor = ArgumentCaptor.forClass(FenceCacheContext.class);
        verify(aspectHandler).handleCache(eq(joinPoint), captor.capture());
        FenceCacheContext context = captor.getValue();
        assertEquals("app:product:1", context.getKey());
        assertEquals(Duration.ofMinutes(5), context.getTtl());
        assertEquals(String.class, context.getReturnType());
        assertEquals("getProduct", context.getMethodName());
        verify(joinPoint, never()).proceed();
    }

    /**
     * 测试条件不满足时直接执行原方法
     */
    @Test
    public void testAroundCache_ConditionNotMet() throws Throwable {
        Method method = mockMethod("getProduct", Long.class);
        when(spelParser.parseCondition(anyString(), eq(joinPoint))).thenReturn(false);
        when(joinPoint.proceed()).thenReturn("direct");

        Object result = aspect.aroundCache(joinPoint, method.getAnnotation(FenceCacheable.class));

        assertEquals("direct", result);
        verify(aspectHandler, never()).handleCache(any(), any());
    }

    /**
     * 测试缓存键解析失败时直接执行原方法
     */
    @Test
    public void testAroundCache_KeyUnresolved() throws Throwable {
        Method method = mockMethod("getProduct", Long.class);
        when(spelParser.parseCondition(anyString(), eq(joinPoint))).thenReturn(true);
        when(spelParser.parseKey(anyString(), eq(joinPoint))).thenReturn(null);
        when(joinPoint.proceed()).thenReturn("direct");

        assertEquals("direct", aspect.aroundCache(joinPoint, method.getAnnotation(FenceCacheable.class)));
        verify(aspectHandler, never()).handleCache(any(), any());
    }

    /**
     * 测试无返回值方法不走缓存
     */
    @Test
    public void testAroundCache_VoidMethod() throws Throwable {
        Method method = mockMethod("refresh", Long.class);

        aspect.aroundCache(joinPoint, method.getAnnotation(FenceCacheable.class));

        verify(joinPoint).proceed();
        verify(aspectHandler, never()).handleCache(any(), any());
    }

    /**
     * 测试标记删除注解
     */
    @Test
    public void testAroundEvict() throws Throwable {
        Method method = mockMethod("updateProduct", Long.class);
        when(spelParser.parseKey("'product:' + #id", joinPoint)).thenReturn("product:1");
        when(methodSignature.getName()).thenReturn("updateProduct");

        aspect.aroundEvict(joinPoint, method.getAnnotation(FenceCacheEvict.class));

        ArgumentCaptor<FenceCacheContext> captor = ArgumentCaptor.forClass(FenceCacheContext.class);
        verify(aspectHandler).handleEvict(eq(joinPoint), captor.capture(), eq(true));
        assertEquals("app:product:1", captor.getValue().getKey());
    }

    private Method mockMethod(String name, Class<?>... parameterTypes) throws NoSuchMethodException {
        Method method = TestService.class.getMethod(name, parameterTypes);
        when(methodSignature.getMethod()).thenReturn(method);
        return method;
    }

    public static class TestService {

        @FenceCacheable(key = "'product:' + #id", ttl = 5, timeUnit = TimeUnit.MINUTES, condition = "#id > 0")
        public String getProduct(Long id) {
            return "db";
        }

        @FenceCacheable(key = "#id")
        public void refresh(Long id) {
        }

        @FenceCacheEvict(key = "'product:' + #id", beforeInvocation = true)
        public void updateProduct(Long id) {
        }
    }
}
