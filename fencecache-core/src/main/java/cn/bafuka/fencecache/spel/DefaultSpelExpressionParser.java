package cn.bafuka.fencecache.spel;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SpEL 表达式解析器默认实现
 * 基于 Spring Expression Language，解析后的表达式按原文缓存
 */
@Slf4j
public class DefaultSpelExpressionParser implements SpelExpressionParser {

    private final ExpressionParser parser = new org.springframework.expression.spel.standard.SpelExpressionParser();

    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    @Override
    public String parseKey(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return null;
        }

        try {
            Object value = expressionFor(expression).getValue(createEvaluationContext(joinPoint));
            return value == null ? null : String.valueOf(value);
        } catch (Exception e) {
            log.error("解析 SpEL key 表达式失败: {}", expression, e);
            return null;
        }
    }

    @Override
    public boolean parseCondition(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return true;
        }

        try {
            Boolean result = expressionFor(expression).getValue(createEvaluationContext(joinPoint), Boolean.class);
            return result != null && result;
        } catch (Exception e) {
            log.error("解析 SpEL condition 表达式失败: {}", expression, e);
            return false;
        }
    }

    private Expression expressionFor(String expression) {
        return expressionCache.computeIfAbsent(expression, parser::parseExpression);
    }

    /**
     * 创建 SpEL 求值上下文
     *
     * 使用 SimpleEvaluationContext：只读数据绑定，只能访问属性，不能调用任意类型或构造对象
     */
    private EvaluationContext createEvaluationContext(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Object[] args = joinPoint.getArgs();

        SimpleEvaluationContext context = SimpleEvaluationContext
                .forReadOnlyDataBinding()
                .build();

        String[] parameterNames = parameterNameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length && i < args.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        // p0, a0 参数别名
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            context.setVariable("a" + i, args[i]);
        }

        return context;
    }
}
