package cn.bafuka.fencecache.codec.impl;

import cn.bafuka.fencecache.codec.ValueCodec;
import com.alibaba.fastjson.JSON;

import java.lang.reflect.Type;

/**
 * 基于 fastjson 的 JSON 编解码器
 *
 * @param <V> 值类型
 */
public class FastjsonValueCodec<V> implements ValueCodec<V> {

    /**
     * 目标类型（支持泛型，如 {@code new TypeReference<List<Product>>(){}.getType()}）
     */
    private final Type type;

    public FastjsonValueCodec(Type type) {
        this.type = type;
    }

    public static <V> FastjsonValueCodec<V> of(Class<V> type) {
        return new FastjsonValueCodec<>(type);
    }

    @Override
    public byte[] encode(V value) {
        return JSON.toJSONBytes(value);
    }

    @Override
    public V decode(byte[] bytes) {
        return JSON.parseObject(bytes, type);
    }

    public Type getType() {
        return type;
    }
}
