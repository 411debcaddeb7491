package cn.bafuka.fencecache.codec;

/**
 * 值编解码器
 * 编码结果不能为空数组，空数组在存储中表示缓存的空结果
 *
 * @param <V> 值类型
 */
public interface ValueCodec<V> {

    /**
     * 编码
     *
     * @param value 非 null 的值
     * @return 非空字节数组
     */
    byte[] encode(V value);

    /**
     * 解码
     *
     * @param bytes 非空字节数组
     * @return 值
     */
    V decode(byte[] bytes);
}
