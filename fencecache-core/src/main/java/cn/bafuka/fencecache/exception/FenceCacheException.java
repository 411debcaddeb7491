package cn.bafuka.fencecache.exception;

/**
 * FenceCache 异常
 * 存储不可用、回源失败、编解码失败时抛出
 */
public class FenceCacheException extends RuntimeException {

    /**
     * 缓存键
     */
    private final String key;

    /**
     * 失败原因
     */
    private final Reason reason;

    public FenceCacheException(String message, Throwable cause, String key, Reason reason) {
        super(message, cause);
        this.key = key;
        this.reason = reason;
    }

    public static FenceCacheException storeUnavailable(String key, String operation, Throwable cause) {
        return new FenceCacheException(
                String.format("Store operation failed: op=%s, key=%s", operation, key),
                cause, key, Reason.STORE_UNAVAILABLE);
    }

    public static FenceCacheException loaderFailed(String key, Throwable cause) {
        return new FenceCacheException(
                String.format("Failed to load from source: key=%s", key),
                cause, key, Reason.LOADER_FAILED);
    }

    public static FenceCacheException codecError(String key, Throwable cause) {
        return new FenceCacheException(
                String.format("Failed to encode/decode cached value: key=%s", key),
                cause, key, Reason.CODEC_ERROR);
    }

    public String getKey() {
        return key;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * 失败原因枚举
     */
    public enum Reason {
        /**
         * 存储（Redis）不可用或脚本执行失败
         */
        STORE_UNAVAILABLE("存储不可用"),

        /**
         * 回源加载失败
         */
        LOADER_FAILED("回源失败"),

        /**
         * 编解码失败
         */
        CODEC_ERROR("编解码失败");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "FenceCacheException{" +
                "key=" + key +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
