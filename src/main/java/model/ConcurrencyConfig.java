package model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 并发控制配置参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConcurrencyConfig {

    public static final String DEFAULT_RESOURCE = "concurrency-control.properties";

    static final String KEY_LOCK_TIMEOUT = "concurrency.lock-timeout-ms";
    static final String KEY_CONFLICT_WINDOW = "concurrency.conflict-window-ms";
    static final String KEY_CLEANUP_INTERVAL = "concurrency.cleanup-interval-ms";
    static final String KEY_OPERATION_RETENTION = "concurrency.operation-retention-ms";

    @Builder.Default
    private long lockTimeoutMillis = 30_000;            // 写锁持有时间，默认30秒
    @Builder.Default
    private long conflictWindowMillis = 5_000;          // 冲突检测时间窗口，默认5秒
    @Builder.Default
    private long cleanupIntervalMillis = 60_000;        // 后台清理间隔，默认1分钟
    @Builder.Default
    private long operationRetentionMillis = 600_000;    // 操作日志保留时间，默认10分钟

    public static ConcurrencyConfig defaults() {
        return ConcurrencyConfig.builder().build();
    }

    /**
     * 从Properties读取配置，缺失的键使用默认值
     *
     * @throws IllegalArgumentException 配置值不是正整数
     */
    public static ConcurrencyConfig fromProperties(Properties properties) {
        ConcurrencyConfig defaults = defaults();
        return ConcurrencyConfig.builder()
                .lockTimeoutMillis(readMillis(properties, KEY_LOCK_TIMEOUT, defaults.lockTimeoutMillis))
                .conflictWindowMillis(readMillis(properties, KEY_CONFLICT_WINDOW, defaults.conflictWindowMillis))
                .cleanupIntervalMillis(readMillis(properties, KEY_CLEANUP_INTERVAL, defaults.cleanupIntervalMillis))
                .operationRetentionMillis(readMillis(properties, KEY_OPERATION_RETENTION, defaults.operationRetentionMillis))
                .build();
    }

    /**
     * 从classpath资源加载配置，资源不存在时返回默认配置
     */
    public static ConcurrencyConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = ConcurrencyConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + resource, e);
        }
        return fromProperties(properties);
    }

    public static ConcurrencyConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    private static long readMillis(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number of milliseconds: " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + raw);
        }
        return value;
    }
}
