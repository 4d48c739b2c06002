package org.tacheck.service;

import lombok.Builder;
import lombok.Getter;
import org.tacheck.explorer.ExplorationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 引擎配置。此类是不可变的，用 {@link #builder()} 构造，
 * 或用 {@link #fromSystemProperties()} 从 tacheck.* 系统属性读取。
 */
@Getter
@Builder(toBuilder = true)
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    /** 每个查询最多探索的符号状态数 */
    @Builder.Default
    private final int maxStates = 1_000_000;

    /** 每个查询的时间上限 (毫秒)，0 表示不限 */
    @Builder.Default
    private final long timeoutMillis = 0L;

    /** {@link QueryService} 的工作线程数 */
    @Builder.Default
    private final int workerThreads = Runtime.getRuntime().availableProcessors();

    /** 是否用 Z3 为见证路径的每一步采样具体时钟赋值 */
    @Builder.Default
    private final boolean concretizeWitnesses = true;

    /** 是否在探索时释放与行为无关的时钟 */
    @Builder.Default
    private final boolean reduceClocks = true;

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * 读取 tacheck.maxStates、tacheck.timeoutMillis、tacheck.workerThreads、
     * tacheck.concretizeWitnesses 与 tacheck.reduceClocks，未设置的项取默认值。
     * @throws IllegalArgumentException 属性值不是合法的数字
     */
    public static EngineConfig fromSystemProperties() {
        EngineConfig defaults = defaults();
        EngineConfig config = builder()
                .maxStates(intProperty("tacheck.maxStates", defaults.maxStates))
                .timeoutMillis(longProperty("tacheck.timeoutMillis", defaults.timeoutMillis))
                .workerThreads(intProperty("tacheck.workerThreads", defaults.workerThreads))
                .concretizeWitnesses(booleanProperty("tacheck.concretizeWitnesses", defaults.concretizeWitnesses))
                .reduceClocks(booleanProperty("tacheck.reduceClocks", defaults.reduceClocks))
                .build();
        logger.debug("引擎配置: {}", config);
        return config;
    }

    /**
     * 每次调用都从现在开始计时。
     */
    public ExplorationLimits newLimits() {
        return ExplorationLimits.of(maxStates, timeoutMillis);
    }

    private static int intProperty(String key, int fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("系统属性 " + key + " 不是整数: " + value, e);
        }
    }

    private static long longProperty(String key, long fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("系统属性 " + key + " 不是整数: " + value, e);
        }
    }

    private static boolean booleanProperty(String key, boolean fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{maxStates=" + maxStates + ", timeoutMillis=" + timeoutMillis
                + ", workerThreads=" + workerThreads + ", concretizeWitnesses=" + concretizeWitnesses
                + ", reduceClocks=" + reduceClocks + '}';
    }
}
