package com.predictionmarket.config;

/**
 * Configuration parsed from environment variables.
 */
public class EngineConfig {

    private final int httpPort;
    private final int metricsPort;
    private final int bookDepth;
    private final int defaultTradeLimit;
    private final int statsIntervalSeconds;
    private final String corsAllowedOrigin;
    private final boolean detailedLogging;

    public EngineConfig(int httpPort, int metricsPort, int bookDepth, int defaultTradeLimit,
                        int statsIntervalSeconds, String corsAllowedOrigin,
                        boolean detailedLogging) {
        this.httpPort = httpPort;
        this.metricsPort = metricsPort;
        this.bookDepth = bookDepth;
        this.defaultTradeLimit = defaultTradeLimit;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.corsAllowedOrigin = corsAllowedOrigin;
        this.detailedLogging = detailedLogging;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static EngineConfig fromEnv() {
        int httpPort = getEnvInt("HTTP_PORT", 8000);
        int metricsPort = getEnvInt("METRICS_PORT", 9091);
        int bookDepth = getEnvInt("BOOK_DEPTH", 10);
        int defaultTradeLimit = getEnvInt("DEFAULT_TRADE_LIMIT", 20);
        int statsIntervalSeconds = getEnvInt("STATS_INTERVAL_SECONDS", 10);
        String corsAllowedOrigin = getEnv("CORS_ALLOWED_ORIGIN", "*");
        boolean detailedLogging = Boolean.parseBoolean(getEnv("ENABLE_DETAILED_LOGGING", "false"));

        return new EngineConfig(httpPort, metricsPort, bookDepth, defaultTradeLimit,
                statsIntervalSeconds, corsAllowedOrigin, detailedLogging);
    }

    /**
     * Defaults only, ignoring the environment.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(8000, 9091, 10, 20, 10, "*", false);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public int getBookDepth() {
        return bookDepth;
    }

    public int getDefaultTradeLimit() {
        return defaultTradeLimit;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public String getCorsAllowedOrigin() {
        return corsAllowedOrigin;
    }

    public boolean isDetailedLogging() {
        return detailedLogging;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "httpPort=" + httpPort +
                ", metricsPort=" + metricsPort +
                ", bookDepth=" + bookDepth +
                ", defaultTradeLimit=" + defaultTradeLimit +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", corsAllowedOrigin='" + corsAllowedOrigin + '\'' +
                ", detailedLogging=" + detailedLogging +
                '}';
    }
}
