package agentpool.dispatcher.config;

import agentpool.dispatcher.strategy.StrategyType;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the dispatcher and monitoring settings.
 * All settings have sensible defaults.
 */
public final class DispatcherConfig {

    // Server settings
    private int serverPort = 8090;
    private String agentKey = null; // If set, outcome reports must provide X-Agentpool-Key header

    // Health checking
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration probeTimeout = Duration.ofSeconds(5);
    private int maxRetries = 3;

    // Dispatch
    private StrategyType strategy = StrategyType.ADAPTIVE;
    private double failoverThreshold = 0.8;
    private int circuitBreakerThreshold = 5;
    private Duration circuitBreakerTimeout = Duration.ofSeconds(60);
    private double performanceSmoothing = 0.2;

    // Alerting
    private double responseTimeThresholdMs = 10_000;
    private double errorRateThreshold = 0.1;
    private double successRateThreshold = 0.9;
    private double queueLengthThreshold = 50;
    private boolean alertsEnabled = true;
    private List<String> alertChannels = List.of("console");
    private String alertWebhookUrl = null;
    private Duration responseTimeCooldown = Duration.ofMinutes(5);
    private Duration errorRateCooldown = Duration.ofMinutes(5);
    private Duration unhealthyCooldown = Duration.ofMinutes(10);

    // Retention
    private Duration retentionPeriod = Duration.ofHours(24);

    private DispatcherConfig() {
    }

    public static DispatcherConfig defaults() {
        return new DispatcherConfig();
    }

    public static DispatcherConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from AGENTPOOL_* variables, falling back to defaults.
     */
    public static DispatcherConfig fromEnv(Map<String, String> env) {
        DispatcherConfig config = new DispatcherConfig();

        String port = env.get("AGENTPOOL_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String agentKey = env.get("AGENTPOOL_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String interval = env.get("AGENTPOOL_HEALTH_CHECK_INTERVAL_MS");
        if (interval != null && !interval.isBlank()) {
            config.healthCheckInterval = Duration.ofMillis(Long.parseLong(interval.trim()));
        }

        String probeTimeout = env.get("AGENTPOOL_PROBE_TIMEOUT_MS");
        if (probeTimeout != null && !probeTimeout.isBlank()) {
            config.probeTimeout = Duration.ofMillis(Long.parseLong(probeTimeout.trim()));
        }

        String strategy = env.get("AGENTPOOL_STRATEGY");
        if (strategy != null && !strategy.isBlank()) {
            config.strategy = StrategyType.fromWire(strategy);
        }

        String threshold = env.get("AGENTPOOL_CIRCUIT_BREAKER_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            config.circuitBreakerThreshold = Integer.parseInt(threshold.trim());
        }

        String retention = env.get("AGENTPOOL_RETENTION_HOURS");
        if (retention != null && !retention.isBlank()) {
            config.retentionPeriod = Duration.ofHours(Long.parseLong(retention.trim()));
        }

        String alertsEnabled = env.get("AGENTPOOL_ALERTS_ENABLED");
        if (alertsEnabled != null && !alertsEnabled.isBlank()) {
            config.alertsEnabled = Boolean.parseBoolean(alertsEnabled.trim());
        }

        String channels = env.get("AGENTPOOL_ALERT_CHANNELS");
        if (channels != null && !channels.isBlank()) {
            config.alertChannels = Arrays.stream(channels.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        String webhook = env.get("AGENTPOOL_ALERT_WEBHOOK_URL");
        if (webhook != null && !webhook.isBlank()) {
            config.alertWebhookUrl = webhook.trim();
        }

        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public StrategyType strategy() {
        return strategy;
    }

    public double failoverThreshold() {
        return failoverThreshold;
    }

    public int circuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public Duration circuitBreakerTimeout() {
        return circuitBreakerTimeout;
    }

    public double performanceSmoothing() {
        return performanceSmoothing;
    }

    public double responseTimeThresholdMs() {
        return responseTimeThresholdMs;
    }

    public double errorRateThreshold() {
        return errorRateThreshold;
    }

    public double successRateThreshold() {
        return successRateThreshold;
    }

    public double queueLengthThreshold() {
        return queueLengthThreshold;
    }

    public boolean alertsEnabled() {
        return alertsEnabled;
    }

    public List<String> alertChannels() {
        return alertChannels;
    }

    public String alertWebhookUrl() {
        return alertWebhookUrl;
    }

    public Duration responseTimeCooldown() {
        return responseTimeCooldown;
    }

    public Duration errorRateCooldown() {
        return errorRateCooldown;
    }

    public Duration unhealthyCooldown() {
        return unhealthyCooldown;
    }

    public Duration retentionPeriod() {
        return retentionPeriod;
    }

    // Fluent setters for testing/customization
    public DispatcherConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public DispatcherConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public DispatcherConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public DispatcherConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public DispatcherConfig withMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    public DispatcherConfig withStrategy(StrategyType strategy) {
        this.strategy = strategy;
        return this;
    }

    public DispatcherConfig withFailoverThreshold(double threshold) {
        this.failoverThreshold = threshold;
        return this;
    }

    public DispatcherConfig withCircuitBreakerThreshold(int threshold) {
        this.circuitBreakerThreshold = threshold;
        return this;
    }

    public DispatcherConfig withCircuitBreakerTimeout(Duration timeout) {
        this.circuitBreakerTimeout = timeout;
        return this;
    }

    public DispatcherConfig withResponseTimeThresholdMs(double threshold) {
        this.responseTimeThresholdMs = threshold;
        return this;
    }

    public DispatcherConfig withErrorRateThreshold(double threshold) {
        this.errorRateThreshold = threshold;
        return this;
    }

    public DispatcherConfig withSuccessRateThreshold(double threshold) {
        this.successRateThreshold = threshold;
        return this;
    }

    public DispatcherConfig withQueueLengthThreshold(double threshold) {
        this.queueLengthThreshold = threshold;
        return this;
    }

    public DispatcherConfig withAlertsEnabled(boolean enabled) {
        this.alertsEnabled = enabled;
        return this;
    }

    public DispatcherConfig withAlertChannels(List<String> channels) {
        this.alertChannels = List.copyOf(channels);
        return this;
    }

    public DispatcherConfig withAlertWebhookUrl(String url) {
        this.alertWebhookUrl = url;
        return this;
    }

    public DispatcherConfig withUnhealthyCooldown(Duration cooldown) {
        this.unhealthyCooldown = cooldown;
        return this;
    }

    public DispatcherConfig withRetentionPeriod(Duration retention) {
        this.retentionPeriod = retention;
        return this;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{" +
                "serverPort=" + serverPort +
                ", strategy=" + strategy.wireName() +
                ", healthCheckInterval=" + healthCheckInterval +
                ", circuitBreakerThreshold=" + circuitBreakerThreshold +
                ", retention=" + retentionPeriod +
                ", alertChannels=" + alertChannels +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
