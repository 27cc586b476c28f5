package com.brokerbridge.engine;

import com.brokerbridge.config.ConfigLoader;
import com.brokerbridge.engine.id.OrderIdStrategy;
import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration of a broker session.
 *
 * <p>Typically read from the {@code broker-session} block:</p>
 * <pre>
 * broker-session {
 *   host = "127.0.0.1"
 *   port = 7497
 *   client-id = 1
 *   read-only = true
 *   order-id-strategy = INCREMENT
 * }
 * </pre>
 */
public class SessionConfig {

    public static final String CONFIG_PATH = "broker-session";

    private String name = "broker";
    private String host = "127.0.0.1";
    private int port = 7497;
    private int clientId = 0;
    private boolean readOnly = false;
    private boolean financialAdvisor = false;
    private OrderIdStrategy orderIdStrategy = OrderIdStrategy.RETRY;
    private int orderIdMaxAttempts = 5;
    private Duration orderIdAttemptTimeout = Duration.ofMillis(500);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration contractTimeout = Duration.ofSeconds(10);
    private boolean subscribeOnConnect = true;
    private int maxRequestsPerSecond = 45;
    private boolean downloadShortRates = false;
    private String shortRatesHost = "ftp2.interactivebrokers.com";
    private String shortRatesUser = "shortstock";
    private Duration shortRatesTimeout = Duration.ofSeconds(30);

    public SessionConfig() {
    }

    protected void loadFromConfig(Config config) {
        if (config.hasPath("name")) {
            this.name = config.getString("name");
        }
        if (config.hasPath("host")) {
            this.host = config.getString("host");
        }
        if (config.hasPath("port")) {
            this.port = config.getInt("port");
        }
        if (config.hasPath("client-id")) {
            this.clientId = config.getInt("client-id");
        }
        if (config.hasPath("read-only")) {
            this.readOnly = config.getBoolean("read-only");
        }
        if (config.hasPath("is-fa")) {
            this.financialAdvisor = config.getBoolean("is-fa");
        }
        if (config.hasPath("order-id-strategy")) {
            this.orderIdStrategy = parseStrategy(config.getString("order-id-strategy"));
        }
        if (config.hasPath("order-id.max-attempts")) {
            this.orderIdMaxAttempts = config.getInt("order-id.max-attempts");
        }
        if (config.hasPath("order-id.attempt-timeout")) {
            this.orderIdAttemptTimeout = ConfigLoader.getDuration(config, "order-id.attempt-timeout");
        }
        if (config.hasPath("request-timeout")) {
            this.requestTimeout = ConfigLoader.getDuration(config, "request-timeout");
        }
        if (config.hasPath("contract-timeout")) {
            this.contractTimeout = ConfigLoader.getDuration(config, "contract-timeout");
        }
        if (config.hasPath("subscribe-on-connect")) {
            this.subscribeOnConnect = config.getBoolean("subscribe-on-connect");
        }
        if (config.hasPath("max-requests-per-second")) {
            this.maxRequestsPerSecond = config.getInt("max-requests-per-second");
        }
        if (config.hasPath("download-short-rates")) {
            this.downloadShortRates = config.getBoolean("download-short-rates");
        }
        if (config.hasPath("short-rates.host")) {
            this.shortRatesHost = config.getString("short-rates.host");
        }
        if (config.hasPath("short-rates.user")) {
            this.shortRatesUser = config.getString("short-rates.user");
        }
        if (config.hasPath("short-rates.timeout")) {
            this.shortRatesTimeout = ConfigLoader.getDuration(config, "short-rates.timeout");
        }
    }

    private static OrderIdStrategy parseStrategy(String value) {
        try {
            return OrderIdStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoader.ConfigurationException("Unknown order-id-strategy: " + value
                    + " (expected RETRY, BASIC or INCREMENT)", e);
        }
    }

    /**
     * Read a session block, e.g. {@code config.getConfig("broker-session")}.
     */
    public static SessionConfig fromConfig(Config config) {
        SessionConfig sessionConfig = new SessionConfig();
        sessionConfig.loadFromConfig(config);
        sessionConfig.validate();
        return sessionConfig;
    }

    /**
     * Read the {@code broker-session} block of the default configuration.
     */
    public static SessionConfig load() {
        return fromConfig(ConfigLoader.load().getConfig(CONFIG_PATH));
    }

    /**
     * @throws ConfigLoader.ConfigurationException if a value is out of range
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigLoader.ConfigurationException("Session name is required");
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigLoader.ConfigurationException("Invalid port: " + port);
        }
        if (orderIdMaxAttempts < 1) {
            throw new ConfigLoader.ConfigurationException("order-id.max-attempts must be at least 1");
        }
        if (orderIdAttemptTimeout.isNegative() || orderIdAttemptTimeout.isZero()) {
            throw new ConfigLoader.ConfigurationException("order-id.attempt-timeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()
                || contractTimeout.isNegative() || contractTimeout.isZero()) {
            throw new ConfigLoader.ConfigurationException("Timeouts must be positive");
        }
        if (downloadShortRates && (shortRatesHost == null || shortRatesHost.isBlank())) {
            throw new ConfigLoader.ConfigurationException("short-rates.host is required to download short rates");
        }
    }

    // ==================== Getters ====================

    public String getName() {
        return name;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getClientId() {
        return clientId;
    }

    /**
     * @return true if order placement and cancellation are refused
     */
    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isFinancialAdvisor() {
        return financialAdvisor;
    }

    public OrderIdStrategy getOrderIdStrategy() {
        return orderIdStrategy;
    }

    public int getOrderIdMaxAttempts() {
        return orderIdMaxAttempts;
    }

    public Duration getOrderIdAttemptTimeout() {
        return orderIdAttemptTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getContractTimeout() {
        return contractTimeout;
    }

    public boolean isSubscribeOnConnect() {
        return subscribeOnConnect;
    }

    public int getMaxRequestsPerSecond() {
        return maxRequestsPerSecond;
    }

    /**
     * @return true if the short-stock rate files are fetched into the short_rates table on connect
     */
    public boolean isDownloadShortRates() {
        return downloadShortRates;
    }

    public String getShortRatesHost() {
        return shortRatesHost;
    }

    public String getShortRatesUser() {
        return shortRatesUser;
    }

    public Duration getShortRatesTimeout() {
        return shortRatesTimeout;
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final SessionConfig config = new SessionConfig();

        public Builder name(String name) {
            config.name = name;
            return this;
        }

        public Builder host(String host) {
            config.host = host;
            return this;
        }

        public Builder port(int port) {
            config.port = port;
            return this;
        }

        public Builder clientId(int clientId) {
            config.clientId = clientId;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            config.readOnly = readOnly;
            return this;
        }

        public Builder financialAdvisor(boolean financialAdvisor) {
            config.financialAdvisor = financialAdvisor;
            return this;
        }

        public Builder orderIdStrategy(OrderIdStrategy strategy) {
            config.orderIdStrategy = strategy;
            return this;
        }

        public Builder orderIdMaxAttempts(int maxAttempts) {
            config.orderIdMaxAttempts = maxAttempts;
            return this;
        }

        public Builder orderIdAttemptTimeout(Duration timeout) {
            config.orderIdAttemptTimeout = timeout;
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            config.requestTimeout = timeout;
            return this;
        }

        public Builder contractTimeout(Duration timeout) {
            config.contractTimeout = timeout;
            return this;
        }

        public Builder subscribeOnConnect(boolean subscribe) {
            config.subscribeOnConnect = subscribe;
            return this;
        }

        public Builder maxRequestsPerSecond(int max) {
            config.maxRequestsPerSecond = max;
            return this;
        }

        public Builder downloadShortRates(boolean download) {
            config.downloadShortRates = download;
            return this;
        }

        public Builder shortRatesHost(String host) {
            config.shortRatesHost = host;
            return this;
        }

        public SessionConfig build() {
            config.validate();
            return config;
        }
    }

    @Override
    public String toString() {
        return "SessionConfig{name=" + name + ", host=" + host + ", port=" + port + ", clientId=" + clientId
                + ", readOnly=" + readOnly + ", fa=" + financialAdvisor + ", orderIds=" + orderIdStrategy + "}";
    }
}
