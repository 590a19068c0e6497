package com.pricewatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "price-watch/0.1 (+contact)";

    private Scheduler scheduler = new Scheduler();
    private Fetch fetch = new Fetch();
    private Alerts alerts = new Alerts();
    private Webhooks webhooks = new Webhooks();
    private Retention retention = new Retention();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Webhooks getWebhooks() {
        return webhooks;
    }

    public void setWebhooks(Webhooks webhooks) {
        this.webhooks = webhooks;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int tickIntervalSeconds = 30;
        private int maxDueJobsPerTick = 20;
        private int workerCount = 4;
        private int staleRunMinutes = 30;
        private int runTimeoutSeconds = 900;
        private int defaultSuccessIntervalMinutes = 60;
        private int defaultRetryIntervalMinutes = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickIntervalSeconds() {
            return Math.max(1, tickIntervalSeconds);
        }

        public void setTickIntervalSeconds(int tickIntervalSeconds) {
            this.tickIntervalSeconds = Math.max(1, tickIntervalSeconds);
        }

        public int getMaxDueJobsPerTick() {
            return Math.max(1, maxDueJobsPerTick);
        }

        public void setMaxDueJobsPerTick(int maxDueJobsPerTick) {
            this.maxDueJobsPerTick = Math.max(1, maxDueJobsPerTick);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }

        public int getRunTimeoutSeconds() {
            return Math.max(1, runTimeoutSeconds);
        }

        public void setRunTimeoutSeconds(int runTimeoutSeconds) {
            this.runTimeoutSeconds = Math.max(1, runTimeoutSeconds);
        }

        public int getDefaultSuccessIntervalMinutes() {
            return Math.max(1, defaultSuccessIntervalMinutes);
        }

        public void setDefaultSuccessIntervalMinutes(int defaultSuccessIntervalMinutes) {
            this.defaultSuccessIntervalMinutes = Math.max(1, defaultSuccessIntervalMinutes);
        }

        public int getDefaultRetryIntervalMinutes() {
            return Math.max(1, defaultRetryIntervalMinutes);
        }

        public void setDefaultRetryIntervalMinutes(int defaultRetryIntervalMinutes) {
            this.defaultRetryIntervalMinutes = Math.max(1, defaultRetryIntervalMinutes);
        }
    }

    public static class Fetch {
        private String userAgent;
        private long minCallDelayMs = 50;
        private int globalConcurrency = 8;
        private int perHostDelayMs = 500;
        private int requestTimeoutSeconds = 20;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 5000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public long getMinCallDelayMs() {
            return Math.max(1, minCallDelayMs);
        }

        public void setMinCallDelayMs(long minCallDelayMs) {
            this.minCallDelayMs = Math.max(1, minCallDelayMs);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
        }
    }

    public static class Alerts {
        private int suppressionWindowMinutes = 360;
        private double defaultPriceDropPercent = 10.0;
        private double defaultPriceIncreasePercent = 10.0;
        private boolean defaultOutOfStock = true;

        public int getSuppressionWindowMinutes() {
            return Math.max(0, suppressionWindowMinutes);
        }

        public void setSuppressionWindowMinutes(int suppressionWindowMinutes) {
            this.suppressionWindowMinutes = Math.max(0, suppressionWindowMinutes);
        }

        public double getDefaultPriceDropPercent() {
            return defaultPriceDropPercent;
        }

        public void setDefaultPriceDropPercent(double defaultPriceDropPercent) {
            this.defaultPriceDropPercent = defaultPriceDropPercent;
        }

        public double getDefaultPriceIncreasePercent() {
            return defaultPriceIncreasePercent;
        }

        public void setDefaultPriceIncreasePercent(double defaultPriceIncreasePercent) {
            this.defaultPriceIncreasePercent = defaultPriceIncreasePercent;
        }

        public boolean isDefaultOutOfStock() {
            return defaultOutOfStock;
        }

        public void setDefaultOutOfStock(boolean defaultOutOfStock) {
            this.defaultOutOfStock = defaultOutOfStock;
        }
    }

    public static class Webhooks {
        private boolean enabled = false;
        private int pollIntervalMs = 2000;
        private int batchSize = 50;
        private int requestTimeoutSeconds = 10;
        private int lockTtlSeconds = 120;
        private long backoffBaseSeconds = 5;
        private double backoffFactor = 2.0;
        private long backoffMaxSeconds = 300;
        private int maxAttempts = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getLockTtlSeconds() {
            return Math.max(1, lockTtlSeconds);
        }

        public void setLockTtlSeconds(int lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(1, lockTtlSeconds);
        }

        public long getBackoffBaseSeconds() {
            return Math.max(0, backoffBaseSeconds);
        }

        public void setBackoffBaseSeconds(long backoffBaseSeconds) {
            this.backoffBaseSeconds = Math.max(0, backoffBaseSeconds);
        }

        public double getBackoffFactor() {
            return Math.max(1.0, backoffFactor);
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = Math.max(1.0, backoffFactor);
        }

        public long getBackoffMaxSeconds() {
            return Math.max(0, backoffMaxSeconds);
        }

        public void setBackoffMaxSeconds(long backoffMaxSeconds) {
            this.backoffMaxSeconds = Math.max(0, backoffMaxSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }
    }

    public static class Retention {
        private boolean enabled = false;
        private int intervalHours = 24;
        private int initialDelayMinutes = 10;
        private int batchSize = 1000;
        private String coldStorageDir = "./archive";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalHours() {
            return Math.max(1, intervalHours);
        }

        public void setIntervalHours(int intervalHours) {
            this.intervalHours = Math.max(1, intervalHours);
        }

        public int getInitialDelayMinutes() {
            return Math.max(0, initialDelayMinutes);
        }

        public void setInitialDelayMinutes(int initialDelayMinutes) {
            this.initialDelayMinutes = Math.max(0, initialDelayMinutes);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public String getColdStorageDir() {
            return coldStorageDir;
        }

        public void setColdStorageDir(String coldStorageDir) {
            this.coldStorageDir = coldStorageDir;
        }
    }
}
