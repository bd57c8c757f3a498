package com.jreinhal.tieredrag.config;

import com.jreinhal.tieredrag.extraction.BackoffPolicy;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.TierSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tieredrag.extraction")
public class ExtractionProperties {
    /**
     * Quality score at which escalation stops.
     */
    private double targetQuality = 0.70;

    /**
     * Per-tier settings keyed by lower-case tier name ("fast", "balanced", "premium").
     * A tier with no entry falls back to its built-in defaults; only FAST is enabled that way.
     */
    private Map<String, Tier> tiers = new LinkedHashMap<>();

    public double getTargetQuality() {
        return targetQuality;
    }

    public void setTargetQuality(double targetQuality) {
        this.targetQuality = targetQuality;
    }

    public Map<String, Tier> getTiers() {
        return tiers;
    }

    public void setTiers(Map<String, Tier> tiers) {
        this.tiers = tiers;
    }

    public TierSettings settingsFor(ExtractionTier tier) {
        Tier configured = tiers.get(tier.configKey());
        if (configured == null) {
            TierSettings defaults = TierSettings.defaults(tier);
            return tier == ExtractionTier.FAST ? defaults
                    : new TierSettings(tier, false, defaults.costPerPage(), defaults.qualityCeiling(), null, null,
                    defaults.timeout(), defaults.backoff());
        }
        return configured.toSettings(tier);
    }

    /**
     * Enabled tiers, cheapest first; equal costs keep declaration order.
     */
    public List<TierSettings> enabledTiers() {
        List<TierSettings> enabled = new ArrayList<>();
        for (ExtractionTier tier : ExtractionTier.values()) {
            TierSettings settings = settingsFor(tier);
            if (settings.enabled()) {
                enabled.add(settings);
            }
        }
        enabled.sort(Comparator.comparingDouble(TierSettings::costPerPage));
        return enabled;
    }

    public static class Tier {
        private boolean enabled = true;
        private Double costPerPage;
        private Double qualityCeiling;
        private String serviceUrl;
        private String model;
        private int timeoutSeconds = 60;
        private Backoff backoff = new Backoff();

        TierSettings toSettings(ExtractionTier tier) {
            return new TierSettings(tier, enabled,
                    costPerPage != null ? costPerPage : tier.defaultCostPerPage(),
                    qualityCeiling != null ? qualityCeiling : tier.defaultQualityCeiling(),
                    serviceUrl, model, Duration.ofSeconds(Math.max(1, timeoutSeconds)), backoff.toPolicy());
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Double getCostPerPage() {
            return costPerPage;
        }

        public void setCostPerPage(Double costPerPage) {
            this.costPerPage = costPerPage;
        }

        public Double getQualityCeiling() {
            return qualityCeiling;
        }

        public void setQualityCeiling(Double qualityCeiling) {
            this.qualityCeiling = qualityCeiling;
        }

        public String getServiceUrl() {
            return serviceUrl;
        }

        public void setServiceUrl(String serviceUrl) {
            this.serviceUrl = serviceUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public Backoff getBackoff() {
            return backoff;
        }

        public void setBackoff(Backoff backoff) {
            this.backoff = backoff;
        }
    }

    public static class Backoff {
        private int maxAttempts = 1;
        private long initialBackoffMs = 0L;
        private double backoffMultiplier = 2.0;
        private double jitter = 0.0;

        BackoffPolicy toPolicy() {
            return new BackoffPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), backoffMultiplier, jitter);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }
}
