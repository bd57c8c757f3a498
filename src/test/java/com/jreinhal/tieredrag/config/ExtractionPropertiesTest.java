package com.jreinhal.tieredrag.config;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.TierSettings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExtractionPropertiesTest {

    @Test
    void onlyFastTierIsEnabledWithoutConfiguration() {
        ExtractionProperties properties = new ExtractionProperties();

        List<TierSettings> enabled = properties.enabledTiers();

        assertEquals(1, enabled.size());
        assertEquals(ExtractionTier.FAST, enabled.get(0).tier());
        assertFalse(properties.settingsFor(ExtractionTier.PREMIUM).enabled());
    }

    @Test
    void enabledTiersAreOrderedByCost() {
        ExtractionProperties.Tier cheapPremium = new ExtractionProperties.Tier();
        cheapPremium.setCostPerPage(0.00001);
        Map<String, ExtractionProperties.Tier> tiers = new LinkedHashMap<>();
        tiers.put("premium", cheapPremium);
        tiers.put("balanced", new ExtractionProperties.Tier());
        ExtractionProperties properties = new ExtractionProperties();
        properties.setTiers(tiers);

        List<ExtractionTier> order = properties.enabledTiers().stream().map(TierSettings::tier).toList();

        assertEquals(List.of(ExtractionTier.FAST, ExtractionTier.PREMIUM, ExtractionTier.BALANCED), order);
    }

    @Test
    void configuredValuesOverrideDefaults() {
        ExtractionProperties.Tier vision = new ExtractionProperties.Tier();
        vision.setServiceUrl("http://vision:8080");
        vision.setModel("qwen-vl");
        vision.setTimeoutSeconds(0);
        ExtractionProperties.Backoff backoff = new ExtractionProperties.Backoff();
        backoff.setMaxAttempts(3);
        backoff.setInitialBackoffMs(250);
        vision.setBackoff(backoff);
        ExtractionProperties properties = new ExtractionProperties();
        properties.setTiers(Map.of("balanced", vision));

        TierSettings settings = properties.settingsFor(ExtractionTier.BALANCED);

        assertTrue(settings.enabled());
        assertEquals("http://vision:8080", settings.serviceUrl());
        assertEquals("qwen-vl", settings.model());
        assertEquals(Duration.ofSeconds(1), settings.timeout());
        assertEquals(3, settings.backoff().maxAttempts());
        assertEquals(Duration.ofMillis(250), settings.backoff().initialDelay());
        assertEquals(ExtractionTier.BALANCED.defaultCostPerPage(), settings.costPerPage());
    }

    @Test
    void disabledTierIsLeftOut() {
        ExtractionProperties.Tier fast = new ExtractionProperties.Tier();
        fast.setEnabled(false);
        ExtractionProperties properties = new ExtractionProperties();
        properties.setTiers(Map.of("fast", fast));

        assertTrue(properties.enabledTiers().isEmpty());
    }
}
