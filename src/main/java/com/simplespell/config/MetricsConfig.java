package com.simplespell.config;

import com.simplespell.data.FrequencyModel;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {
    @Autowired
    public MetricsConfig(MeterRegistry registry, FrequencyModel model) {
        // 0 until the first corpus build
        Gauge.builder("spellcheck.vocabulary.size", model, m -> m.isInitialized() ? m.size() : 0)
                .register(registry);
    }
}
