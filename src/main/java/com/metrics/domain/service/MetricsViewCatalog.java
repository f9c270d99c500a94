package com.metrics.domain.service;

import com.metrics.domain.exception.NotFoundException;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.infrastructure.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only lookup of metrics views by name, populated from configuration.
 */
@Slf4j
@Component
public class MetricsViewCatalog {
    
    private final Map<String, MetricsViewSpec> views;
    
    @Autowired
    public MetricsViewCatalog(EngineProperties properties) {
        this(properties.getViews());
    }
    
    public MetricsViewCatalog(Map<String, MetricsViewSpec> views) {
        Map<String, MetricsViewSpec> byName = new HashMap<>();
        views.forEach((name, view) -> {
            if (view.getName() == null) {
                view.setName(name);
            }
            byName.put(name, view);
        });
        this.views = Collections.unmodifiableMap(byName);
        log.info("Loaded {} metrics views: {}", this.views.size(), this.views.keySet());
    }
    
    public MetricsViewSpec get(String name) {
        MetricsViewSpec view = views.get(name);
        if (view == null) {
            throw NotFoundException.view(name);
        }
        return view;
    }
}
