package com.chih.JTemplates.core.impl;

import com.chih.JTemplates.core.spi.TemplateMetrics;

public class NoOpTemplateMetrics implements TemplateMetrics {
    @Override
    public void recordLookup(String templateName, long durationNs, boolean success) {
        // Do nothing
    }

    @Override
    public void recordReload(String triggeredBy, long durationNs, boolean success) {
        // Do nothing
    }
}
