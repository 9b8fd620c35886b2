package com.chih.JTemplates.spring.metrics;

import com.chih.JTemplates.core.spi.TemplateMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jtemplates.lookup.timer / jtemplates.lookup.count: 模板查找（含动态模式下的变更检查和重新加载），
 *       tags: template={模板名}, result={success|failure}</li>
 *   <li>jtemplates.reload.timer / jtemplates.reload.count: 重新加载，
 *       tags: trigger={触发重新加载的模板名}, result={success|failure}</li>
 * </ul>
 * </p>
 * <p>
 * 查找不存在的模板时，TemplateCollection 传入的是 {@link TemplateMetrics#UNKNOWN_TEMPLATE}，
 * 因此 template 标签的取值不会超过集合中出现过的模板名。
 * </p>
 */
public class MicrometerTemplateMetrics implements TemplateMetrics {

    private final MeterRegistry registry;

    public MicrometerTemplateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordLookup(String templateName, long durationNs, boolean success) {
        record("jtemplates.lookup", "template lookup", "template", templateName, durationNs, success);
    }

    @Override
    public void recordReload(String triggeredBy, long durationNs, boolean success) {
        record("jtemplates.reload", "template reload", "trigger", triggeredBy, durationNs, success);
    }

    private void record(String prefix, String description, String tagKey, String tagValue,
                        long durationNs, boolean success) {
        String result = success ? "success" : "failure";
        // Micrometer 不接受 null 的 tag 值
        String value = (tagValue != null) ? tagValue : "";

        Timer.builder(prefix + ".timer")
                .description("Timer for " + description)
                .tag(tagKey, value)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder(prefix + ".count")
                .description("Counter for " + description)
                .tag(tagKey, value)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
