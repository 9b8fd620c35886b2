package com.chih.JTemplates.spring.health;

import com.chih.JTemplates.core.engine.TemplateCollection;
import com.chih.JTemplates.core.exception.JTemplatesException;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * JTemplates 健康检查指示器
 * 最近一次重新加载失败时状态标记为 DOWN，此时仍在使用失败前的模板集合
 *
 * @author lizhiyuan
 * @since 2025/12/1 22:12
 */
public class JTemplatesHealthIndicator extends AbstractHealthIndicator {

    private final TemplateCollection templateCollection;

    public JTemplatesHealthIndicator(TemplateCollection templateCollection) {
        this.templateCollection = templateCollection;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        JTemplatesException error = templateCollection.getLastReloadError();

        if (error == null) {
            builder.up().withDetail("message", "All templates loaded successfully.");
        } else {
            builder.status(Status.DOWN).withDetail("message", "Last template reload failed, serving previous templates.")
                    .withDetail("error", error.getMessage());
        }
        builder.withDetail("root", templateCollection.getRoot().toString())
                .withDetail("patterns", templateCollection.getPatterns())
                .withDetail("dynamic", templateCollection.isDynamic())
                .withDetail("templateCount", templateCollection.templateSet().size())
                .withDetail("reloadCount", templateCollection.getReloadCount());
    }
}
