package com.chih.JTemplates.spring;

import com.chih.JTemplates.core.engine.TemplateCollection;
import com.chih.JTemplates.core.impl.MustacheTemplateEngine;
import com.chih.JTemplates.core.impl.NoOpTemplateMetrics;
import com.chih.JTemplates.core.spi.TemplateEngine;
import com.chih.JTemplates.core.spi.TemplateMetrics;
import com.chih.JTemplates.spring.health.JTemplatesHealthIndicator;
import com.chih.JTemplates.spring.metrics.MicrometerTemplateMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * JTemplates Spring Boot 自动配置类。
 * <p>
 * 根据 {@code j-templates.*} 配置创建 {@link TemplateCollection}，并按类路径接入监控指标和健康检查。
 * </p>
 *
 * <h3>Bean 配置策略：</h3>
 * <ul>
 *   <li><strong>@ConditionalOnMissingBean</strong>：允许用户自定义实现覆盖默认配置</li>
 *   <li><strong>@ConditionalOnProperty</strong>：只有配置了根目录才创建模板集合</li>
 *   <li><strong>@ConditionalOnClass</strong>：Micrometer、Actuator 存在时才启用对应功能</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * // application.yml
 * j-templates:
 *   root: ./templates
 *   patterns:
 *     - "*.html"
 *     - "*.css"
 *   dynamic: true     # 开发环境，修改文件后立即生效
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 * @see JTemplatesProperties
 * @see TemplateCollection
 */
@Configuration
@EnableConfigurationProperties(JTemplatesProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class TemplateAutoConfiguration {

    /**
     * 默认模板引擎，用户没有自定义 TemplateEngine 时使用 Mustache
     */
    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine() {
        return new MustacheTemplateEngine();
    }

    /**
     * 监控组件配置。
     * <p>
     * Micrometer 在类路径中且存在 MeterRegistry Bean 时使用 Micrometer 实现，
     * 否则由下面的保底配置注入 NoOp 实现。
     * </p>
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(TemplateMetrics.class)
        public TemplateMetrics templateMetrics(MeterRegistry registry) {
            return new MicrometerTemplateMetrics(registry);
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(TemplateMetrics.class)
    public TemplateMetrics defaultTemplateMetrics() {
        return new NoOpTemplateMetrics();
    }

    /**
     * 模板集合。构造时完整加载一次，失败会让应用启动失败。
     */
    @Bean
    @ConditionalOnMissingBean(TemplateCollection.class)
    @ConditionalOnProperty(prefix = "j-templates", name = "root")
    public TemplateCollection templateCollection(JTemplatesProperties properties,
            TemplateEngine engine,
            TemplateMetrics metrics) {
        return new TemplateCollection(Paths.get(properties.getRoot()), properties.getPatterns(),
                properties.isDynamic(), engine, metrics);
    }

    /**
     * 健康检查自动配置
     * 只有当引入了 Actuator (存在 HealthIndicator 类) 且配置了模板根目录时才生效
     */
    @Configuration
    @ConditionalOnClass(HealthIndicator.class)
    @ConditionalOnProperty(prefix = "j-templates", name = "root")
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "jTemplatesHealthIndicator")
        public JTemplatesHealthIndicator jTemplatesHealthIndicator(TemplateCollection templateCollection) {
            return new JTemplatesHealthIndicator(templateCollection);
        }
    }
}
