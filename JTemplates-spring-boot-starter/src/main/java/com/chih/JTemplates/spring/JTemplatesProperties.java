package com.chih.JTemplates.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import java.util.ArrayList;
import java.util.List;

/**
 * 模板集合配置
 * @author lizhiyuan
 * @since 2025/11/30 21:21
*/
@ConfigurationProperties(prefix = "j-templates")
public class JTemplatesProperties {

    /**
     * 模板根目录
     * 未配置时不创建 TemplateCollection
     */
    private String root;

    /**
     * 文件名 glob 模式，只匹配文件名
     */
    private List<String> patterns = new ArrayList<>();

    /**
     * 是否在每次获取模板时检查文件变化 (开发环境使用)
     */
    private boolean dynamic = false;

    public JTemplatesProperties() {
        // 默认约定：html 页面和 mustache 模板
        patterns.add("*.html");
        patterns.add("*.mustache");
    }

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public void setDynamic(boolean dynamic) {
        this.dynamic = dynamic;
    }
}
