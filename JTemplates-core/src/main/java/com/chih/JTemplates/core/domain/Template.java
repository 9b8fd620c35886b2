package com.chih.JTemplates.core.domain;

import com.chih.JTemplates.core.spi.TemplateEngine;

import java.io.StringWriter;
import java.io.Writer;
import java.util.Set;

/**
 * 编译好的单个模板
 * <p>
 * 句柄与产生它的 {@link TemplateSet} 绑定：集合被重新加载替换后，旧句柄仍然可以渲染，
 * 渲染的永远是旧集合中的内容（包括其引用的子模板），不会新旧混合。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public final class Template {

    private final String name;
    private final Object compiledTemplate;
    private final Set<String> dependencies;
    private final TemplateEngine engine;

    public Template(String name, Object compiledTemplate, Set<String> dependencies, TemplateEngine engine) {
        this.name = name;
        this.compiledTemplate = compiledTemplate;
        this.dependencies = dependencies != null ? Set.copyOf(dependencies) : Set.of();
        this.engine = engine;
    }

    /**
     * 渲染为字符串
     *
     * @param scope 数据上下文 (Map、POJO 等)，可为 null
     */
    public String render(Object scope) {
        StringWriter writer = new StringWriter();
        render(scope, writer);
        return writer.toString();
    }

    /**
     * 渲染到 writer，调用方负责关闭 writer
     */
    public void render(Object scope, Writer writer) {
        engine.render(name, compiledTemplate, scope, writer);
    }

    /**
     * @return 相对根目录的模板名，如 {@code s/b.html}
     */
    public String getName() {
        return name;
    }

    /**
     * 编译期引用到的子模板名，仅供查询
     */
    public Set<String> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "Template{name='" + name + "'}";
    }
}
