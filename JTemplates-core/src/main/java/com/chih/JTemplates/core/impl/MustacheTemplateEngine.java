package com.chih.JTemplates.core.impl;

import com.chih.JTemplates.core.exception.TemplateRenderException;
import com.chih.JTemplates.core.spi.CompiledTemplate;
import com.chih.JTemplates.core.spi.TemplateEngine;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * 基于 Mustache 的模板引擎实现
 * 支持 {{user.name}}, {{#list}}循环, {{> s/b.html}} 子模板 等特性
 * <p>
 * 子模板名始终按相对根目录的路径解析（与引用方所在目录无关，也不会自动补扩展名），
 * 内容只来自同一批次的 partialLoader，因此一个模板和它引用的子模板总是来自同一次加载。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    @Override
    public CompiledTemplate compile(String template, String name, Function<String, String> partialLoader) {
        if (template == null) {
            return null;
        }
        try {
            // 每次编译创建一个临时的 Factory，绑定当前批次的 partialLoader
            // 创建 Factory 有开销，但只在（重新）加载时发生
            TemplateSetMustacheFactory mf = new TemplateSetMustacheFactory(partialLoader);
            Mustache mustache = mf.compile(new StringReader(template), name);
            return new CompiledTemplate(mustache, Collections.unmodifiableSet(mf.getRecordedDependencies()));
        } catch (Exception e) {
            log.error("Failed to compile mustache template: {}", name, e);
            throw e;
        }
    }

    @Override
    public void render(String name, Object compiledTemplate, Object scope, Writer writer) {
        if (compiledTemplate == null) {
            return;
        }

        try {
            Mustache mustache = (Mustache) compiledTemplate;
            mustache.execute(writer, scope != null ? scope : Collections.emptyMap());
            writer.flush();
        } catch (Exception e) {
            log.error("Template execution failed: {}", name, e);
            throw new TemplateRenderException(name, e);
        }
    }

    /**
     * 自定义 Mustache 工厂，子模板只从本批次读取到的源码中加载
     */
    private static class TemplateSetMustacheFactory extends DefaultMustacheFactory {
        private final Function<String, String> partialLoader;
        // 记录编译期遇到的所有引用
        private final Set<String> recordedDependencies = new LinkedHashSet<>();

        TemplateSetMustacheFactory(Function<String, String> partialLoader) {
            this.partialLoader = partialLoader;
        }

        @Override
        public String resolvePartialPath(String dir, String name, String extension) {
            // {{> s/b.html}} 与 {{> /s/b.html}} 等价，都相对根目录
            return name.startsWith("/") ? name.substring(1) : name;
        }

        @Override
        public Reader getReader(String resourceName) {
            // Mustache 调用此方法说明模板中出现了 {{> resourceName}}
            // 同一个 Factory 内编译结果会被缓存，所以每个名字只会到这里一次
            recordedDependencies.add(resourceName);

            String content = partialLoader != null ? partialLoader.apply(resourceName) : null;
            if (content == null) {
                throw new MustacheNotFoundException(resourceName);
            }
            return new StringReader(content);
        }

        Set<String> getRecordedDependencies() {
            return recordedDependencies;
        }
    }
}
