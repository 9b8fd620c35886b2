package com.chih.JTemplates.core.engine;

import com.chih.JTemplates.core.domain.Template;
import com.chih.JTemplates.core.domain.TemplateSet;
import com.chih.JTemplates.core.exception.EmptyTemplateSetException;
import com.chih.JTemplates.core.exception.TemplateCompileException;
import com.chih.JTemplates.core.exception.TemplateIOException;
import com.chih.JTemplates.core.spi.CompiledTemplate;
import com.chih.JTemplates.core.spi.TemplateEngine;
import com.chih.JTemplates.core.support.TemplateFile;
import com.chih.JTemplates.core.support.TemplateFileScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 模板集合加载器：扫描根目录、读取文件、编译为一个 {@link TemplateSet}
 * <p>
 * 每次 {@link #build()} 都是完整的一次加载，任何一步失败都会中止，不会返回部分结果。
 * 除读取文件系统外没有副作用，可被多个线程同时调用。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * TemplateSetLoader loader = new TemplateSetLoader(
 *     Paths.get("/srv/templates"),
 *     List.of("*.html", "*.css"),
 *     new MustacheTemplateEngine());
 * TemplateSet set = loader.build();
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public class TemplateSetLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateSetLoader.class);

    private final Path root;
    private final List<String> patterns;
    private final TemplateEngine templateEngine;

    /**
     * @param root 模板根目录
     * @param patterns 文件名 glob 模式，按顺序匹配，重复的模式会被去掉
     * @param templateEngine 模板引擎
     * @throws IllegalArgumentException 参数为 null，或模式列表为空、包含 null
     */
    public TemplateSetLoader(Path root, List<String> patterns, TemplateEngine templateEngine) {
        if (root == null) {
            throw new IllegalArgumentException("Template root cannot be null");
        }
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Template patterns cannot be null or empty");
        }
        if (patterns.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Template patterns cannot contain null: " + patterns);
        }
        if (templateEngine == null) {
            throw new IllegalArgumentException("Template engine cannot be null");
        }
        this.root = root;
        // 创建副本，避免外部修改影响内部状态
        this.patterns = List.copyOf(new LinkedHashSet<>(patterns));
        this.templateEngine = templateEngine;
    }

    /**
     * 完整加载一次
     *
     * @return 编译好的模板集合，附带每个文件的修改时间快照
     * @throws com.chih.JTemplates.core.exception.TemplateTraversalException 根目录无法遍历
     * @throws com.chih.JTemplates.core.exception.TemplatePatternException 模式语法错误
     * @throws TemplateIOException 文件读取失败
     * @throws TemplateCompileException 模板语法错误
     * @throws EmptyTemplateSetException 没有任何文件匹配
     */
    public TemplateSet build() {
        long startTime = System.nanoTime();

        List<TemplateFile> files = new TemplateFileScanner(root, patterns).scan();

        Map<String, FileTime> modTimes = new LinkedHashMap<>();
        Map<String, String> sources = new LinkedHashMap<>();
        for (TemplateFile file : files) {
            try {
                // 先取修改时间再读内容：读取期间若文件又被改动，下次检查一定能发现
                modTimes.put(file.getName(), file.readModifiedTime());
                sources.put(file.getName(), file.readContent());
            } catch (TemplateIOException e) {
                throw new TemplateIOException(e.getPath(), String.format(
                        "Failed to load templates under root=\"%s\" with patterns %s: %s",
                        root, patterns, e.getMessage()), e);
            }
        }

        if (sources.isEmpty()) {
            throw new EmptyTemplateSetException(root, patterns);
        }

        // 子模板只从本批次读取到的内容中加载
        Function<String, String> partialLoader = sources::get;

        Map<String, Template> templates = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : sources.entrySet()) {
            String name = entry.getKey();
            templates.put(name, compile(name, entry.getValue(), partialLoader));
        }

        TemplateSet templateSet = new TemplateSet(root, templates, modTimes);
        log.info("Loaded {} templates under {} with patterns {} in {} ms",
                templateSet.size(), root, patterns,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return templateSet;
    }

    private Template compile(String name, String source, Function<String, String> partialLoader) {
        CompiledTemplate compiled;
        try {
            compiled = templateEngine.compile(source, name, partialLoader);
        } catch (RuntimeException e) {
            throw new TemplateCompileException(name, root, patterns, e);
        }
        if (compiled == null) {
            throw new TemplateCompileException(name, root, patterns,
                    new IllegalStateException("Template engine returned no compiled template"));
        }
        return new Template(name, compiled.getEngineObject(), compiled.getDependencies(), templateEngine);
    }

    public Path getRoot() {
        return root;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
