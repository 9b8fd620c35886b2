package com.chih.JTemplates.core.engine;

import com.chih.JTemplates.core.domain.Template;
import com.chih.JTemplates.core.domain.TemplateSet;
import com.chih.JTemplates.core.exception.JTemplatesException;
import com.chih.JTemplates.core.exception.TemplateIOException;
import com.chih.JTemplates.core.exception.TemplateNotFoundException;
import com.chih.JTemplates.core.exception.TemplateReloadException;
import com.chih.JTemplates.core.exception.TemplateRemovedException;
import com.chih.JTemplates.core.impl.MustacheTemplateEngine;
import com.chih.JTemplates.core.impl.NoOpTemplateMetrics;
import com.chih.JTemplates.core.spi.TemplateEngine;
import com.chih.JTemplates.core.spi.TemplateMetrics;
import com.chih.JTemplates.core.support.TemplateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 核心管理器：持有一个目录下所有模板编译出的集合，按名称提供模板
 *
 * <p>
 * 构造时完整加载一次（失败直接抛出，不会产生实例）。之后：
 * </p>
 * <ul>
 *   <li><strong>静态模式</strong>（{@code dynamic = false}）：集合只读，{@link #get(String)} 无锁、无 IO，适合生产环境</li>
 *   <li><strong>动态模式</strong>（{@code dynamic = true}）：每次 {@link #get(String)} 都检查所有文件的修改时间，
 *       任意一个文件比快照新，就重新加载整个集合后再返回，适合开发环境</li>
 * </ul>
 *
 * <p>
 * 锁说明：
 * </p>
 * <ul>
 *   <li>动态模式下 {@link #get(String)} 整体串行：查找、变更检查、重新加载在同一把锁内完成，
 *       不会有两次重新加载重叠，也不会读到替换了一半的集合</li>
 *   <li>集合与修改时间快照放在同一个不可变的 {@link TemplateSet} 中，通过替换一个 volatile 引用整体切换</li>
 *   <li>重新加载很慢时，所有并发调用都会被阻塞，没有超时</li>
 * </ul>
 *
 * <p>
 * 由于拿不到模板之间的引用关系，任何一个文件变化都会触发全量重新加载。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * TemplateCollection templates = new TemplateCollection(
 *     Paths.get("templates"),               // 扫描的根目录
 *     List.of("*.html", "*.js", "*.css"),   // 文件名模式
 *     devMode);                             // true 时监控文件变化
 *
 * Template t = templates.get("nav/login.html");  // 文件变化时会重新加载
 * t.render(model, response.getWriter());
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public class TemplateCollection {

    private static final Logger log = LoggerFactory.getLogger(TemplateCollection.class);

    private final TemplateSetLoader loader;
    private final boolean dynamic;
    private final TemplateMetrics metrics;

    // 只在动态模式下使用
    private final ReentrantLock lock = new ReentrantLock();

    // 当前集合；只在持有 lock 时替换
    private volatile TemplateSet current;

    private volatile JTemplatesException lastReloadError;
    private volatile long reloadCount;

    /**
     * 使用默认的 Mustache 引擎，不记录监控指标
     *
     * @param root 模板根目录
     * @param patterns 文件名 glob 模式（只匹配文件名，不含目录部分）
     * @param dynamic 为 true 时每次 get 都检查文件变化
     */
    public TemplateCollection(Path root, List<String> patterns, boolean dynamic) {
        this(root, patterns, dynamic, new MustacheTemplateEngine(), new NoOpTemplateMetrics());
    }

    public TemplateCollection(Path root, List<String> patterns, boolean dynamic,
                              TemplateEngine templateEngine, TemplateMetrics metrics) {
        this(new TemplateSetLoader(root, patterns, templateEngine), dynamic, metrics);
    }

    /**
     * 全参构造函数
     *
     * @param loader 模板集合加载器
     * @param dynamic 为 true 时每次 get 都检查文件变化
     * @param metrics 监控指标，为 null 时不记录
     * @throws JTemplatesException 首次加载失败（包括没有任何文件匹配）
     */
    public TemplateCollection(TemplateSetLoader loader, boolean dynamic, TemplateMetrics metrics) {
        this.loader = loader;
        this.dynamic = dynamic;
        this.metrics = (metrics != null) ? metrics : new NoOpTemplateMetrics();

        // 首次加载，失败直接抛出
        this.current = loader.build();
        log.info("Initialized {} templates under {} (dynamic={}).", current.size(), loader.getRoot(), dynamic);
    }

    /**
     * 按名称获取模板
     * <p>
     * 动态模式下，如果任何文件发生了变化，会先重新加载整个集合。
     * </p>
     *
     * @param name 相对根目录的模板名，如 {@code s/b.html}
     * @return 编译好的模板
     * @throws TemplateNotFoundException 模板不存在
     * @throws TemplateRemovedException 重新加载后模板不存在了
     * @throws TemplateIOException 检查文件修改时间失败
     * @throws TemplateReloadException 重新加载失败，之前的集合继续生效
     */
    public Template get(String name) {
        long startTime = System.nanoTime();
        boolean success = false;
        String metricName = name;
        try {
            Template template = dynamic ? getDynamic(name) : lookup(current, name);
            success = true;
            return template;
        } catch (TemplateNotFoundException e) {
            // 被移除的模板曾经存在，保留原名；其余名字来自调用方，数量不受控
            if (!(e instanceof TemplateRemovedException)) {
                metricName = TemplateMetrics.UNKNOWN_TEMPLATE;
            }
            throw e;
        } finally {
            metrics.recordLookup(metricName, System.nanoTime() - startTime, success);
        }
    }

    private Template getDynamic(String name) {
        lock.lock();
        try {
            TemplateSet templateSet = current;
            // 先确认名字有效，再做变更检查
            Template template = lookup(templateSet, name);

            String changed = findChangedFile(templateSet, name);
            if (changed == null) {
                return template;
            }

            // 无法只更新一个模板的定义，只能整体重新加载
            log.info("Template file {} changed under {}, reloading all templates (requested: {})",
                    changed, loader.getRoot(), name);
            TemplateSet reloaded = reload(name);
            Template fresh = reloaded.lookup(name);
            if (fresh == null) {
                throw new TemplateRemovedException(name, loader.getRoot(), loader.getPatterns());
            }
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 找到第一个修改时间晚于快照的文件
     *
     * @return 变化的模板名，没有变化时返回 null
     */
    private String findChangedFile(TemplateSet templateSet, String requested) {
        for (Map.Entry<String, FileTime> entry : templateSet.getModTimes().entrySet()) {
            TemplateFile file = TemplateFile.forName(loader.getRoot(), entry.getKey());
            FileTime modTime;
            try {
                modTime = file.readModifiedTime();
            } catch (TemplateIOException e) {
                throw new TemplateIOException(file.getPath(), String.format(
                        "get(\"%s\"): failed to get file info for template \"%s\", path \"%s\"",
                        requested, file.getName(), file.getPath()), e);
            }
            if (modTime.compareTo(entry.getValue()) > 0) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * 重新加载并替换当前集合；失败时当前集合保持不变
     * 调用方必须持有 lock
     */
    private TemplateSet reload(String triggeredBy) {
        long startTime = System.nanoTime();
        try {
            TemplateSet reloaded = loader.build();
            current = reloaded;
            lastReloadError = null;
            reloadCount++;
            metrics.recordReload(triggeredBy, System.nanoTime() - startTime, true);
            return reloaded;
        } catch (JTemplatesException e) {
            log.error("Failed to reload templates under {}, triggered by {}", loader.getRoot(), triggeredBy, e);
            TemplateReloadException failure = new TemplateReloadException(triggeredBy, e);
            lastReloadError = failure;
            metrics.recordReload(triggeredBy, System.nanoTime() - startTime, false);
            throw failure;
        }
    }

    private Template lookup(TemplateSet templateSet, String name) {
        Template template = templateSet.lookup(name);
        if (template == null) {
            throw new TemplateNotFoundException(name, loader.getRoot(), loader.getPatterns());
        }
        return template;
    }

    /**
     * 返回当前的模板集合，不做变更检查
     * <p>
     * 可用于枚举所有模板，如 {@code templates.templateSet().getNames()}。
     * 需要最新内容时请使用 {@link #get(String)}。
     * </p>
     */
    public TemplateSet templateSet() {
        return current;
    }

    public Path getRoot() {
        return loader.getRoot();
    }

    public List<String> getPatterns() {
        return loader.getPatterns();
    }

    public boolean isDynamic() {
        return dynamic;
    }

    /**
     * 最近一次重新加载的失败原因，成功加载后清空
     *
     * @return 失败原因，没有失败时返回 null
     */
    public JTemplatesException getLastReloadError() {
        return lastReloadError;
    }

    /**
     * 构造之后成功重新加载的次数
     */
    public long getReloadCount() {
        return reloadCount;
    }
}
