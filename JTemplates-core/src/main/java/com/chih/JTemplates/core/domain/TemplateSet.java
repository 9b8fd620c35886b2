package com.chih.JTemplates.core.domain;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一次加载产生的模板集合
 * <p>
 * 同时持有编译好的模板和加载时记录的每个文件的修改时间快照，两者的 key 完全一致。
 * 实例不可变，重新加载时整体替换，绝不原地修改。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public final class TemplateSet {

    private final Path root;
    private final Map<String, Template> templates;
    private final Map<String, FileTime> modTimes;

    public TemplateSet(Path root, Map<String, Template> templates, Map<String, FileTime> modTimes) {
        if (!templates.keySet().equals(modTimes.keySet())) {
            throw new IllegalArgumentException(
                    "Templates " + templates.keySet() + " and modification times " + modTimes.keySet() + " differ");
        }
        this.root = root;
        // 保留加载顺序
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        this.modTimes = Collections.unmodifiableMap(new LinkedHashMap<>(modTimes));
    }

    /**
     * 按名称查找模板
     *
     * @return 模板，不存在时返回 null
     */
    public Template lookup(String name) {
        return templates.get(name);
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    /**
     * 所有模板名，按加载顺序
     */
    public Set<String> getNames() {
        return templates.keySet();
    }

    public Collection<Template> getTemplates() {
        return templates.values();
    }

    public int size() {
        return templates.size();
    }

    /**
     * 加载时每个文件的修改时间快照
     */
    public Map<String, FileTime> getModTimes() {
        return modTimes;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return "TemplateSet{root='" + root + "', templates=" + templates.keySet() + "}";
    }
}
