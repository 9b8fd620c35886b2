package com.chih.JTemplates.core.spi;

import java.util.Set;

/**
 * 编译模板 记录编译期引用到的子模板名
 * @author lizhiyuan
 * @since 2025/12/2 21:16
*/
public class CompiledTemplate {

    // 具体的模板引擎对象 (如 Mustache)
    private final Object engineObject;

    // 编译过程中发现的子模板依赖（仅供查询，不参与失效判断）
    private final Set<String> dependencies;

    public CompiledTemplate(Object engineObject, Set<String> dependencies) {
        this.engineObject = engineObject;
        this.dependencies = dependencies;
    }

    public Object getEngineObject() {
        return engineObject;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }
}
