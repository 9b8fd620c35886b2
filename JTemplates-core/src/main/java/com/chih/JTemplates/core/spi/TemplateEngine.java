package com.chih.JTemplates.core.spi;

import java.io.Writer;
import java.util.function.Function;

/**
 * 模板引擎 SPI 接口
 * 允许用户替换底层的编译与渲染逻辑
 *
 * @author lizhiyuan
 * @since 2025/11/30
 */
public interface TemplateEngine {

    /**
     * 1. 编译阶段：将模板源码编译为模板集合中的一个具名成员
     *
     * @param template 模板源码
     * @param name 成员名（相对根目录的路径，如 {@code s/b.html}）
     * @param partialLoader 子模板加载器 (输入子模板名称，返回同一批次读取到的源码，不存在时返回 null)。
     *                      如果为 null，则不支持子模板。
     * @return 编译后的对象
     */
    CompiledTemplate compile(String template, String name, Function<String, String> partialLoader);

    /**
     * 2. 执行阶段：使用编译好的对象渲染到 writer
     *
     * @param name 模板名，用于错误信息
     * @param compiledTemplate 编译后的对象 (来自于 compile 方法返回的 {@link CompiledTemplate#getEngineObject()})
     * @param scope 数据上下文，可为 null
     * @param writer 输出目标，调用方负责关闭
     */
    void render(String name, Object compiledTemplate, Object scope, Writer writer);
}
