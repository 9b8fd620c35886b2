package com.chih.JTemplates.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author lizhiyuan
 */
public interface TemplateMetrics {

    /**
     * 查找不存在的模板时使用的模板名，避免调用方传入的任意名字变成指标标签
     */
    String UNKNOWN_TEMPLATE = "<unknown>";

    /**
     * 记录一次模板查找（动态模式下包含变更检查与可能的重新加载）
     *
     * @param templateName 模板名；名字不在集合中时为 {@link #UNKNOWN_TEMPLATE}
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordLookup(String templateName, long durationNs, boolean success);

    /**
     * 记录一次全量重新加载
     *
     * @param triggeredBy 触发重新加载的模板名
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordReload(String triggeredBy, long durationNs, boolean success);
}
