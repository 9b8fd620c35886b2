package com.chih.JTemplates.core.exception;

/**
 * 动态模式下重新加载失败，cause 为具体的构建异常
 */
public class TemplateReloadException extends JTemplatesException {

    private final String triggeredBy;

    public TemplateReloadException(String triggeredBy, JTemplatesException cause) {
        super(String.format("Failed to reload templates, triggered by template \"%s\": %s",
                triggeredBy, cause.getMessage()), cause);
        this.triggeredBy = triggeredBy;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }
}
