package com.chih.JTemplates.core.exception;

public class TemplateRenderException extends JTemplatesException {
    public TemplateRenderException(String name, Throwable cause) {
        super("Failed to render template: " + name, cause);
    }
}
