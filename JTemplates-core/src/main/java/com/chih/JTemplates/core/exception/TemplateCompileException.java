package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

public class TemplateCompileException extends JTemplatesException {

    private final String templateName;

    public TemplateCompileException(String templateName, Path root, List<String> patterns, Throwable cause) {
        super(String.format("Failed to compile template \"%s\" under root=\"%s\" with patterns %s: %s",
                templateName, root, patterns, cause.getMessage()), cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
