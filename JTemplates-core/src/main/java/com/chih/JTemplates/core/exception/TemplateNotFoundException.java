package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * 请求的模板名不在当前模板集合中
 *
 * @see TemplateRemovedException
 */
public class TemplateNotFoundException extends JTemplatesException {

    private final String templateName;

    public TemplateNotFoundException(String templateName, Path root, List<String> patterns) {
        this(templateName, String.format("Template \"%s\" not found in collection in root=\"%s\", patterns=%s",
                templateName, root, patterns));
    }

    protected TemplateNotFoundException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
