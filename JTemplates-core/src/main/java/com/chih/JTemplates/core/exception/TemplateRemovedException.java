package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * 模板在重新加载前存在，重新加载后消失（文件被删除或改名）
 */
public class TemplateRemovedException extends TemplateNotFoundException {
    public TemplateRemovedException(String templateName, Path root, List<String> patterns) {
        super(templateName, String.format(
                "After reload, template \"%s\" no longer found in collection in root=\"%s\", patterns=%s",
                templateName, root, patterns));
    }
}
