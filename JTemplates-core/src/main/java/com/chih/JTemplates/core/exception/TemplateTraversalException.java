package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * 遍历模板根目录失败（目录不存在、不可读或中途出错）
 */
public class TemplateTraversalException extends JTemplatesException {
    public TemplateTraversalException(Path root, List<String> patterns, String reason, Throwable cause) {
        super(String.format("Failed to traverse root=\"%s\" while searching for template files with patterns %s: %s",
                root, patterns, reason), cause);
    }
}
