package com.chih.JTemplates.core.exception;

import java.nio.file.Path;

/**
 * 读取模板文件内容或修改时间失败
 */
public class TemplateIOException extends JTemplatesException {

    private final Path path;

    public TemplateIOException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public TemplateIOException(Path path, String message) {
        super(message);
        this.path = path;
    }

    /**
     * @return 出错的文件路径
     */
    public Path getPath() {
        return path;
    }
}
