package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

public class TemplatePatternException extends JTemplatesException {

    private final String pattern;

    public TemplatePatternException(String pattern, Path root, List<String> patterns, Throwable cause) {
        super(String.format("Invalid template file pattern \"%s\" under root=\"%s\" with patterns %s: %s",
                pattern, root, patterns, cause.getMessage()), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
