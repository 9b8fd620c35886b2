package com.chih.JTemplates.core.exception;

import java.nio.file.Path;
import java.util.List;

public class EmptyTemplateSetException extends JTemplatesException {
    public EmptyTemplateSetException(Path root, List<String> patterns) {
        super(String.format("Zero templates found under root=\"%s\" with patterns %s", root, patterns));
    }
}
