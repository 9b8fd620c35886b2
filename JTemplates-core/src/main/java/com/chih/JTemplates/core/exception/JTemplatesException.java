package com.chih.JTemplates.core.exception;

/**
 * JTemplates 框架根异常
 */
public class JTemplatesException extends RuntimeException {
    public JTemplatesException(String message) {
        super(message);
    }

    public JTemplatesException(String message, Throwable cause) {
        super(message, cause);
    }
}
