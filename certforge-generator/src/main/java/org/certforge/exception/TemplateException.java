package org.certforge.exception;

import lombok.Getter;

@Getter
public class TemplateException extends RuntimeException {

    private final TemplateError error;

    public TemplateException(TemplateError error, String message) {
        super(message);
        this.error = error;
    }

    public TemplateException(TemplateError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
