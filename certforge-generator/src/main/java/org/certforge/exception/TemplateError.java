package org.certforge.exception;

import lombok.Getter;

@Getter
public enum TemplateError {
    UNKNOWN_VARIANT("Unknown template variant: %s (available: %s)"),
    MISSING_PALETTE_ROLE("Palette is missing required role '%s' for %s"),
    VARIANT_NOT_RENDERED("Variant '%s' has not been rendered, missing file: %s"),
    TEMPLATE_WRITE_FAILED("Failed to write template to %s: %s"),
    TEMPLATE_COPY_FAILED("Failed to copy template %s to %s: %s"),
    RENDER_FAILED("Rendering of variant '%s' failed: %s");

    private final String message;

    TemplateError(String message) {
        this.message = message;
    }

    public TemplateException createException(Object... details) {
        return new TemplateException(this, String.format(message, details));
    }

    public TemplateException createException(Throwable cause, Object... details) {
        return new TemplateException(this, String.format(message, details), cause);
    }
}
