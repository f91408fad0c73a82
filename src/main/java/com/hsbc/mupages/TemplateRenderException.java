package com.hsbc.mupages;

/**
 * Thrown when a template cannot be compiled or rendered.
 */
public class TemplateRenderException extends Exception {

    /**
     * @param message The error message
     */
    public TemplateRenderException(String message) {
        super(message);
    }

    /**
     * @param message The error message
     * @param cause   The exception thrown by the template library
     */
    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
