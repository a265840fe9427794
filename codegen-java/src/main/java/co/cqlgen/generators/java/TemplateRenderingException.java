package co.cqlgen.generators.java;

import co.cqlgen.core.GenerationException;

/**
 * A template failed to parse or to execute against an emission model. Fatal for the whole run.
 */
public class TemplateRenderingException extends GenerationException {

    public TemplateRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
