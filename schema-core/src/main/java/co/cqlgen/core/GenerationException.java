package co.cqlgen.core;

/**
 * Root of the generator's failure taxonomy. Every subclass is fatal for the whole run:
 * the pipeline stops at the first one and the top-level caller decides how to exit.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
