package co.cqlgen.core;

/**
 * The persist configuration is missing, empty or violates a structural rule
 * (no tables, a table without columns, a table without a partition key, ...).
 */
public class SchemaConfigurationException extends GenerationException {

  public SchemaConfigurationException(String message) {
    super(message);
  }

  public SchemaConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
