package co.cqlgen.core;

import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads persist configurations from disk and validates them before anything is rendered.
 */
public final class PersistConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(PersistConfigLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  public static final String CONFIG_FILE_NAME = "persist-config.json";
  public static final String CONFIG_DIRECTORY = "config";

  private PersistConfigLoader() {}

  /**
   * Find {@code persist-config.json} in {@code workingDir}, falling back to
   * {@code workingDir/config}.
   */
  public static Path locate(Path workingDir) {
    Path direct = workingDir.resolve(CONFIG_FILE_NAME);
    if (Files.isRegularFile(direct)) return direct;
    Path nested = workingDir.resolve(CONFIG_DIRECTORY).resolve(CONFIG_FILE_NAME);
    if (Files.isRegularFile(nested)) return nested;
    throw new SchemaConfigurationException(CONFIG_FILE_NAME + " not found in " + workingDir
        + " or " + workingDir.resolve(CONFIG_DIRECTORY));
  }

  public static PersistConfig load(Path path) throws IOException {
    String content = read(path);
    PersistConfig config = parse(content, PersistConfig.class);
    LOG.debug("Loaded {} table definition(s) from {}", config.tables().size(), path);
    PersistConfigValidator.validate(config);
    return config;
  }

  /**
   * Legacy single-table mode: {@code path} holds a JSON array of column definitions.
   * The table name defaults to the lower-cased model name.
   */
  public static PersistConfig loadLegacy(Path path, String keyspace, String targetPackage,
                                         String modelName, String daoName, String tableName) throws IOException {
    String content = read(path);
    List<ColumnDefinition> columns = parse(content, new TypeReference<List<ColumnDefinition>>() {});
    String table = tableName == null || tableName.isBlank() ? modelName.toLowerCase(Locale.ROOT) : tableName;
    PersistConfig config = PersistConfig.singleTable(keyspace, targetPackage,
        new TableDefinition(modelName, table, daoName, modelName, columns));
    PersistConfigValidator.validate(config);
    return config;
  }

  private static String read(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new SchemaConfigurationException("schema file " + path + " does not exist");
    }
    String content = Files.readString(path);
    if (content.isBlank()) {
      throw new SchemaConfigurationException("schema file " + path + " is empty");
    }
    return content;
  }

  private static <T> T parse(String content, Class<T> type) throws IOException {
    try {
      return JSON.readValue(content, type);
    } catch (JsonMappingException e) {
      throw rethrowConfigurationProblem(e);
    }
  }

  private static <T> T parse(String content, TypeReference<T> type) throws IOException {
    try {
      return JSON.readValue(content, type);
    } catch (JsonMappingException e) {
      throw rethrowConfigurationProblem(e);
    }
  }

  // Creator failures (e.g. an unknown key role) arrive wrapped by Jackson; surface them as
  // configuration errors and leave every other mapping problem as the IOException it is.
  private static JsonMappingException rethrowConfigurationProblem(JsonMappingException e) {
    for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
      if (t instanceof SchemaConfigurationException sce) {
        throw new SchemaConfigurationException(sce.getMessage() + " at " + e.getPathReference(), sce);
      }
    }
    return e;
  }
}
