package co.cqlgen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Root of a persist configuration ({@code persist-config.json}). Passed by value into the
 * generator; nothing in the pipeline keeps process-wide state.
 *
 * @param keyspace          keyspace qualifying every generated statement
 * @param targetPackage     Java package of the generated DAO classes
 * @param boilerplatePath   optional FreeMarker template spliced into every DAO
 * @param additionalImports extra import lines for every DAO, in configured order
 * @param modelImportAlias  package of the model classes the DAOs read and write; falls back to
 *                          the model-generation package, then to {@code targetPackage}
 * @param modelGeneration   optional DTO generation target
 * @param tables            tables, processed in this order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistConfig(
    @JsonProperty("keyspace") String keyspace,
    @JsonProperty("package") String targetPackage,
    @JsonProperty("boilerplate") String boilerplatePath,
    @JsonProperty("imports") List<String> additionalImports,
    @JsonProperty("modelPackage") String modelImportAlias,
    @JsonProperty("ModelGeneration") @JsonAlias({"modelGeneration"}) ModelGenerationTarget modelGeneration,
    @JsonProperty("tables") List<TableDefinition> tables
) {
  public PersistConfig {
    additionalImports = additionalImports == null
        ? List.of() : Collections.unmodifiableList(new ArrayList<>(additionalImports));
    tables = tables == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tables));
    if (boilerplatePath != null && boilerplatePath.isBlank()) boilerplatePath = null;
    if (modelImportAlias != null && modelImportAlias.isBlank()) modelImportAlias = null;
  }

  /**
   * Wrap a single table into a configuration, as the legacy {@code --model/--dao} mode does.
   */
  public static PersistConfig singleTable(String keyspace, String targetPackage, TableDefinition table) {
    return new PersistConfig(keyspace, targetPackage, null, List.of(), null, null, List.of(table));
  }

  public Optional<ModelGenerationTarget> modelGenerationTarget() {
    return Optional.ofNullable(modelGeneration);
  }

  public Optional<String> boilerplate() {
    return Optional.ofNullable(boilerplatePath);
  }

  /**
   * Package the generated DAOs import their model classes from.
   */
  public String modelPackage() {
    if (modelImportAlias != null) return modelImportAlias;
    if (modelGeneration != null && modelGeneration.packageName() != null
        && !modelGeneration.packageName().isBlank()) {
      return modelGeneration.packageName();
    }
    return targetPackage;
  }
}
