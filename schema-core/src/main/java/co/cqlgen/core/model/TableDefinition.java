package co.cqlgen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table to generate a DAO (and optionally a DTO) for. Column order is significant:
 * it is preserved in generated field order, scan order and insert order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableDefinition(
    @JsonProperty("modelName") String modelName,
    @JsonProperty("tableName") String tableName,
    @JsonProperty("dao") @JsonAlias({"daoName"}) String daoName,
    @JsonProperty("generatedName") @JsonAlias({"generatedArtifactName"}) String generatedArtifactName,
    @JsonProperty("columns") List<ColumnDefinition> columns
) {
  public TableDefinition {
    columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
    if (generatedArtifactName == null || generatedArtifactName.isBlank()) generatedArtifactName = modelName;
  }
}
