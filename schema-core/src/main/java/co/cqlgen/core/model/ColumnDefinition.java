package co.cqlgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column of a table definition.
 *
 * @param name              column name, also used as the Java field name in generated code
 * @param storageType       CQL type string, e.g. {@code text}, {@code timestamp}, {@code list<blob>}
 * @param keyRole           role in the primary key
 * @param deserializeTarget type that each blob element of a {@code list<blob>} or
 *                          {@code map<text,blob>} column round-trips through; {@code null} when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("type") String storageType,
    @JsonProperty("key") KeyRole keyRole,
    @JsonProperty("deserializeTo") String deserializeTarget
) {
  public ColumnDefinition {
    if (keyRole == null) keyRole = KeyRole.NONE;
    if (deserializeTarget != null && deserializeTarget.isBlank()) deserializeTarget = null;
  }

  public static ColumnDefinition of(String name, String storageType) {
    return new ColumnDefinition(name, storageType, KeyRole.NONE, null);
  }

  public static ColumnDefinition of(String name, String storageType, KeyRole keyRole) {
    return new ColumnDefinition(name, storageType, keyRole, null);
  }

  public boolean hasDeserializeTarget() {
    return deserializeTarget != null;
  }
}
