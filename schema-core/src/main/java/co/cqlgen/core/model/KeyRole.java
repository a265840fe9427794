package co.cqlgen.core.model;

import co.cqlgen.core.SchemaConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Role a column plays in the table's primary key.
 *
 * <p>Wire names match the {@code key} attribute of a column definition:
 * {@code partition}, {@code cluster}, {@code cluster-asc}, {@code cluster-desc}.
 * An absent or empty value (or {@code none}) means the column is not part of the key.
 */
public enum KeyRole {
  NONE("none"),
  PARTITION("partition"),
  CLUSTER("cluster"),
  CLUSTER_ASC("cluster-asc"),
  CLUSTER_DESC("cluster-desc");

  private final String wireName;

  KeyRole(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isPartition() {
    return this == PARTITION;
  }

  public boolean isClustering() {
    return this == CLUSTER || this == CLUSTER_ASC || this == CLUSTER_DESC;
  }

  /**
   * Explicit sort direction for the clustering order clause, or {@code null} when the
   * column declares none (plain {@code cluster} and non-key columns).
   */
  public String sortDirection() {
    return switch (this) {
      case CLUSTER_ASC  -> "ASC";
      case CLUSTER_DESC -> "DESC";
      default           -> null;
    };
  }

  @JsonCreator
  public static KeyRole fromWireName(String value) {
    if (value == null || value.isBlank()) return NONE;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (KeyRole role : values()) {
      if (role.wireName.equals(v)) return role;
    }
    throw new SchemaConfigurationException("unsupported key role '" + value
        + "' (expected partition, cluster, cluster-asc, cluster-desc or none)");
  }
}
