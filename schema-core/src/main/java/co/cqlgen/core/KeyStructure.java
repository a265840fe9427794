package co.cqlgen.core;

import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.KeyRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Key layout of one table, derived once from its ordered columns, plus the CQL fragments
 * built from it.
 *
 * <ul>
 *   <li>{@code partitionKeys}: columns with role {@code partition}, in column order</li>
 *   <li>{@code clusteringKeys}: columns with role {@code cluster}, {@code cluster-asc} or
 *       {@code cluster-desc}, in column order</li>
 *   <li>{@code clusteringOrder}: {@code "name ASC|DESC"} for {@code cluster-asc}/{@code cluster-desc}
 *       columns only</li>
 *   <li>{@code allKeys}: every key column, in column order</li>
 * </ul>
 */
public final class KeyStructure {

  private final List<String> partitionKeys;
  private final List<String> clusteringKeys;
  private final List<String> clusteringOrder;
  private final List<String> allKeys;

  private KeyStructure(List<String> partitionKeys, List<String> clusteringKeys,
                       List<String> clusteringOrder, List<String> allKeys) {
    this.partitionKeys = Collections.unmodifiableList(partitionKeys);
    this.clusteringKeys = Collections.unmodifiableList(clusteringKeys);
    this.clusteringOrder = Collections.unmodifiableList(clusteringOrder);
    this.allKeys = Collections.unmodifiableList(allKeys);
  }

  /**
   * Derive the key layout of {@code table} from its columns.
   *
   * @throws SchemaConfigurationException if no column is a partition key
   */
  public static KeyStructure of(String table, List<ColumnDefinition> columns) {
    List<String> partition = new ArrayList<>();
    List<String> clustering = new ArrayList<>();
    List<String> order = new ArrayList<>();
    List<String> all = new ArrayList<>();

    for (ColumnDefinition col : columns) {
      KeyRole role = col.keyRole();
      if (role.isPartition()) {
        partition.add(col.name());
        all.add(col.name());
      } else if (role.isClustering()) {
        clustering.add(col.name());
        all.add(col.name());
      }
      if (role.sortDirection() != null) {
        order.add(col.name() + " " + role.sortDirection());
      }
    }

    if (partition.isEmpty()) {
      throw new SchemaConfigurationException("Partitioning keys were empty for table " + table);
    }
    return new KeyStructure(partition, clustering, order, all);
  }

  public List<String> partitionKeys() { return partitionKeys; }
  public List<String> clusteringKeys() { return clusteringKeys; }
  public List<String> clusteringOrder() { return clusteringOrder; }
  public List<String> allKeys() { return allKeys; }

  /**
   * A single partition key stands alone; a composite one is parenthesized, as the
   * primary key clause requires.
   */
  public String partitionKeyClause() {
    if (partitionKeys.size() == 1) return partitionKeys.get(0);
    return "(" + String.join(", ", partitionKeys) + ")";
  }

  /**
   * {@code ", c1, c2"} to append after the partition key clause; empty without clustering keys.
   */
  public String clusteringColumnsClause() {
    if (clusteringKeys.isEmpty()) return "";
    return ", " + String.join(", ", clusteringKeys);
  }

  /**
   * {@code "WITH CLUSTERING ORDER BY (c1 ASC, c2 DESC)"}; empty when no column declares a direction.
   */
  public String clusteringOrderClause() {
    if (clusteringOrder.isEmpty()) return "";
    return "WITH CLUSTERING ORDER BY (" + String.join(", ", clusteringOrder) + ")";
  }

  public String primaryKeyClause() {
    return "PRIMARY KEY (" + partitionKeyClause() + clusteringColumnsClause() + ")";
  }

  public String allKeysClause() {
    return String.join(", ", allKeys);
  }

  /**
   * {@code "k1=? AND k2=?"} over every key column; the predicate of single-row lookups and deletes.
   */
  public String allKeysEquality() {
    return equality(allKeys);
  }

  public String partitionKeysClause() {
    return String.join(", ", partitionKeys);
  }

  /**
   * {@code "k1=? AND k2=?"} over the partition key columns; the predicate of partition listings.
   */
  public String partitionKeysEquality() {
    return equality(partitionKeys);
  }

  private static String equality(List<String> keys) {
    return keys.stream().map(k -> k + "=?").collect(Collectors.joining(" AND "));
  }
}
