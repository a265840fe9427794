package co.cqlgen.generators.java;

import co.cqlgen.core.KeyStructure;
import com.squareup.javapoet.ClassName;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fully resolved rendering context of one table. Built once by {@link EmissionModelBuilder},
 * read by the DAO template, the boilerplate template and the DTO generator; never mutated.
 */
public final class EmissionModel {

    private final String packageName;
    private final String keyspace;
    private final String tableName;
    private final String modelName;
    private final ClassName modelClass;
    private final String daoName;
    private final String generatedName;
    private final List<ColumnEmission> columns;
    private final KeyStructure keys;
    private final Set<ImportFlag> importFlags;
    private final List<String> imports;
    private final List<String> additionalImports;
    private final String sourceDefinition;

    EmissionModel(String packageName, String keyspace, String tableName, String modelName, ClassName modelClass,
                  String daoName, String generatedName, List<ColumnEmission> columns, KeyStructure keys,
                  Set<ImportFlag> importFlags, List<String> imports, List<String> additionalImports,
                  String sourceDefinition) {
        this.packageName = packageName;
        this.keyspace = keyspace;
        this.tableName = tableName;
        this.modelName = modelName;
        this.modelClass = modelClass;
        this.daoName = daoName;
        this.generatedName = generatedName;
        this.columns = List.copyOf(columns);
        this.keys = keys;
        this.importFlags = Set.copyOf(importFlags);
        this.imports = List.copyOf(imports);
        this.additionalImports = List.copyOf(additionalImports);
        this.sourceDefinition = sourceDefinition;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getTableName() {
        return tableName;
    }

    public String getQualifiedTableName() {
        return keyspace + "." + tableName;
    }

    public String getModelName() {
        return modelName;
    }

    public ClassName getModelClass() {
        return modelClass;
    }

    /** Model type as written in the DAO. */
    public String getModelType() {
        return TypeNames.simple(modelClass);
    }

    public String getDaoName() {
        return daoName;
    }

    public String getGeneratedName() {
        return generatedName;
    }

    public String getStreamType() {
        return modelName + "Stream";
    }

    public List<ColumnEmission> getColumns() {
        return columns;
    }

    public List<ColumnEmission> getKeyColumns() {
        return columnsNamed(keys.allKeys());
    }

    public List<ColumnEmission> getPartitionKeyColumns() {
        return columnsNamed(keys.partitionKeys());
    }

    public List<ColumnEmission> getSerializedColumns() {
        return columns.stream().filter(ColumnEmission::isSerialized).collect(Collectors.toList());
    }

    public KeyStructure getKeys() {
        return keys;
    }

    public Set<ImportFlag> getImportFlags() {
        return importFlags;
    }

    public boolean isIncludeTime() {
        return importFlags.contains(ImportFlag.TIME_SUPPORT);
    }

    public boolean isIncludeJson() {
        return importFlags.contains(ImportFlag.STRUCTURED_SERIALIZATION);
    }

    /** Generated imports, sorted. */
    public List<String> getImports() {
        return imports;
    }

    /** Configured extra imports, in configured order, minus any already generated. */
    public List<String> getAdditionalImports() {
        return additionalImports;
    }

    /** Table definition as JSON, one {@code " * "}-prefixed line per JSON line, safe inside a block comment. */
    public String getSourceDefinition() {
        return sourceDefinition;
    }

    public String getPartitionKeyClause() {
        return keys.partitionKeyClause();
    }

    public String getClusteringColumnsClause() {
        return keys.clusteringColumnsClause();
    }

    public String getClusteringOrderClause() {
        return keys.clusteringOrderClause();
    }

    public String getPrimaryKeyClause() {
        return keys.primaryKeyClause();
    }

    public String getAllKeysClause() {
        return keys.allKeysClause();
    }

    public String getAllKeysEquality() {
        return keys.allKeysEquality();
    }

    public String getPartitionKeysClause() {
        return keys.partitionKeysClause();
    }

    public String getPartitionKeysEquality() {
        return keys.partitionKeysEquality();
    }

    public String getInsertFields() {
        return columns.stream().map(ColumnEmission::getName).collect(Collectors.joining(", "));
    }

    public String getInsertValues() {
        return columns.stream().map(c -> "?").collect(Collectors.joining(", "));
    }

    public String getInsertResource() {
        return columns.stream().map(ColumnEmission::getInsertReference).collect(Collectors.joining(", "));
    }

    /** Key values of a model named {@code r}, in key order. */
    public String getDeleteKeys() {
        return getKeyColumns().stream().map(c -> "r." + c.getGetter() + "()").collect(Collectors.joining(", "));
    }

    /** Typed parameter list of the single-row lookup, e.g. {@code UUID id, Instant ts}. */
    public String getKeyParameters() {
        return parameters(getKeyColumns());
    }

    public String getKeyArguments() {
        return keys.allKeysClause();
    }

    /** Typed parameter list of the partition listing and stream operations. */
    public String getPartitionKeyParameters() {
        return parameters(getPartitionKeyColumns());
    }

    public String getPartitionKeyArguments() {
        return keys.partitionKeysClause();
    }

    private List<ColumnEmission> columnsNamed(List<String> names) {
        return names.stream()
            .map(n -> columns.stream().filter(c -> c.getName().equals(n)).findFirst().orElseThrow())
            .collect(Collectors.toList());
    }

    private static String parameters(List<ColumnEmission> cols) {
        return cols.stream().map(c -> c.getTargetType() + " " + c.getName()).collect(Collectors.joining(", "));
    }
}
