package co.cqlgen.generators.java;

import co.cqlgen.core.model.KeyRole;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;

/**
 * Everything the templates need to emit one column: its Java types, how it is scanned from a
 * row, how it is bound on insert and how it is declared on the DTO.
 *
 * <p>Exposed through JavaBean getters so templates can write {@code ${column.scanExpression}}.
 */
public final class ColumnEmission {

    private final String name;
    private final String storageType;
    private final KeyRole keyRole;
    private final TypeMapping mapping;
    private final TypeName dtoTypeName;
    private final ClassName serializedElementClass;

    ColumnEmission(String name, String storageType, KeyRole keyRole, TypeMapping mapping,
                   TypeName dtoTypeName, ClassName serializedElementClass) {
        this.name = name;
        this.storageType = storageType;
        this.keyRole = keyRole;
        this.mapping = mapping;
        this.dtoTypeName = dtoTypeName;
        this.serializedElementClass = serializedElementClass;
    }

    public String getName() {
        return name;
    }

    public String getStorageType() {
        return storageType;
    }

    public KeyRole getKeyRole() {
        return keyRole;
    }

    public boolean isPartitionKey() {
        return keyRole.isPartition();
    }

    public boolean isClusteringKey() {
        return keyRole.isClustering();
    }

    public TypeMapping getMapping() {
        return mapping;
    }

    /** Raw row type, e.g. {@code List<ByteBuffer>}. */
    public TypeName getTargetTypeName() {
        return mapping.targetType();
    }

    public String getTargetType() {
        return TypeNames.simple(mapping.targetType());
    }

    /** Field type on the model class; differs from the target type only for serialized columns. */
    public TypeName getDtoTypeName() {
        return dtoTypeName;
    }

    public String getDtoType() {
        return TypeNames.simple(dtoTypeName);
    }

    public boolean isSerialized() {
        return mapping.isSerialized();
    }

    public boolean isBlobList() {
        return isSerialized() && mapping.collectionKind() == TypeMapping.CollectionKind.LIST;
    }

    public boolean isBlobMap() {
        return isSerialized() && mapping.collectionKind() == TypeMapping.CollectionKind.MAP;
    }

    /** {@code deserializeTo} as configured, or {@code null}. */
    public String getSerializedElementType() {
        return mapping.serializedElementType();
    }

    public ClassName getSerializedElementClass() {
        return serializedElementClass;
    }

    /** Simple name of the resolved {@code deserializeTo} class, for use in generated code. */
    public String getSerializedElementSimpleName() {
        return serializedElementClass == null ? null : TypeNames.simple(serializedElementClass);
    }

    /** Lower-camel JSON property name of the DTO field. */
    public String getSerializationTag() {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    public String getGetter() {
        return "get" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public String getSetter() {
        return "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /** Suffix of the generated encode/decode helpers, e.g. {@code Tags} for {@code encodeTags}. */
    public String getHelperSuffix() {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Expression reading this column from a driver {@code Row} named {@code row}.
     */
    public String getScanExpression() {
        String element = TypeNames.simple(mapping.elementType());
        return switch (mapping.collectionKind()) {
            case LIST -> "row.getList(\"" + name + "\", " + element + ".class)";
            case SET  -> "row.getSet(\"" + name + "\", " + element + ".class)";
            case MAP  -> "row.getMap(\"" + name + "\", String.class, " + element + ".class)";
            case NONE -> "row.get(\"" + name + "\", " + element + ".class)";
        };
    }

    /**
     * Expression producing the scanned value as the model field expects it; serialized columns
     * are decoded from their raw blobs first.
     */
    public String getReadExpression() {
        if (isSerialized()) return "decode" + getHelperSuffix() + "(" + getScanExpression() + ")";
        return getScanExpression();
    }

    /**
     * Value bound for this column on insert from a model named {@code r}. Serialized columns
     * pass through their encode helper.
     */
    public String getInsertReference() {
        String value = "r." + getGetter() + "()";
        return isSerialized() ? "encode" + getHelperSuffix() + "(" + value + ")" : value;
    }
}
