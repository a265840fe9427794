package co.cqlgen.generators.java;

import com.squareup.javapoet.TypeName;

import java.util.Set;

/**
 * Result of mapping one CQL storage type.
 *
 * @param targetType            Java type a row value is read into
 * @param collectionKind        shape of the value, drives how it is scanned from a row
 * @param elementType           element type for lists and sets, value type for maps,
 *                              {@code targetType} itself for scalars
 * @param serializedElementType {@code deserializeTo} type name when the column round-trips its
 *                              blob elements, otherwise {@code null}
 * @param importFlags           support the column needs in the generated DAO
 */
public record TypeMapping(
    TypeName targetType,
    CollectionKind collectionKind,
    TypeName elementType,
    String serializedElementType,
    Set<ImportFlag> importFlags
) {
    public enum CollectionKind { NONE, LIST, SET, MAP }

    public TypeMapping {
        importFlags = Set.copyOf(importFlags);
    }

    public boolean isSerialized() {
        return serializedElementType != null;
    }

    public boolean isKnown() {
        return !TypeMapper.UNKNOWN.equals(targetType);
    }
}
