package co.cqlgen.generators.java;

import co.cqlgen.core.CqlType;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps CQL storage types to the Java types the generated DAO and DTO use.
 *
 * <ul>
 *   <li>{@code text}, {@code varchar}, {@code ascii} → {@code String}</li>
 *   <li>{@code uuid}, {@code timeuuid} → {@code UUID}</li>
 *   <li>{@code int} → {@code Integer}; {@code bigint}, {@code counter} → {@code Long}</li>
 *   <li>{@code double} → {@code Double}; {@code float} → {@code Float}</li>
 *   <li>{@code boolean} → {@code Boolean}; {@code blob} → {@code ByteBuffer}</li>
 *   <li>{@code timestamp} → {@code Instant} (raises {@link ImportFlag#TIME_SUPPORT})</li>
 *   <li>{@code list<blob>} → {@code List<ByteBuffer>}, {@code map<text,blob>} → {@code Map<String, ByteBuffer>};
 *       with a {@code deserializeTo} target the column is marked serialized
 *       (raises {@link ImportFlag#STRUCTURED_SERIALIZATION})</li>
 *   <li>{@code list<T>} / {@code set<T>} with a scalar {@code T} → {@code List<T>} / {@code Set<T>}</li>
 * </ul>
 *
 * Anything else maps to {@link #UNKNOWN}. The generator does not check types against a real
 * catalog, so an unknown type only shows up when the generated code is compiled.
 */
public final class TypeMapper {
    private static final Logger LOG = LoggerFactory.getLogger(TypeMapper.class);

    /** Sentinel for storage types no rule matches. */
    public static final ClassName UNKNOWN = ClassName.get("", "UnknownCqlType");

    static final ClassName STRING = ClassName.get(String.class);
    static final ClassName UUID = ClassName.get("java.util", "UUID");
    static final ClassName INSTANT = ClassName.get("java.time", "Instant");
    static final ClassName BYTE_BUFFER = ClassName.get("java.nio", "ByteBuffer");
    static final ClassName LIST = ClassName.get("java.util", "List");
    static final ClassName SET = ClassName.get("java.util", "Set");
    static final ClassName MAP = ClassName.get("java.util", "Map");

    private static final Map<String, ClassName> SCALARS = Map.ofEntries(
        Map.entry("text", STRING),
        Map.entry("varchar", STRING),
        Map.entry("ascii", STRING),
        Map.entry("uuid", UUID),
        Map.entry("timeuuid", UUID),
        Map.entry("int", ClassName.get(Integer.class)),
        Map.entry("bigint", ClassName.get(Long.class)),
        Map.entry("counter", ClassName.get(Long.class)),
        Map.entry("double", ClassName.get(Double.class)),
        Map.entry("float", ClassName.get(Float.class)),
        Map.entry("boolean", ClassName.get(Boolean.class)),
        Map.entry("blob", BYTE_BUFFER),
        Map.entry("timestamp", INSTANT)
    );

    // One level only: list<list<int>> does not match.
    private static final Pattern COLLECTION = Pattern.compile("^(list|set)<([a-z]+)>$");

    private TypeMapper() {}

    /**
     * Map a storage type. {@code deserializeTarget} is only honoured for {@code list<blob>}
     * and {@code map<text,blob>}; pass {@code null} or an empty string when there is none.
     */
    public static TypeMapping map(String storageType, String deserializeTarget) {
        String type = CqlType.normalize(storageType);
        String target = deserializeTarget == null || deserializeTarget.isBlank() ? null : deserializeTarget.trim();

        ClassName scalar = SCALARS.get(type);
        if (scalar != null) {
            return new TypeMapping(scalar, TypeMapping.CollectionKind.NONE, scalar, null, flagsFor(scalar));
        }

        if (CqlType.LIST_OF_BLOB.equals(type)) {
            return new TypeMapping(ParameterizedTypeName.get(LIST, BYTE_BUFFER), TypeMapping.CollectionKind.LIST,
                BYTE_BUFFER, target, serializationFlags(target));
        }
        if (CqlType.MAP_OF_TEXT_TO_BLOB.equals(type)) {
            return new TypeMapping(ParameterizedTypeName.get(MAP, STRING, BYTE_BUFFER), TypeMapping.CollectionKind.MAP,
                BYTE_BUFFER, target, serializationFlags(target));
        }

        Matcher m = COLLECTION.matcher(type);
        if (m.matches()) {
            ClassName element = SCALARS.get(m.group(2));
            if (element != null) {
                boolean isList = "list".equals(m.group(1));
                return new TypeMapping(
                    ParameterizedTypeName.get(isList ? LIST : SET, element),
                    isList ? TypeMapping.CollectionKind.LIST : TypeMapping.CollectionKind.SET,
                    element, null, flagsFor(element));
            }
        }

        LOG.warn("No Java mapping for storage type '{}', emitting {}", storageType, UNKNOWN.simpleName());
        return new TypeMapping(UNKNOWN, TypeMapping.CollectionKind.NONE, UNKNOWN, null, Set.of());
    }

    public static TypeMapping map(String storageType) {
        return map(storageType, null);
    }

    private static Set<ImportFlag> flagsFor(TypeName type) {
        return INSTANT.equals(type) ? EnumSet.of(ImportFlag.TIME_SUPPORT) : Set.of();
    }

    private static Set<ImportFlag> serializationFlags(String target) {
        return target == null ? Set.of() : EnumSet.of(ImportFlag.STRUCTURED_SERIALIZATION);
    }
}
