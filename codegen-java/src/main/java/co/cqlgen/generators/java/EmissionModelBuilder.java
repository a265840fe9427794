package co.cqlgen.generators.java;

import co.cqlgen.core.KeyStructure;
import co.cqlgen.core.SchemaConfigurationException;
import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Derives the {@link EmissionModel} of one table from the configuration: key structure,
 * per-column type mappings, the union of import flags and the import list.
 */
public final class EmissionModelBuilder {

    // Key columns become parameters of methods that also declare these.
    static final Set<String> RESERVED_COLUMN_NAMES = Set.of("session");

    private static final List<String> BASE_IMPORTS = List.of(
        "com.datastax.oss.driver.api.core.CqlSession",
        "com.datastax.oss.driver.api.core.cql.Row",
        "com.datastax.oss.driver.api.core.cql.SimpleStatement",
        "java.util.ArrayList",
        "java.util.List",
        "java.util.Optional",
        "java.util.concurrent.ArrayBlockingQueue",
        "java.util.concurrent.BlockingQueue",
        "java.util.concurrent.Executor",
        "org.slf4j.Logger",
        "org.slf4j.LoggerFactory"
    );

    private static final List<String> TIME_IMPORTS = List.of("java.time.Instant");

    private static final List<String> JSON_IMPORTS = List.of(
        "com.fasterxml.jackson.core.JsonProcessingException",
        "com.fasterxml.jackson.databind.ObjectMapper",
        "java.io.IOException",
        "java.nio.ByteBuffer",
        "java.util.LinkedHashMap",
        "java.util.Map"
    );

    private static final Set<String> JAVA_LANG_TYPES = Set.of(
        "String", "Integer", "Long", "Double", "Float", "Boolean", "Short", "Byte", "Character", "Object"
    );

    private static final ObjectWriter DEFINITION_WRITER = definitionWriter();

    private EmissionModelBuilder() {}

    public static EmissionModel build(PersistConfig config, TableDefinition table) {
        KeyStructure keys = KeyStructure.of(table.tableName(), table.columns());
        String daoPackage = config.targetPackage();
        String modelPackage = config.modelPackage();

        Set<ImportFlag> flags = EnumSet.noneOf(ImportFlag.class);
        Set<String> imports = new TreeSet<>(BASE_IMPORTS);
        List<ColumnEmission> columns = new ArrayList<>();

        for (ColumnDefinition col : table.columns()) {
            if (RESERVED_COLUMN_NAMES.contains(col.name())) {
                throw new SchemaConfigurationException(table.tableName() + "." + col.name()
                    + ": column name clashes with a name the generated DAO declares " + RESERVED_COLUMN_NAMES);
            }
            if (col.name().equals(table.daoName()) || col.name().equals(table.modelName())) {
                throw new SchemaConfigurationException(table.tableName() + "." + col.name()
                    + ": column name clashes with a generated class name");
            }

            TypeMapping mapping = TypeMapper.map(col.storageType(), col.deserializeTarget());
            flags.addAll(mapping.importFlags());
            TypeNames.collectImports(mapping.targetType(), daoPackage, imports);

            ClassName element = null;
            TypeName dtoType = mapping.targetType();
            if (mapping.isSerialized()) {
                element = resolveTarget(table, col, modelPackage);
                TypeNames.collectImports(element, daoPackage, imports);
                dtoType = switch (mapping.collectionKind()) {
                    case MAP -> ParameterizedTypeName.get(TypeMapper.MAP, TypeMapper.STRING, element);
                    default  -> ParameterizedTypeName.get(TypeMapper.LIST, element);
                };
            }
            columns.add(new ColumnEmission(col.name(), col.storageType(), col.keyRole(), mapping, dtoType, element));
        }

        if (flags.contains(ImportFlag.TIME_SUPPORT)) imports.addAll(TIME_IMPORTS);
        if (flags.contains(ImportFlag.STRUCTURED_SERIALIZATION)) imports.addAll(JSON_IMPORTS);

        ClassName modelClass = ClassName.get(modelPackage, table.modelName());
        TypeNames.collectImports(modelClass, daoPackage, imports);

        Set<String> additional = new LinkedHashSet<>();
        for (String imp : config.additionalImports()) {
            String name = imp.trim();
            if (!imports.contains(name)) additional.add(name);
        }

        return new EmissionModel(daoPackage, config.keyspace(), table.tableName(), table.modelName(), modelClass,
            table.daoName(), table.generatedArtifactName(), columns, keys, flags,
            new ArrayList<>(imports), new ArrayList<>(additional), sourceDefinition(table));
    }

    /**
     * Resolve a {@code deserializeTo} name: qualified names stand as written, bare
     * {@code java.lang} names go to {@code java.lang}, other bare names live in the model package.
     */
    static ClassName resolveTarget(TableDefinition table, ColumnDefinition col, String modelPackage) {
        String target = col.deserializeTarget().trim();
        if (JAVA_LANG_TYPES.contains(target)) return ClassName.get("java.lang", target);
        if (!target.contains(".")) return ClassName.get(modelPackage, target);
        try {
            return ClassName.bestGuess(target);
        } catch (IllegalArgumentException e) {
            throw new SchemaConfigurationException(table.tableName() + "." + col.name()
                + ": cannot resolve deserializeTo type '" + target + "'", e);
        }
    }

    private static String sourceDefinition(TableDefinition table) {
        try {
            String json = DEFINITION_WRITER.writeValueAsString(table).replace("*/", "*\\/");
            return json.lines().map(line -> " * " + line).collect(Collectors.joining("\n"));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("table definition " + table.tableName() + " is not serializable", e);
        }
    }

    // Fixed "\n" line feeds so output does not depend on the platform separator.
    private static ObjectWriter definitionWriter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        return new ObjectMapper().writer(printer);
    }
}
