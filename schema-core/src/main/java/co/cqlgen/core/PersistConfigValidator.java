package co.cqlgen.core;

import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

public final class PersistConfigValidator {
  private static final Logger LOG = LoggerFactory.getLogger(PersistConfigValidator.class);

  // Unquoted CQL identifiers; keyspace and table names are spliced into Java string literals.
  private static final Pattern CQL_IDENTIFIER = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");
  // Unquoted CQL folds column names to lower case; a leading capital would also let a column
  // shadow the type and constant names of the generated DAO.
  private static final Pattern COLUMN_NAME = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");
  // Spliced into a text block one column per line, so no line breaks.
  private static final Pattern CQL_TYPE = Pattern.compile("^[a-zA-Z0-9_<>, ]+$");

  private PersistConfigValidator() {}

  public static void validate(PersistConfig c) {
    if (isBlank(c.keyspace())) fail("keyspace required");
    if (!CQL_IDENTIFIER.matcher(c.keyspace()).matches()) fail("keyspace '" + c.keyspace() + "' is not a valid CQL identifier");
    if (isBlank(c.targetPackage())) fail("package required");
    if (!SourceVersion.isName(c.targetPackage())) fail("package '" + c.targetPackage() + "' is not a valid Java package");
    if (c.modelImportAlias() != null && !SourceVersion.isName(c.modelImportAlias())) {
      fail("modelPackage '" + c.modelImportAlias() + "' is not a valid Java package");
    }
    c.modelGenerationTarget().ifPresent(m -> {
      if (isBlank(m.packageName())) fail("ModelGeneration.Package required");
      if (!SourceVersion.isName(m.packageName())) fail("ModelGeneration.Package '" + m.packageName() + "' is not a valid Java package");
    });
    for (String imp : c.additionalImports()) {
      if (!isImport(imp)) fail("import '" + imp + "' is not a valid import");
    }

    if (c.tables().isEmpty()) fail("At least one table must be defined");

    Set<String> daoNames = new HashSet<>();
    for (TableDefinition t : c.tables()) {
      if (t == null) fail("null table definition");
      validateTable(t);
      if (!daoNames.add(t.daoName())) fail("duplicate dao " + t.daoName());
    }
  }

  static void validateTable(TableDefinition t) {
    if (isBlank(t.tableName())) fail("tableName required");
    String table = t.tableName();
    if (!CQL_IDENTIFIER.matcher(table).matches()) fail("tableName '" + table + "' is not a valid CQL identifier");
    if (isBlank(t.modelName())) fail(table + ": modelName required");
    if (!SourceVersion.isName(t.modelName())) fail(table + ": modelName '" + t.modelName() + "' is not a valid Java identifier");
    if (isBlank(t.daoName())) fail(table + ": dao required");
    if (!SourceVersion.isName(t.daoName())) fail(table + ": dao '" + t.daoName() + "' is not a valid Java identifier");

    // Spliced into a line comment, where a line break or a unicode escape would end it.
    if (t.generatedArtifactName() != null
        && t.generatedArtifactName().chars().anyMatch(ch -> ch == '\n' || ch == '\r' || ch == '\\')) {
      fail(table + ": generatedName must be a single line without backslashes");
    }

    if (t.columns().isEmpty()) fail("Table " + table + " had no columns defined");

    Set<String> names = new HashSet<>();
    boolean hasPartitionKey = false;
    for (ColumnDefinition col : t.columns()) {
      if (col == null) fail(table + ": null column definition");
      if (isBlank(col.name())) fail(table + ": column.name required");
      if (!SourceVersion.isName(col.name()) || !COLUMN_NAME.matcher(col.name()).matches()) {
        fail(table + "." + col.name() + ": column name must be a Java identifier starting with a"
            + " lower-case letter and made of letters, digits and underscores");
      }
      if (!names.add(col.name())) fail(table + ": duplicate column " + col.name());
      if (isBlank(col.storageType())) fail(table + "." + col.name() + ": type required");
      if (!CQL_TYPE.matcher(col.storageType()).matches()) {
        fail(table + "." + col.name() + ": type '" + col.storageType() + "' contains unsupported characters");
      }

      if (col.hasDeserializeTarget()) {
        if (!SourceVersion.isName(col.deserializeTarget())) {
          fail(table + "." + col.name() + ": deserializeTo '" + col.deserializeTarget() + "' is not a valid Java type name");
        }
        if (!CqlType.isBlobCollection(col.storageType())) {
          LOG.warn("{}.{}: deserializeTo is only honoured on list<blob> and map<text,blob> columns, ignoring it for {}",
              table, col.name(), col.storageType());
        }
      }
      hasPartitionKey |= col.keyRole().isPartition();
    }
    if (!hasPartitionKey) fail("Table " + table + " has no partition key");
  }

  private static boolean isImport(String imp) {
    if (isBlank(imp)) return false;
    String name = imp.trim();
    if (name.startsWith("static ")) name = name.substring("static ".length()).trim();
    if (name.endsWith(".*")) name = name.substring(0, name.length() - 2);
    return SourceVersion.isName(name);
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }
  private static void fail(String msg) { throw new SchemaConfigurationException(msg); }
}
