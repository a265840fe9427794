package co.cqlgen.core;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Vocabulary of the CQL storage types the generator understands.
 *
 * <h3>Scalars</h3>
 * <pre>
 *   text, varchar, ascii   → String
 *   uuid, timeuuid         → UUID
 *   int                    → Integer
 *   bigint, counter        → Long
 *   double                 → Double
 *   float                  → Float
 *   boolean                → Boolean
 *   blob                   → ByteBuffer
 *   timestamp              → Instant
 * </pre>
 *
 * <h3>Blob collections</h3>
 * {@code list<blob>} and {@code map<text,blob>} may carry a {@code deserializeTo} type; each
 * element is then round-tripped through JSON.
 *
 * <h3>One-level collections</h3>
 * {@code list<T>} and {@code set<T>} where {@code T} is one of the scalars above. Nested
 * collections are not recognized.
 *
 * <p>Anything else is not rejected here: it is mapped to an unknown type further down the
 * pipeline and only surfaces when the generated code is compiled.
 */
public final class CqlType {

  public static final String LIST_OF_BLOB = "list<blob>";
  public static final String MAP_OF_TEXT_TO_BLOB = "map<text,blob>";

  public static final Set<String> SCALARS = Set.of(
      "text", "varchar", "ascii", "uuid", "timeuuid", "int", "bigint", "counter",
      "double", "float", "boolean", "blob", "timestamp"
  );

  private static final Pattern AROUND_PUNCTUATION = Pattern.compile("\\s*([<>,])\\s*");

  private CqlType() {}

  /**
   * Canonical form of a storage type string: trimmed, lower-cased, no whitespace around
   * {@code <}, {@code ,} and {@code >} ({@code "map<text, blob>"} becomes {@code "map<text,blob>"}).
   * Whitespace elsewhere is kept, so {@code "big int"} stays unrecognized.
   */
  public static String normalize(String storageType) {
    if (storageType == null) return "";
    return AROUND_PUNCTUATION.matcher(storageType.trim().toLowerCase(Locale.ROOT)).replaceAll("$1");
  }

  public static boolean isScalar(String storageType) {
    return SCALARS.contains(normalize(storageType));
  }

  public static boolean isBlobList(String storageType) {
    return LIST_OF_BLOB.equals(normalize(storageType));
  }

  public static boolean isBlobMap(String storageType) {
    return MAP_OF_TEXT_TO_BLOB.equals(normalize(storageType));
  }

  /**
   * Return true if columns of this type may carry a {@code deserializeTo} target.
   */
  public static boolean isBlobCollection(String storageType) {
    return isBlobList(storageType) || isBlobMap(storageType);
  }
}
