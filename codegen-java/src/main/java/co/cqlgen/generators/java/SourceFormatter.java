package co.cqlgen.generators.java;

/**
 * Turns rendered Java text into the canonical form written to disk.
 */
public interface SourceFormatter {

    /**
     * @throws SourceFormattingException if {@code source} is not valid Java
     */
    String format(String artifactName, String source);
}
