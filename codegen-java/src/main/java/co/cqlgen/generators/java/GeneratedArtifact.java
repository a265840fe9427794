package co.cqlgen.generators.java;

import java.nio.file.Path;

/**
 * One formatted source file, held in memory until every table of a run has rendered.
 *
 * @param sourceRoot directory under the output directory the package tree starts in;
 *                   {@code "."} for DAOs, the model-generation location for DTOs
 */
public record GeneratedArtifact(Kind kind, String tableName, String packageName, String className,
                                String sourceRoot, String source) {

    public enum Kind { DAO, DTO }

    /** Path of the file relative to the output directory. */
    public Path relativePath() {
        Path root = Path.of(sourceRoot == null || sourceRoot.isBlank() ? "." : sourceRoot);
        for (String segment : packageName.split("\\.")) {
            root = root.resolve(segment);
        }
        return root.resolve(className + ".java").normalize();
    }

    public Path resolve(Path outDir) {
        return outDir.resolve(relativePath()).normalize();
    }
}
