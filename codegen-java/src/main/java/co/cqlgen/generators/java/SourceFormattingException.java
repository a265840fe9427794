package co.cqlgen.generators.java;

import co.cqlgen.core.GenerationException;

/**
 * Rendered text is not valid Java source. The message carries the offending text so the
 * broken template output can be inspected.
 */
public class SourceFormattingException extends GenerationException {

    private final String artifactName;
    private final String source;

    public SourceFormattingException(String artifactName, String problems, String source) {
        super("Error formatting " + artifactName + ": " + problems + "\n" + source);
        this.artifactName = artifactName;
        this.source = source;
    }

    public String getArtifactName() {
        return artifactName;
    }

    public String getSource() {
        return source;
    }
}
