package co.cqlgen.generators.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.util.stream.Collectors;

/**
 * Normalizes whitespace of rendered sources and rejects anything JavaParser cannot parse.
 *
 * <p>Layout is otherwise left as rendered: line feeds only, no trailing blanks, at most one
 * empty line in a row, exactly one newline at the end.
 */
public class JavaSourceFormatter implements SourceFormatter {

    private final ParserConfiguration configuration =
        new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public String format(String artifactName, String source) {
        String normalized = normalize(source);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(normalized);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
            throw new SourceFormattingException(artifactName, problems, source);
        }
        return normalized;
    }

    static String normalize(String source) {
        StringBuilder out = new StringBuilder(source.length());
        boolean previousBlank = true;
        for (String line : source.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1)) {
            String trimmed = line.stripTrailing();
            boolean blank = trimmed.isEmpty();
            if (blank && previousBlank) continue;
            out.append(trimmed).append('\n');
            previousBlank = blank;
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') end--;
        return out.substring(0, end) + "\n";
    }
}
