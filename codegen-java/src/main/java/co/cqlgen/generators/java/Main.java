package co.cqlgen.generators.java;

import co.cqlgen.core.GenerationException;
import co.cqlgen.core.PersistConfigLoader;
import co.cqlgen.core.model.PersistConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI entry point.
 *
 * Usage:
 *   java -jar codegen-java.jar [--output <dir>]
 *   java -jar codegen-java.jar --model <Name> --dao <Name> --keyspace <ks> --package <pkg> [--table <t>] [--output <dir>]
 *
 * Without {@code --model} the persist configuration is looked up in the working directory,
 * then in its {@code config} directory. With {@code --model}, {@code <Name>.json} in the
 * working directory holds the column array of a single table.
 */
public class Main {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT =
        "Usage: java -jar codegen-java.jar [--output <dir>]\n"
            + "       java -jar codegen-java.jar --model <Name> --dao <Name> --keyspace <ks> --package <pkg> [--table <t>] [--output <dir>]";

    public static void main(String[] args) {
        System.exit(run(args, Path.of("").toAbsolutePath(), System.out, System.err));
    }

    static int run(String[] args, Path workingDir, PrintStream out, PrintStream err) {
        String model = null;
        String dao = null;
        String keyspace = null;
        String pkg = null;
        String table = null;
        String output = null;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (!flag.startsWith("--")) {
                err.println("Error: unexpected argument " + flag);
                err.println(USAGE_TEXT);
                return USAGE;
            }
            if (i + 1 >= args.length) {
                err.println("Error: " + flag + " needs a value");
                err.println(USAGE_TEXT);
                return USAGE;
            }
            String value = args[++i];
            switch (flag) {
                case "--model":
                    model = value;
                    break;
                case "--dao":
                    dao = value;
                    break;
                case "--keyspace":
                    keyspace = value;
                    break;
                case "--package":
                    pkg = value;
                    break;
                case "--table":
                    table = value;
                    break;
                case "--output":
                    output = value;
                    break;
                default:
                    err.println("Error: unknown option " + flag);
                    err.println(USAGE_TEXT);
                    return USAGE;
            }
        }

        boolean legacy = model != null || dao != null;
        if (legacy && (model == null || dao == null || keyspace == null || pkg == null)) {
            err.println("Error: --model, --dao, --keyspace and --package are required together");
            err.println(USAGE_TEXT);
            return USAGE;
        }

        Path outDir = (output == null ? workingDir : workingDir.resolve(output)).normalize();
        try {
            PersistConfig config = legacy
                ? PersistConfigLoader.loadLegacy(workingDir.resolve(model + ".json"), keyspace, pkg, model, dao, table)
                : PersistConfigLoader.load(PersistConfigLoader.locate(workingDir));

            List<Path> written = new DaoGenerator().generate(config, workingDir, outDir);

            out.println("Generated " + written.size() + " file(s) for " + config.tables().size()
                + " table(s) in " + outDir);
            for (Path file : written) {
                out.println("  - " + outDir.relativize(file));
            }
            return OK;
        } catch (GenerationException | IOException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }
}
