package co.cqlgen.generators.java;

import co.cqlgen.core.PersistConfigValidator;
import co.cqlgen.core.model.ModelGenerationTarget;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generates the DAO (and, when a model-generation target is configured, the DTO) of every
 * table in a persist configuration.
 *
 * <p>Tables are rendered in configured order and nothing is written until all of them have
 * rendered and formatted, so a failing table leaves the output directory untouched. Files
 * are overwritten on every run; the same configuration always yields the same bytes.
 */
public class DaoGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(DaoGenerator.class);

    private final SourceFormatter formatter;
    private final DtoGenerator dtoGenerator = new DtoGenerator();

    public DaoGenerator() {
        this(new JavaSourceFormatter());
    }

    public DaoGenerator(SourceFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Render every table without writing. A relative boilerplate path resolves against
     * {@code baseDir}.
     */
    public List<GeneratedArtifact> render(PersistConfig config, Path baseDir) {
        PersistConfigValidator.validate(config);
        DaoTemplateRenderer renderer = config.boilerplate()
            .map(p -> DaoTemplateRenderer.withBoilerplate(baseDir.resolve(p)))
            .orElseGet(DaoTemplateRenderer::new);
        Optional<ModelGenerationTarget> dtoTarget = config.modelGenerationTarget();

        List<GeneratedArtifact> artifacts = new ArrayList<>();
        for (TableDefinition table : config.tables()) {
            EmissionModel model = EmissionModelBuilder.build(config, table);

            String dao = formatter.format(table.daoName(), renderer.render(model));
            artifacts.add(new GeneratedArtifact(GeneratedArtifact.Kind.DAO, table.tableName(),
                config.targetPackage(), table.daoName(), ".", dao));

            if (dtoTarget.isPresent()) {
                String pkg = dtoTarget.get().packageName();
                String dto = formatter.format(table.modelName(), dtoGenerator.generate(model, pkg).toString());
                artifacts.add(new GeneratedArtifact(GeneratedArtifact.Kind.DTO, table.tableName(),
                    pkg, table.modelName(), dtoTarget.get().location(), dto));
            }
            LOG.debug("Rendered {} ({} columns)", model.getQualifiedTableName(), model.getColumns().size());
        }
        return artifacts;
    }

    public List<GeneratedArtifact> render(PersistConfig config) {
        return render(config, Path.of("."));
    }

    /**
     * Render every table, then write all files under {@code outDir}.
     *
     * @return written files, in table order
     */
    public List<Path> generate(PersistConfig config, Path baseDir, Path outDir) throws IOException {
        List<GeneratedArtifact> artifacts = render(config, baseDir);
        List<Path> written = new ArrayList<>();
        for (GeneratedArtifact artifact : artifacts) {
            Path file = artifact.resolve(outDir);
            Files.createDirectories(file.getParent());
            Files.writeString(file, artifact.source(), StandardCharsets.UTF_8);
            LOG.info("Generated {} {} for table {} at {}", artifact.kind(), artifact.className(),
                artifact.tableName(), file);
            written.add(file);
        }
        return written;
    }

    public List<Path> generate(PersistConfig config, Path outDir) throws IOException {
        return generate(config, Path.of("."), outDir);
    }
}
