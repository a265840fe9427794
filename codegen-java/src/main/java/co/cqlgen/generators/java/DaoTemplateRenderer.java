package co.cqlgen.generators.java;

import co.cqlgen.core.SchemaConfigurationException;
import freemarker.core.PlainTextOutputFormat;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the DAO source of one table from {@code templates/dao.ftl}.
 *
 * <p>An optional boilerplate template is rendered first against the same model and its output
 * is spliced into the DAO class body ahead of the stream record. Both templates see the model
 * as {@code model}; the DAO template also sees the rendered boilerplate as {@code boilerplate}.
 */
public class DaoTemplateRenderer {

    static final String DAO_TEMPLATE = "dao.ftl";

    private final Configuration freemarker;
    private final Template boilerplate;

    public DaoTemplateRenderer() {
        this.freemarker = configuration();
        this.boilerplate = null;
    }

    private DaoTemplateRenderer(Configuration freemarker, Template boilerplate) {
        this.freemarker = freemarker;
        this.boilerplate = boilerplate;
    }

    /**
     * Renderer splicing the template stored at {@code file} into every DAO.
     *
     * @throws SchemaConfigurationException if the file does not exist
     * @throws TemplateRenderingException if it cannot be read or is not a valid template
     */
    public static DaoTemplateRenderer withBoilerplate(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SchemaConfigurationException("Boilerplate template not found: " + file, e);
        } catch (IOException e) {
            throw new TemplateRenderingException("Could not read boilerplate template " + file, e);
        }
        return withBoilerplateText(file.getFileName().toString(), text);
    }

    public static DaoTemplateRenderer withBoilerplateText(String name, String text) {
        Configuration cfg = configuration();
        try {
            return new DaoTemplateRenderer(cfg, new Template(name, new StringReader(text), cfg));
        } catch (IOException e) {
            // freemarker.core.ParseException is an IOException
            throw new TemplateRenderingException("Invalid boilerplate template " + name + ": " + e.getMessage(), e);
        }
    }

    public String render(EmissionModel model) {
        String spliced = boilerplate == null ? "" : process(boilerplate, Map.of("model", model), model);
        Template dao;
        try {
            dao = freemarker.getTemplate(DAO_TEMPLATE);
        } catch (IOException e) {
            throw new TemplateRenderingException("Could not load " + DAO_TEMPLATE, e);
        }
        return process(dao, Map.of("model", model, "boilerplate", spliced.stripTrailing()), model);
    }

    private static String process(Template template, Map<String, Object> root, EmissionModel model) {
        StringWriter out = new StringWriter();
        try {
            template.process(root, out);
        } catch (TemplateException | IOException e) {
            throw new TemplateRenderingException("Error rendering " + template.getName() + " for table "
                + model.getTableName() + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static Configuration configuration() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(DaoTemplateRenderer.class, "/templates");
        cfg.setDefaultEncoding(StandardCharsets.UTF_8.name());
        cfg.setOutputFormat(PlainTextOutputFormat.INSTANCE);
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setFallbackOnNullLoopVariable(false);
        return cfg;
    }
}
