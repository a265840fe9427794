package co.cqlgen.generators.java;

import co.cqlgen.core.SchemaConfigurationException;
import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.KeyRole;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class DaoGeneratorTest {

  @TempDir
  Path tempDir;

  private final DaoGenerator generator = new DaoGenerator();

  @Test
  void writesDaoPerTable() throws Exception {
    Path out = tempDir.resolve("out");

    List<Path> written = generator.generate(Fixtures.config(Fixtures.events(), Fixtures.readings()), tempDir, out);

    assertThat(written).containsExactly(
        out.resolve("com/acme/dao/EventDao.java"),
        out.resolve("com/acme/dao/ReadingDao.java"));
    assertThat(Files.readString(written.get(0))).contains("public abstract class EventDao {").endsWith("}\n");
  }

  @Test
  void writesModelClassesUnderTheirLocation() throws Exception {
    Path out = tempDir.resolve("out");

    List<Path> written = generator.generate(Fixtures.configWithModels(Fixtures.events()), tempDir, out);

    assertThat(written).containsExactly(
        out.resolve("com/acme/dao/EventDao.java"),
        out.resolve("model-src/com/acme/model/Event.java"));
    assertThat(Files.readString(written.get(0))).contains("import com.acme.model.Event;");
    assertThat(Files.readString(written.get(1))).contains("package com.acme.model;");
  }

  @Test
  void renderingTwiceIsByteIdentical() throws Exception {
    Path out = tempDir.resolve("out");
    PersistConfig config = Fixtures.configWithModels(Fixtures.events(), Fixtures.readings());

    List<Path> first = generator.generate(config, tempDir, out);
    List<String> before = first.stream().map(DaoGeneratorTest::read).toList();
    List<Path> second = generator.generate(config, tempDir, out);

    assertThat(second).isEqualTo(first);
    assertThat(second.stream().map(DaoGeneratorTest::read).toList()).isEqualTo(before);
  }

  @Test
  void emptyTableListAbortsWithoutOutput() {
    Path out = tempDir.resolve("out");

    assertThatThrownBy(() -> generator.generate(Fixtures.config(), tempDir, out))
      .isInstanceOf(SchemaConfigurationException.class)
      .hasMessage("At least one table must be defined");
    assertThat(out).doesNotExist();
  }

  @Test
  void failingLaterTableWritesNothing() {
    Path out = tempDir.resolve("out");
    TableDefinition broken = new TableDefinition("Broken", "broken", "BrokenDao", null, List.of(
        ColumnDefinition.of("id", "text", KeyRole.PARTITION),
        ColumnDefinition.of("session", "text")));

    assertThatThrownBy(() -> generator.generate(Fixtures.config(Fixtures.events(), broken), tempDir, out))
      .isInstanceOf(SchemaConfigurationException.class);
    assertThat(out).doesNotExist();
  }

  @Test
  void formattingFailureWritesNothing() {
    Path out = tempDir.resolve("out");
    DaoGenerator failing = new DaoGenerator((name, source) -> {
      if (name.equals("ReadingDao")) throw new SourceFormattingException(name, "rejected", source);
      return source;
    });

    assertThatThrownBy(() -> failing.generate(Fixtures.config(Fixtures.events(), Fixtures.readings()), tempDir, out))
      .isInstanceOf(SourceFormattingException.class)
      .hasMessageStartingWith("Error formatting ReadingDao: rejected");
    assertThat(out).doesNotExist();
  }

  @Test
  void boilerplateResolvesAgainstBaseDir() throws Exception {
    Files.createDirectories(tempDir.resolve("templates"));
    Files.writeString(tempDir.resolve("templates/extra.ftl"), "    // boilerplate for ${model.daoName}\n");
    PersistConfig config = new PersistConfig("ks", "com.acme.dao", "templates/extra.ftl", List.of(), null, null,
        List.of(Fixtures.readings()));

    List<GeneratedArtifact> artifacts = generator.render(config, tempDir);

    assertThat(artifacts).singleElement().satisfies(a -> {
      assertThat(a.kind()).isEqualTo(GeneratedArtifact.Kind.DAO);
      assertThat(a.relativePath()).isEqualTo(Path.of("com", "acme", "dao", "ReadingDao.java"));
      assertThat(a.source()).contains("// boilerplate for ReadingDao");
    });
  }

  @Test
  void missingBoilerplateAbortsBeforeRendering() {
    PersistConfig config = new PersistConfig("ks", "com.acme.dao", "nope.ftl", List.of(), null, null,
        List.of(Fixtures.readings()));

    assertThatThrownBy(() -> generator.render(config, tempDir))
      .isInstanceOf(SchemaConfigurationException.class)
      .hasMessageContaining("nope.ftl");
  }

  private static String read(Path p) {
    try {
      return Files.readString(p);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
