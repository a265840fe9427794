package co.cqlgen.generators.java;

import co.cqlgen.core.SchemaConfigurationException;
import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.KeyRole;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class DaoTemplateRendererTest {

  @TempDir
  Path tempDir;

  private final JavaSourceFormatter formatter = new JavaSourceFormatter();

  private static EmissionModel model(TableDefinition table) {
    return EmissionModelBuilder.build(Fixtures.config(table), table);
  }

  @Test
  void rendersEventDao() {
    String dao = new DaoTemplateRenderer().render(model(Fixtures.events()));

    assertThat(dao)
      .startsWith("// Code generated by cqlgen for Event; DO NOT EDIT THIS FILE\n")
      .contains("package com.acme.dao;")
      .contains("import java.time.Instant;")
      .contains("public abstract class EventDao {")
      .contains("private static final ObjectMapper MAPPER = new ObjectMapper();")
      .contains("CREATE TABLE IF NOT EXISTS ks.events (")
      .contains("tags list<blob>,")
      .contains("PRIMARY KEY (id, ts)")
      .contains(") WITH CLUSTERING ORDER BY (ts DESC)\"\"\";")
      .contains("\"INSERT INTO ks.events (id, ts, tags, name) VALUES (?, ?, ?, ?)\"")
      .contains("\"SELECT id, ts, tags, name FROM ks.events WHERE id=? AND ts=?\"")
      .contains("\"SELECT id, ts, tags, name FROM ks.events WHERE id=?\"")
      .contains("\"DELETE FROM ks.events WHERE id=? AND ts=?\"")
      .contains("protected abstract CqlSession createSession();")
      .contains("public void init() {")
      .contains("public Event add(Event r) {")
      .contains("public record EventStream(Event dto, Throwable error) {")
      .contains("session.execute(statement(INSERT, r.getId(), r.getTs(), encodeTags(r.getTags()), r.getName()));")
      .contains("return single(query(session, SELECT_SINGLE, id, ts));")
      .contains("private static Optional<Event> single(List<Event> rows) {")
      .contains("public Optional<Event> get(UUID id, Instant ts) {")
      .contains("public Optional<Event> get(UUID id, Instant ts, CqlSession session) {")
      .contains("public List<Event> list(UUID id) {")
      .contains("public BlockingQueue<EventStream> stream(UUID id) {")
      .contains("session.execute(statement(DELETE, r.getId(), r.getTs()));")
      .contains("resource.setTags(decodeTags(row.getList(\"tags\", ByteBuffer.class)));")
      .contains("resource.setTs(row.get(\"ts\", Instant.class));")
      .contains("private static List<Tag> decodeTags(List<ByteBuffer> raw) {")
      .contains("private static byte[] bytes(ByteBuffer buffer) {");

    assertThatCode(() -> formatter.format("EventDao", dao)).doesNotThrowAnyException();
  }

  @Test
  void compositePartitionKey() {
    String dao = new DaoTemplateRenderer().render(model(Fixtures.readings()));

    assertThat(dao)
      .contains("PRIMARY KEY ((k1, k2))")
      .contains("WHERE k1=? AND k2=?\"")
      .contains("public List<Reading> list(String k1, Integer k2) {")
      .contains("public Optional<Reading> get(String k1, Integer k2) {")
      .doesNotContain("CLUSTERING ORDER")
      .doesNotContain("ObjectMapper")
      .doesNotContain("import java.time.Instant;");

    assertThatCode(() -> formatter.format("ReadingDao", dao)).doesNotThrowAnyException();
  }

  @Test
  void fullKeyLookupReferencesEachKeyOnce() {
    String dao = new DaoTemplateRenderer().render(model(Fixtures.events()));

    String select = dao.lines()
      .filter(line -> line.contains("WHERE id=? AND ts=?") && line.contains("SELECT"))
      .findFirst()
      .orElseThrow();
    String where = select.substring(select.indexOf("WHERE"));
    assertThat(where.split("id=\\?", -1)).hasSize(2);
    assertThat(where.split("ts=\\?", -1)).hasSize(2);
  }

  @Test
  void blobMapHelpersAndUnknownTypes() {
    TableDefinition table = new TableDefinition("Doc", "docs", "DocDao", null, List.of(
        ColumnDefinition.of("id", "text", KeyRole.PARTITION),
        new ColumnDefinition("attrs", "map<text,blob>", KeyRole.NONE, "Attr"),
        ColumnDefinition.of("amount", "decimal")));

    String dao = new DaoTemplateRenderer().render(model(table));

    assertThat(dao)
      .contains("session.execute(statement(INSERT, r.getId(), encodeAttrs(r.getAttrs()), r.getAmount()));")
      .contains("private static Map<String, Attr> decodeAttrs(Map<String, ByteBuffer> raw) {")
      .contains("resource.setAmount(row.get(\"amount\", UnknownCqlType.class));");

    assertThatCode(() -> formatter.format("DocDao", dao)).doesNotThrowAnyException();
  }

  @Test
  void boilerplateIsSplicedBeforeStreamRecord() {
    DaoTemplateRenderer renderer = DaoTemplateRenderer.withBoilerplateText("extra.ftl",
        "    public String tableName() {\n        return \"${model.qualifiedTableName}\";\n    }\n");

    String dao = renderer.render(model(Fixtures.events()));

    int boilerplate = dao.indexOf("return \"ks.events\";");
    assertThat(boilerplate).isPositive();
    assertThat(boilerplate).isLessThan(dao.indexOf("public record EventStream"));
    assertThatCode(() -> formatter.format("EventDao", dao)).doesNotThrowAnyException();
  }

  @Test
  void boilerplateIsReadFromFile() throws Exception {
    Path file = Files.writeString(tempDir.resolve("extra.ftl"), "    // extra for ${model.tableName}\n");

    String dao = DaoTemplateRenderer.withBoilerplate(file).render(model(Fixtures.readings()));

    assertThat(dao).contains("// extra for readings");
  }

  @Test
  void missingBoilerplateIsAConfigurationError() {
    assertThatThrownBy(() -> DaoTemplateRenderer.withBoilerplate(tempDir.resolve("missing.ftl")))
      .isInstanceOf(SchemaConfigurationException.class)
      .hasMessageContaining("missing.ftl");
  }

  @Test
  void brokenBoilerplateFailsRendering() {
    assertThatThrownBy(() -> DaoTemplateRenderer.withBoilerplateText("bad.ftl", "<#if>"))
      .isInstanceOf(TemplateRenderingException.class)
      .hasMessageContaining("bad.ftl");

    DaoTemplateRenderer renderer = DaoTemplateRenderer.withBoilerplateText("undefined.ftl", "${model.nothingHere}");
    assertThatThrownBy(() -> renderer.render(model(Fixtures.events())))
      .isInstanceOf(TemplateRenderingException.class)
      .hasMessageContaining("undefined.ftl");
  }

  @Test
  void renderingIsDeterministic() {
    PersistConfig config = Fixtures.config(Fixtures.events());
    DaoTemplateRenderer renderer = new DaoTemplateRenderer();

    String first = renderer.render(EmissionModelBuilder.build(config, Fixtures.events()));
    String second = renderer.render(EmissionModelBuilder.build(config, Fixtures.events()));

    assertThat(second).isEqualTo(first);
  }

  @Test
  void columnsNamedLikeGeneratedLocalsAreOnlyParameters() {
    String dao = formatter.format("ClashDao",
        new DaoTemplateRenderer().render(model(GeneratedSourceCompilationTest.clashing())));

    assertThat(dao)
      .contains("public Optional<Clash> get(String res, String cql, Instant stream, Integer params, CqlSession session) {")
      .contains("return single(query(session, SELECT_SINGLE, res, cql, stream, params));")
      .contains("return streamQuery(SELECT_LIST, res, cql);")
      .contains("session.execute(statement(INSERT, r.getRes(), r.getCql(), r.getStream(), r.getParams(), r.getRow(), "
          + "r.getResource(), r.getResults(), r.getR(), r.getThat(), r.getOther(), encodeValues(r.getValues()), "
          + "encodeEncoded(r.getEncoded())));")
      .contains("resource.setResource(row.get(\"resource\", String.class));")
      .contains("resource.setRow(row.get(\"row\", String.class));")
      .doesNotContain("String res =")
      .doesNotContain("List<ByteBuffer> values =")
      .doesNotContain("Map<String, ByteBuffer> encoded =");
  }
}
