package co.cqlgen.core.model;

import co.cqlgen.core.SchemaConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class PersistConfigTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final TableDefinition TABLE = new TableDefinition("Event", "events", "EventDao", null,
      List.of(ColumnDefinition.of("id", "uuid", KeyRole.PARTITION)));

  @Test
  void modelPackageFallsBackToModelGenerationThenTargetPackage() {
    assertThat(new PersistConfig("ks", "com.acme.dao", null, null, "com.acme.alias",
        new ModelGenerationTarget("com.acme.model", null), List.of(TABLE)).modelPackage())
      .isEqualTo("com.acme.alias");
    assertThat(new PersistConfig("ks", "com.acme.dao", null, null, " ",
        new ModelGenerationTarget("com.acme.model", null), List.of(TABLE)).modelPackage())
      .isEqualTo("com.acme.model");
    assertThat(PersistConfig.singleTable("ks", "com.acme.dao", TABLE).modelPackage())
      .isEqualTo("com.acme.dao");
  }

  @Test
  void defaultsAreApplied() {
    PersistConfig c = new PersistConfig("ks", "com.acme", "", null, null, null, null);
    assertThat(c.additionalImports()).isEmpty();
    assertThat(c.tables()).isEmpty();
    assertThat(c.boilerplate()).isEmpty();
    assertThat(new ModelGenerationTarget("com.acme", null).location()).isEqualTo(".");
    assertThat(TABLE.generatedArtifactName()).isEqualTo("Event");
  }

  @Test
  void readsLowerCaseModelGenerationAndAliases() throws Exception {
    PersistConfig c = MAPPER.readValue("""
        {"keyspace": "ks", "package": "p",
         "modelGeneration": {"package": "m", "location": "out"},
         "tables": [{"modelName": "A", "tableName": "a", "daoName": "ADao", "generatedArtifactName": "Gen",
                     "columns": [{"name": "id", "type": "text", "key": "PARTITION"}]}]}
        """, PersistConfig.class);

    assertThat(c.modelGenerationTarget()).contains(new ModelGenerationTarget("m", "out"));
    assertThat(c.tables().get(0).daoName()).isEqualTo("ADao");
    assertThat(c.tables().get(0).generatedArtifactName()).isEqualTo("Gen");
    assertThat(c.tables().get(0).columns().get(0).keyRole()).isEqualTo(KeyRole.PARTITION);
  }

  @Test
  void keyRoleWireNames() {
    assertThat(KeyRole.fromWireName(null)).isEqualTo(KeyRole.NONE);
    assertThat(KeyRole.fromWireName("")).isEqualTo(KeyRole.NONE);
    assertThat(KeyRole.fromWireName("cluster-asc")).isEqualTo(KeyRole.CLUSTER_ASC);
    assertThat(KeyRole.CLUSTER_DESC.sortDirection()).isEqualTo("DESC");
    assertThat(KeyRole.CLUSTER.sortDirection()).isNull();
    assertThat(KeyRole.CLUSTER.isClustering()).isTrue();
    assertThat(KeyRole.PARTITION.isClustering()).isFalse();
    assertThatThrownBy(() -> KeyRole.fromWireName("primary"))
      .isInstanceOf(SchemaConfigurationException.class);
  }

  @Test
  void columnDefinitionNormalizesBlankTarget() {
    ColumnDefinition c = new ColumnDefinition("tags", "list<blob>", null, " ");
    assertThat(c.keyRole()).isEqualTo(KeyRole.NONE);
    assertThat(c.hasDeserializeTarget()).isFalse();
  }
}
