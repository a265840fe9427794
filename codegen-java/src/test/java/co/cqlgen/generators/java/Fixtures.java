package co.cqlgen.generators.java;

import co.cqlgen.core.model.ColumnDefinition;
import co.cqlgen.core.model.KeyRole;
import co.cqlgen.core.model.ModelGenerationTarget;
import co.cqlgen.core.model.PersistConfig;
import co.cqlgen.core.model.TableDefinition;

import java.util.List;

final class Fixtures {

  private Fixtures() {}

  /** id uuid partition, ts timestamp cluster-desc, tags list<blob> of Tag, name text. */
  static TableDefinition events() {
    return new TableDefinition("Event", "events", "EventDao", null, List.of(
        ColumnDefinition.of("id", "uuid", KeyRole.PARTITION),
        ColumnDefinition.of("ts", "timestamp", KeyRole.CLUSTER_DESC),
        new ColumnDefinition("tags", "list<blob>", KeyRole.NONE, "Tag"),
        ColumnDefinition.of("name", "text")));
  }

  /** k1 text partition, k2 int partition, v double. */
  static TableDefinition readings() {
    return new TableDefinition("Reading", "readings", "ReadingDao", null, List.of(
        ColumnDefinition.of("k1", "text", KeyRole.PARTITION),
        ColumnDefinition.of("k2", "int", KeyRole.PARTITION),
        ColumnDefinition.of("v", "double")));
  }

  static PersistConfig config(TableDefinition... tables) {
    return new PersistConfig("ks", "com.acme.dao", null, List.of(), null, null, List.of(tables));
  }

  static PersistConfig configWithModels(TableDefinition... tables) {
    return new PersistConfig("ks", "com.acme.dao", null, List.of(), null,
        new ModelGenerationTarget("com.acme.model", "model-src"), List.of(tables));
  }
}
