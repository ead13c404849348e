package io.github.matryoshka.manager;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.matryoshka.BaseJdbiTest;
import io.github.matryoshka.dao.Schema;
import io.github.matryoshka.model.MetaData;
import org.jdbi.v3.core.Handle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaManagerTest extends BaseJdbiTest {

  private Handle handle;
  private SchemaManager schemaManager;

  @BeforeEach
  void setup() {
    handle = openHandle();
    schemaManager = new SchemaManager(handle);
  }

  @Test
  void extractVersion() {
    assertThat(SchemaManager.extractVersion("Matryoshka_Meta_42")).contains(42);
    assertThat(SchemaManager.extractVersion("Matryoshka_Meta_0")).contains(0);
    assertThat(SchemaManager.extractVersion("Matryoshka_Meta_7_backup")).contains(7);
    assertThat(SchemaManager.extractVersion("Matryoshka_Data")).isEmpty();
    assertThat(SchemaManager.extractVersion("Matryoshka_Meta_")).isEmpty();
    assertThat(SchemaManager.extractVersion("Other_Matryoshka_Meta_1")).isEmpty();
    assertThat(SchemaManager.extractVersion("Matryoshka_Meta_99999999999")).isEmpty();
  }

  @Test
  void metaTableName() {
    assertThat(SchemaManager.metaTableName(3)).isEqualTo("Matryoshka_Meta_3");
    assertThat(SchemaManager.metaTableName(Schema.CURRENT_VERSION)).isEqualTo(Schema.META_TABLE);
  }

  @Test
  void discover_emptyDatabase() {
    assertThat(schemaManager.discover()).isEmpty();
  }

  @Test
  void discover_findsMaxVersion() {
    handle.execute("CREATE TABLE Matryoshka_Meta_3 (id INTEGER)");
    handle.execute("CREATE TABLE Matryoshka_Meta_42 (id INTEGER)");
    handle.execute("CREATE TABLE Matryoshka_Meta_7 (id INTEGER)");
    handle.execute("CREATE TABLE Unrelated (id INTEGER)");

    assertThat(schemaManager.discover()).contains(MetaData.of(42));
  }

  @Test
  void create() {
    final MetaData metaData = schemaManager.create();

    assertThat(metaData.version()).isEqualTo(Schema.CURRENT_VERSION);
    assertThat(schemaManager.discover()).contains(metaData);
    assertThat(handle.createQuery("SELECT COUNT(*) FROM sqlite_master WHERE name = ?")
        .bind(0, Schema.DATA_TABLE)
        .mapTo(Integer.class)
        .one()).isEqualTo(1);
  }

}
