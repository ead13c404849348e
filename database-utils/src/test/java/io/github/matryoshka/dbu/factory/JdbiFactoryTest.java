package io.github.matryoshka.dbu.factory;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.matryoshka.dbu.model.Database;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbiFactoryTest {

  @TempDir
  Path tempDir;

  @Test
  void createJdbi() {
    final Database database = Database.forSqliteFile(tempDir.resolve("factory.db").toString());
    final Jdbi jdbi = new JdbiFactory(database).createJdbi();
    jdbi.useHandle(handle -> handle.execute("CREATE TABLE example (id INTEGER PRIMARY KEY, name TEXT)"));

    final List<Map<String, Object>> list = jdbi.withHandle(handle -> handle.createQuery("select * from example").mapToMap().list());
    assertThat(list).isEmpty();
    assertThat(tempDir.resolve("factory.db")).exists();
  }

  @Test
  void forSqliteFile_buildsJdbcUrl() {
    assertThat(Database.forSqliteFile("/tmp/container.db").url()).isEqualTo("jdbc:sqlite:/tmp/container.db");
  }

}
