package io.github.matryoshka.dao;

import io.github.matryoshka.model.FileEntry;
import io.github.matryoshka.model.ImmutableFileEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps rows of the meta table.
 */
public class FileEntryMapper implements RowMapper<FileEntry> {

  @Override
  public FileEntry map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableFileEntry.builder()
        .id(rs.getLong("id"))
        .path(rs.getString("path"))
        .type(rs.getInt("type"))
        .flags(rs.getInt("flags"))
        .chunkSize(rs.getInt("chunk_size"))
        .build();
  }

}
