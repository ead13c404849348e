package io.github.matryoshka.dao;

import io.github.matryoshka.model.ChunkLocation;
import io.github.matryoshka.model.ImmutableChunkLocation;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps rows of the chunk range query.
 */
public class ChunkLocationMapper implements RowMapper<ChunkLocation> {

  @Override
  public ChunkLocation map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableChunkLocation.builder()
        .chunkId(rs.getLong("chunk_id"))
        .chunkNum(rs.getLong("chunk_num"))
        .chunkSize(rs.getInt("chunk_size"))
        .blobLength(rs.getInt("blob_length"))
        .build();
  }

}
