package io.taskstore.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import static io.taskstore.core.database.BasicDatabaseStoreManager.getOptionalString;
import static io.taskstore.core.database.BasicDatabaseStoreManager.getOptionalTimestampInstant;

public class StoredRowMapper
        implements RowMapper<StoredRow>
{
    @Override
    public StoredRow map(ResultSet r, StatementContext ctx)
            throws SQLException
    {
        return ImmutableStoredRow.builder()
            .id(r.getString("id"))
            .serializedData(r.getBytes("serialized_data"))
            .acquiredBy(getOptionalString(r, "acquired_by"))
            .acquiredUntil(getOptionalTimestampInstant(r, "acquired_until"))
            .build();
    }
}
