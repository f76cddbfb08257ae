package io.taskstore.core.database;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Serialized payload of a schedule or job row with the lease columns that
 * are not part of the payload.
 */
@Value.Immutable
public interface StoredRow
{
    String getId();

    byte[] getSerializedData();

    Optional<String> getAcquiredBy();

    Optional<Instant> getAcquiredUntil();
}
