package io.taskstore.core.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LISTEN on a pooled PostgreSQL connection, read through
 * {@link PGConnection#getNotifications(int)}.
 */
public class PgNotificationSource
        implements NotificationSource
{
    private static final Logger logger = LoggerFactory.getLogger(PgNotificationSource.class);

    private final DataSource ds;

    @Inject
    public PgNotificationSource(DataSource ds)
    {
        this.ds = ds;
    }

    @Override
    public NotificationSubscription subscribe(String channel)
            throws SQLException
    {
        Connection conn = ds.getConnection();
        try {
            conn.setAutoCommit(true);
            PGConnection pg = conn.unwrap(PGConnection.class);
            try (Statement stmt = conn.createStatement()) {
                // channel is validated by DataStoreConfig; quoting keeps its case
                stmt.execute("LISTEN \"" + channel + "\"");
            }
            return new PgSubscription(conn, pg, channel);
        }
        catch (SQLException | RuntimeException ex) {
            closeQuietly(conn);
            throw ex;
        }
    }

    private static void closeQuietly(Connection conn)
    {
        try {
            conn.close();
        }
        catch (SQLException ex) {
            logger.debug("Failed to close notification connection", ex);
        }
    }

    private static class PgSubscription
            implements NotificationSubscription
    {
        private final Connection conn;
        private final PGConnection pg;
        private final String channel;

        PgSubscription(Connection conn, PGConnection pg, String channel)
        {
            this.conn = conn;
            this.pg = pg;
            this.channel = channel;
        }

        @Override
        public List<String> poll(Duration timeout)
                throws SQLException
        {
            // 0 would block without limit
            int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            PGNotification[] notifications = pg.getNotifications(millis);
            if (notifications == null || notifications.length == 0) {
                return ImmutableList.of();
            }
            ImmutableList.Builder<String> payloads = ImmutableList.builder();
            for (PGNotification notification : notifications) {
                if (channel.equals(notification.getName())) {
                    payloads.add(notification.getParameter());
                }
            }
            return payloads.build();
        }

        @Override
        public void ping()
                throws SQLException
        {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("SELECT 1");
            }
        }

        @Override
        public void close()
        {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("UNLISTEN \"" + channel + "\"");
            }
            catch (SQLException ex) {
                logger.debug("Failed to UNLISTEN channel {}", channel, ex);
            }
            finally {
                closeQuietly(conn);
            }
        }
    }
}
