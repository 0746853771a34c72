package com.dbguardian.server.bus;

import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// LISTEN/NOTIFY on a dedicated connection taken out of the pool for the subscription lifetime
@Slf4j
@Component
public class PgScheduleChangeChannel implements ScheduleChangeChannel {

    private final DataSource dataSource;

    private final int pingTimeoutSec;

    @Autowired
    public PgScheduleChangeChannel(
            DataSource dataSource,
            @Value("${dbguardian.server.listener.pingTimeoutSec:10}") int pingTimeoutSec) {
        this.dataSource = dataSource;
        this.pingTimeoutSec = Math.max(1, pingTimeoutSec);
    }

    @Override
    public Subscription subscribe() throws SQLException {
        Connection connection = this.dataSource.getConnection();
        try {
            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + CHANNEL_NAME);
            }
            PGConnection pgConnection = connection.unwrap(PGConnection.class);
            return new PgSubscription(connection, pgConnection, this.pingTimeoutSec);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("close listen connection failed", e);
        }
    }

    private static class PgSubscription implements Subscription {

        private final Connection connection;

        private final PGConnection pgConnection;

        private final int pingTimeoutSec;

        PgSubscription(Connection connection, PGConnection pgConnection, int pingTimeoutSec) {
            this.connection = connection;
            this.pgConnection = pgConnection;
            this.pingTimeoutSec = pingTimeoutSec;
        }

        @Override
        public List<String> poll(long timeoutMillis) throws SQLException {
            PGNotification[] notifications = this.pgConnection.getNotifications(
                    (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeoutMillis)));
            if (notifications == null || notifications.length == 0) {
                return Collections.emptyList();
            }
            List<String> payloads = new ArrayList<>(notifications.length);
            for (PGNotification notification : notifications) {
                payloads.add(notification.getParameter());
            }
            return payloads;
        }

        @Override
        public void ping() throws SQLException {
            // isValid 带超时, 半开连接不会一直阻塞
            if (!this.connection.isValid(this.pingTimeoutSec)) {
                throw new SQLException("listen connection did not answer within %s s".formatted(this.pingTimeoutSec));
            }
        }

        @Override
        public void close() {
            try (Statement statement = this.connection.createStatement()) {
                statement.execute("UNLISTEN " + CHANNEL_NAME);
            } catch (SQLException e) {
                log.debug("unlisten failed, connection is probably gone", e);
            }
            closeQuietly(this.connection);
        }
    }
}
