package com.dbguardian.server.bus;

import java.util.List;

/**
 * Source of schedule change notifications.
 */
public interface ScheduleChangeChannel {

    String CHANNEL_NAME = "schedule_changes";

    Subscription subscribe() throws Exception;

    interface Subscription extends AutoCloseable {

        /**
         * Wait up to {@code timeoutMillis} for notifications.
         *
         * @return payloads received, empty on timeout
         */
        List<String> poll(long timeoutMillis) throws Exception;

        // round trip to detect a dead connection
        void ping() throws Exception;

        @Override
        void close();
    }
}
