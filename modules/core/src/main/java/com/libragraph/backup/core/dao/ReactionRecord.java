package com.libragraph.backup.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record ReactionRecord(
        @ColumnName("id") long id,
        @ColumnName("message_id") long messageId,
        @ColumnName("reactor_address") String reactorAddress,
        @ColumnName("emoji") String emoji,
        @ColumnName("sent_at") long sentAt,
        @ColumnName("received_at") long receivedAt
) {}
