package com.libragraph.backup.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record InteractionRecord(
        @ColumnName("id") long id,
        @ColumnName("unique_id") String uniqueId,
        @ColumnName("thread_unique_id") String threadUniqueId,
        @ColumnName("kind") short kind,
        @ColumnName("sent_at") long sentAt,
        @ColumnName("edit_state") short editState,
        @ColumnName("latest_revision_id") Long latestRevisionId,
        @ColumnName("payload") String payload
) {}
