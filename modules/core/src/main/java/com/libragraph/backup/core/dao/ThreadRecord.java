package com.libragraph.backup.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record ThreadRecord(
        @ColumnName("id") long id,
        @ColumnName("unique_id") String uniqueId,
        @ColumnName("recipient_address") String recipientAddress
) {}
