package com.libragraph.backup.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.List;

public interface RecipientDao {

    @SqlQuery("SELECT address FROM (" +
            " SELECT recipient_address AS address FROM thread" +
            " UNION SELECT author_address FROM interaction WHERE author_address IS NOT NULL" +
            " UNION SELECT jsonb_object_keys(payload -> 'recipientStates') FROM interaction WHERE kind = 1" +
            " UNION SELECT reactor_address FROM reaction" +
            ") addresses ORDER BY address")
    List<String> findAllAddresses();
}
