package com.libragraph.backup.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(ReactionRecord.class)
public interface ReactionDao {

    @SqlQuery("SELECT * FROM reaction WHERE message_id = :messageId ORDER BY received_at, id")
    List<ReactionRecord> findByMessage(@Bind("messageId") long messageId);

    @SqlUpdate("INSERT INTO reaction (message_id, reactor_address, emoji, sent_at, received_at) " +
            "VALUES (:messageId, :reactorAddress, :emoji, :sentAt, :receivedAt) " +
            "ON CONFLICT (message_id, reactor_address) DO UPDATE SET emoji = EXCLUDED.emoji, " +
            "sent_at = EXCLUDED.sent_at, received_at = EXCLUDED.received_at")
    void upsert(@Bind("messageId") long messageId,
                @Bind("reactorAddress") String reactorAddress,
                @Bind("emoji") String emoji,
                @Bind("sentAt") long sentAt,
                @Bind("receivedAt") long receivedAt);
}
