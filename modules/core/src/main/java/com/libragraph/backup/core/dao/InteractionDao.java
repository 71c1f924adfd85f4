package com.libragraph.backup.core.dao;

import org.jdbi.v3.core.result.ResultIterator;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(InteractionRecord.class)
public interface InteractionDao {

    /** Every interaction in insertion order. The caller must close the iterator. */
    @SqlQuery("SELECT * FROM interaction ORDER BY id")
    ResultIterator<InteractionRecord> iterateAll();

    @SqlQuery("SELECT * FROM interaction WHERE latest_revision_id = :latestId ORDER BY sent_at, id")
    List<InteractionRecord> findPastRevisions(@Bind("latestId") long latestId);

    @SqlUpdate("INSERT INTO interaction (unique_id, thread_unique_id, kind, sent_at, author_address, " +
            "edit_state, latest_revision_id, payload) " +
            "VALUES (:uniqueId, :threadUniqueId, :kind, :sentAt, :authorAddress, :editState, " +
            ":latestRevisionId, CAST(:payloadJson AS jsonb))")
    @GetGeneratedKeys("id")
    long insert(@Bind("uniqueId") String uniqueId,
                @Bind("threadUniqueId") String threadUniqueId,
                @Bind("kind") short kind,
                @Bind("sentAt") long sentAt,
                @Bind("authorAddress") String authorAddress,
                @Bind("editState") short editState,
                @Bind("latestRevisionId") Long latestRevisionId,
                @Bind("payloadJson") String payloadJson);
}
