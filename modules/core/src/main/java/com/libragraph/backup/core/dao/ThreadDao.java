package com.libragraph.backup.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ThreadRecord.class)
public interface ThreadDao {

    @SqlQuery("SELECT * FROM thread WHERE unique_id = :uniqueId")
    Optional<ThreadRecord> findByUniqueId(@Bind("uniqueId") String uniqueId);

    @SqlQuery("SELECT * FROM thread ORDER BY id")
    List<ThreadRecord> findAll();

    @SqlQuery("SELECT * FROM thread WHERE recipient_address = :address ORDER BY id LIMIT 1")
    Optional<ThreadRecord> findByRecipientAddress(@Bind("address") String address);

    @SqlUpdate("INSERT INTO thread (unique_id, recipient_address) VALUES (:uniqueId, :address)")
    @GetGeneratedKeys("id")
    long insert(@Bind("uniqueId") String uniqueId, @Bind("address") String address);
}
