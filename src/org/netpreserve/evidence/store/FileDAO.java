package org.netpreserve.evidence.store;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ContentDigestRecord.class)
public interface FileDAO {
    @SqlQuery("""
            INSERT INTO file (digest, path, size, primary_status_id, stored)
            VALUES (:digest, :path, :size, :primaryStatusId, :stored)
            ON CONFLICT (digest) DO UPDATE SET digest = excluded.digest
            RETURNING id
            """)
    long insertOrGetId(String digest, String path, long size, @Nullable Long primaryStatusId, long stored);

    @SqlQuery("SELECT digest, path, size, primary_status_id FROM file WHERE digest = ?")
    Optional<ContentDigestRecord> find(String digest);

    @SqlQuery("SELECT id FROM file WHERE digest = ?")
    Optional<Long> findId(String digest);

    @SqlQuery("SELECT digest, path, size, primary_status_id FROM file ORDER BY digest")
    List<ContentDigestRecord> list();

    @SqlUpdate("DELETE FROM file WHERE digest = ?")
    int delete(String digest);

    @SqlQuery("SELECT COUNT(*) FROM file")
    long count();
}
