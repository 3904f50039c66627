package org.netpreserve.evidence.store;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(ContentDigestRecord.class)
@RegisterConstructorMapper(CaptureLink.class)
public interface CaptureDAO {
    /**
     * @return 1 if linked, 0 if this capture of the post was already linked
     */
    @SqlUpdate("""
            INSERT INTO capture (post_id, file_id, screen_name, timestamp, url)
            VALUES (:postId, :fileId, :screenName, :timestamp, :url)
            ON CONFLICT (post_id, timestamp) DO NOTHING
            """)
    int insert(long postId, long fileId, String screenName, long timestamp, String url);

    @SqlQuery("""
            SELECT f.digest FROM capture c
            JOIN post p ON p.id = c.post_id
            JOIN file f ON f.id = c.file_id
            WHERE p.status_id = :statusId AND c.timestamp = :timestamp
            """)
    Optional<String> findDigest(long statusId, long timestamp);

    @SqlQuery("""
            SELECT DISTINCT f.digest, f.path, f.size, f.primary_status_id FROM capture c
            JOIN post p ON p.id = c.post_id
            JOIN file f ON f.id = c.file_id
            WHERE p.status_id = ?
            ORDER BY f.digest
            """)
    List<ContentDigestRecord> digestsForPost(long statusId);

    @SqlQuery("""
            SELECT p.status_id, c.screen_name, c.timestamp, c.url, f.digest FROM capture c
            JOIN post p ON p.id = c.post_id
            JOIN file f ON f.id = c.file_id
            ORDER BY p.status_id, c.timestamp
            """)
    List<CaptureLink> list();

    @SqlUpdate("DELETE FROM capture WHERE file_id IN (SELECT id FROM file WHERE digest = ?)")
    int deleteForDigest(String digest);
}
