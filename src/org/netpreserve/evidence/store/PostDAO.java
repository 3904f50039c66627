package org.netpreserve.evidence.store;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface PostDAO {
    @SqlQuery("""
            INSERT INTO post (status_id, screen_name) VALUES (:statusId, :screenName)
            ON CONFLICT (status_id) DO UPDATE SET status_id = excluded.status_id
            RETURNING id
            """)
    long insertOrGetId(long statusId, String screenName);
}
