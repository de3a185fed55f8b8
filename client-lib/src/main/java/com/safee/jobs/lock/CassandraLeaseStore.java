package com.safee.jobs.lock;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;

import java.time.Instant;

/**
 * LeaseStore using a Cassandra LWT (Paxos) insert.
 * Expiry is delegated to the cell TTL, so an expired lease simply disappears and the next
 * INSERT IF NOT EXISTS applies again.
 */
public class CassandraLeaseStore implements LeaseStore {
    private final CqlSession session;
    private final PreparedStatement insertLeaseIfNotExistsStmt;

    public CassandraLeaseStore(CqlSession session) {
        this.session = session;
        this.insertLeaseIfNotExistsStmt = session.prepare(
                SimpleStatement.newInstance(
                        "INSERT INTO leases (lease_key, holder, acquired_at) VALUES (?, ?, ?) IF NOT EXISTS USING TTL ?"));
    }

    @Override
    public boolean setIfAbsent(String key, String value, int ttlSeconds) {
        BoundStatement ins = insertLeaseIfNotExistsStmt.bind(key, value, Instant.now(), ttlSeconds);
        ResultSet res = session.execute(ins);
        Row row = res.one();
        return row != null && row.getBoolean("[applied]");
    }
}
