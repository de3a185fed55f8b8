package com.safee.jobs.queue;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.safee.jobs.db.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.safee.jobs.config.Env.env;
import static com.safee.jobs.config.Env.envInt;

/**
 * Session bootstrap for the Cassandra side (leases and queues): keyspace, then classpath
 * {@code cql/schema.cql}.
 */
public final class CassandraSchema {
    public static final String SCHEMA_RESOURCE = "cql/schema.cql";

    private static final Logger log = LoggerFactory.getLogger(CassandraSchema.class);

    private CassandraSchema() {
    }

    /**
     * Opens a keyspace-bound session from CASSANDRA_* variables, creating the keyspace and
     * tables first when missing.
     */
    public static CqlSession connectFromEnv() {
        String contactPoint = env("CASSANDRA_CONTACT_POINT", "127.0.0.1");
        int port = envInt("CASSANDRA_PORT", 9042);
        String keyspace = env("CASSANDRA_KEYSPACE", "jobs");
        String localDc = env("CASS_LOCAL_DC", "DC1");
        int replication = envInt("CASSANDRA_REPLICATION", 1);

        try (CqlSession bootstrap = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(contactPoint, port))
                .withLocalDatacenter(localDc)
                .build()) {
            ensureKeyspace(bootstrap, keyspace, replication);
        }
        CqlSession session = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(contactPoint, port))
                .withLocalDatacenter(localDc)
                .withKeyspace(keyspace)
                .build();
        apply(session);
        return session;
    }

    public static void ensureKeyspace(CqlSession session, String keyspace, int replicationFactor) {
        ResultSet rs = session.execute(
                "SELECT keyspace_name FROM system_schema.keyspaces WHERE keyspace_name='" + keyspace + "'");
        if (rs.one() == null) {
            log.info("Keyspace '{}' not found. Creating (rf={})", keyspace, replicationFactor);
            session.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                    + " WITH replication = {'class':'SimpleStrategy','replication_factor':" + replicationFactor + "}");
        }
    }

    /** Runs the table DDL against the session's keyspace. */
    public static void apply(CqlSession session) {
        List<String> statements = SchemaInitializer.statements(readResource());
        for (String cql : statements) {
            session.execute(cql);
        }
        log.info("Cassandra schema applied ({} statements)", statements.size());
    }

    private static String readResource() {
        try (InputStream in = CassandraSchema.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading " + SCHEMA_RESOURCE, e);
        }
    }
}
