package com.safee.jobs.worker;

import java.util.UUID;

import com.safee.jobs.db.SchemaInitializer;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** In-memory H2 in PostgreSQL mode with the job schema applied. */
public final class TestDatabases {
    private TestDatabases() {
    }

    public static HikariDataSource h2() {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("worker-h2-test");
        hc.setJdbcUrl("jdbc:h2:mem:worker-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH");
        hc.setUsername("sa");
        hc.setPassword("");
        hc.setMaximumPoolSize(4);
        HikariDataSource ds = new HikariDataSource(hc);
        SchemaInitializer.apply(ds);
        return ds;
    }
}
