package com.safee.jobs.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import static com.safee.jobs.config.Env.env;
import static com.safee.jobs.config.Env.envInt;

public final class DataSources {
    private DataSources() {
    }

    /**
     * Hikari pool for the job database, configured from PG_* variables or JDBC_URL.
     */
    public static HikariDataSource fromEnv(String poolName) {
        String host = env("PG_HOST", "localhost");
        int port = envInt("PG_PORT", 5432);
        String db = env("PG_DB", "jobs");
        String url = env("JDBC_URL", "jdbc:postgresql://" + host + ":" + port + "/" + db);

        HikariConfig hc = new HikariConfig();
        hc.setPoolName(poolName);
        hc.setJdbcUrl(url);
        hc.setUsername(env("PG_USER", "app"));
        hc.setPassword(env("PG_PASSWORD", "app"));
        hc.setMaximumPoolSize(envInt("PG_POOL_SIZE", 10));
        return new HikariDataSource(hc);
    }
}
