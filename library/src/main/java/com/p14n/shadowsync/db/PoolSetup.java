package com.p14n.shadowsync.db;

import com.p14n.shadowsync.data.ShadowSyncConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

public class PoolSetup {

    public static final int DEFAULT_POOL_SIZE = 10;

    private PoolSetup() {
    }

    public static DataSource createPool(ShadowSyncConfig cfg) {
        return createPool(cfg, DEFAULT_POOL_SIZE);
    }

    /**
     * HikariCP pool for the shadow repository. Shadow writes are single-row
     * upserts, so the pool stays small and fails fast when the database is
     * unreachable at startup.
     *
     * @param cfg     database connection details
     * @param maxSize maximum number of pooled connections
     * @return the pooled DataSource
     */
    public static DataSource createPool(ShadowSyncConfig cfg, int maxSize) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.jdbcUrl());
        hc.setUsername(cfg.dbUser());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("shadowsync-shadows");
        hc.setMaximumPoolSize(maxSize);
        hc.setMinimumIdle(Math.min(2, maxSize));
        hc.addDataSourceProperty("ApplicationName", "shadowsync");
        return new HikariDataSource(hc);
    }
}
