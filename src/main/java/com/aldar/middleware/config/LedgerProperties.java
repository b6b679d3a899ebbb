package com.aldar.middleware.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String sqliteFile = "./data/ledger.db";

    public String getSqliteFile() {
        return sqliteFile;
    }

    public void setSqliteFile(String sqliteFile) {
        this.sqliteFile = sqliteFile;
    }
}
