package com.aldar.middleware.store;

import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

final class SqliteFiles {

    static final String DEFAULT_FILE = "ledger.db";

    private SqliteFiles() {
    }

    static Path resolve(String configured) {
        String file = StringUtils.hasText(configured) ? configured.trim() : DEFAULT_FILE;
        Path path = Paths.get(file);
        if (!path.isAbsolute()) {
            path = Paths.get(System.getProperty("user.dir")).resolve(path).normalize();
        }
        return path.toAbsolutePath().normalize();
    }

    static void createParentDirectories(Path dbPath) {
        Path parent = dbPath.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot create sqlite directory for " + dbPath, ex);
        }
    }

    static Connection open(Path dbPath) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    static String nullable(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
