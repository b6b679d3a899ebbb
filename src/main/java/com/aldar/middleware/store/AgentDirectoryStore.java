package com.aldar.middleware.store;

import com.aldar.middleware.config.LedgerProperties;
import com.aldar.middleware.transcript.source.AgentDirectory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Agent and team display names, keyed by the orchestration id. Names change when an agent
 * is renamed; ids never do.
 */
@Component
public class AgentDirectoryStore implements AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(AgentDirectoryStore.class);

    // SQLite default SQLITE_MAX_VARIABLE_NUMBER is 999 on older builds.
    static final int MAX_IDS_PER_QUERY = 500;

    private static final String CREATE_AGENT_SQL = """
            CREATE TABLE IF NOT EXISTS AGENT_ (
              AGENT_ID_ TEXT PRIMARY KEY,
              AGENT_NAME_ TEXT NOT NULL,
              UPDATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_AGENT_NAME_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_AGENT_NAME_
              ON AGENT_(AGENT_NAME_ COLLATE NOCASE)
            """;

    private final LedgerProperties properties;
    private final Object lock = new Object();

    public AgentDirectoryStore(LedgerProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void initializeDatabase() {
        synchronized (lock) {
            Path dbPath = SqliteFiles.resolve(properties.getSqliteFile());
            SqliteFiles.createParentDirectories(dbPath);
            try (Connection connection = SqliteFiles.open(dbPath);
                 Statement statement = connection.createStatement()) {
                statement.execute(CREATE_AGENT_SQL);
                statement.execute(CREATE_AGENT_NAME_INDEX_SQL);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot initialize sqlite agent directory", ex);
            }
        }
    }

    public void registerAgent(String agentId, String agentName) {
        if (!StringUtils.hasText(agentId) || !StringUtils.hasText(agentName)) {
            throw new IllegalArgumentException("agentId and agentName must not be blank");
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         INSERT INTO AGENT_(AGENT_ID_, AGENT_NAME_, UPDATED_AT_)
                         VALUES (?, ?, ?)
                         ON CONFLICT(AGENT_ID_) DO UPDATE SET
                           AGENT_NAME_ = excluded.AGENT_NAME_,
                           UPDATED_AT_ = excluded.UPDATED_AT_
                         """)) {
                statement.setString(1, agentId.trim());
                statement.setString(2, agentName.trim());
                statement.setLong(3, System.currentTimeMillis());
                statement.executeUpdate();
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot register agent agentId=" + agentId, ex);
            }
        }
    }

    @Override
    public Map<String, String> resolveAgentNames(Collection<String> agentIds) {
        Set<String> ids = new LinkedHashSet<>();
        if (agentIds != null) {
            for (String agentId : agentIds) {
                if (StringUtils.hasText(agentId)) {
                    ids.add(agentId.trim());
                }
            }
        }
        if (ids.isEmpty()) {
            return Map.of();
        }

        List<String> ordered = new ArrayList<>(ids);
        Map<String, String> names = new LinkedHashMap<>();
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                for (int from = 0; from < ordered.size(); from += MAX_IDS_PER_QUERY) {
                    List<String> batch = ordered.subList(from, Math.min(ordered.size(), from + MAX_IDS_PER_QUERY));
                    readNames(connection, batch, names);
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot resolve agent names count=" + ids.size(), ex);
            }
        }
        log.debug("Resolved agent names requested={}, found={}", ids.size(), names.size());
        return names;
    }

    @Override
    public Optional<String> findAgentIdByName(String agentName) {
        if (!StringUtils.hasText(agentName)) {
            return Optional.empty();
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT AGENT_ID_
                         FROM AGENT_
                         WHERE AGENT_NAME_ = ? COLLATE NOCASE
                         ORDER BY UPDATED_AT_ DESC
                         LIMIT 1
                         """)) {
                statement.setString(1, agentName.trim());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(resultSet.getString("AGENT_ID_")) : Optional.empty();
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot look up agent by name=" + agentName, ex);
            }
        }
    }

    private static void readNames(Connection connection, List<String> batch, Map<String, String> sink) throws SQLException {
        String placeholders = String.join(", ", Collections.nCopies(batch.size(), "?"));
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT AGENT_ID_, AGENT_NAME_ FROM AGENT_ WHERE AGENT_ID_ IN (" + placeholders + ")")) {
            for (int i = 0; i < batch.size(); i++) {
                statement.setString(i + 1, batch.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    sink.put(resultSet.getString("AGENT_ID_"), resultSet.getString("AGENT_NAME_"));
                }
            }
        }
    }

    private Connection openConnection() throws SQLException {
        return SqliteFiles.open(SqliteFiles.resolve(properties.getSqliteFile()));
    }
}
