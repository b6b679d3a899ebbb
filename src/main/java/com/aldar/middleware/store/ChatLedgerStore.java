package com.aldar.middleware.store;

import com.aldar.middleware.config.LedgerProperties;
import com.aldar.middleware.model.Attachment;
import com.aldar.middleware.model.Feedback;
import com.aldar.middleware.model.LocalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.transcript.ContentText;
import com.aldar.middleware.transcript.source.AttachmentIndex;
import com.aldar.middleware.transcript.source.FeedbackStore;
import com.aldar.middleware.transcript.source.MessageLedger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * SQLite-backed message ledger.
 * <p>
 * The send path writes here before the orchestration run starts: the user message, later
 * its stream marker and run id, uploaded attachments and feedback. The transcript read
 * path only queries.
 */
@Service
public class ChatLedgerStore implements MessageLedger, AttachmentIndex, FeedbackStore {

    private static final Logger log = LoggerFactory.getLogger(ChatLedgerStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String CREATE_MESSAGE_SQL = """
            CREATE TABLE IF NOT EXISTS MESSAGE_ (
              MESSAGE_ID_ TEXT PRIMARY KEY,
              SESSION_ID_ TEXT NOT NULL,
              USER_ID_ TEXT,
              ROLE_ TEXT NOT NULL,
              CONTENT_ TEXT NOT NULL DEFAULT '',
              CONTENT_SIGNATURE_ TEXT NOT NULL DEFAULT '',
              AGENT_ID_ TEXT,
              METADATA_JSON_ TEXT,
              CREATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_MESSAGE_SESSION_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_MESSAGE_SESSION_CREATED_AT_
              ON MESSAGE_(SESSION_ID_, CREATED_AT_)
            """;
    private static final String CREATE_ATTACHMENT_SQL = """
            CREATE TABLE IF NOT EXISTS ATTACHMENT_ (
              ATTACHMENT_ID_ TEXT PRIMARY KEY,
              MESSAGE_ID_ TEXT NOT NULL,
              FILE_NAME_ TEXT,
              FILE_SIZE_ INTEGER,
              CONTENT_TYPE_ TEXT,
              URL_ TEXT,
              CREATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_ATTACHMENT_MESSAGE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_ATTACHMENT_MESSAGE_ID_
              ON ATTACHMENT_(MESSAGE_ID_ COLLATE NOCASE)
            """;
    private static final String CREATE_FEEDBACK_SQL = """
            CREATE TABLE IF NOT EXISTS FEEDBACK_ (
              FEEDBACK_ID_ TEXT PRIMARY KEY,
              MESSAGE_ID_ TEXT NOT NULL,
              USER_ID_ TEXT NOT NULL,
              RATING_ TEXT NOT NULL,
              COMMENT_ TEXT,
              CREATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_FEEDBACK_UQ_SQL = """
            CREATE UNIQUE INDEX IF NOT EXISTS UQ_FEEDBACK_MESSAGE_USER_
              ON FEEDBACK_(MESSAGE_ID_ COLLATE NOCASE, USER_ID_)
            """;

    private final ObjectMapper objectMapper;
    private final LedgerProperties properties;
    private final Object lock = new Object();

    public ChatLedgerStore(ObjectMapper objectMapper, LedgerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void initializeDatabase() {
        synchronized (lock) {
            Path dbPath = SqliteFiles.resolve(properties.getSqliteFile());
            SqliteFiles.createParentDirectories(dbPath);
            try (Connection connection = SqliteFiles.open(dbPath);
                 Statement statement = connection.createStatement()) {
                statement.execute(CREATE_MESSAGE_SQL);
                statement.execute(CREATE_MESSAGE_SESSION_INDEX_SQL);
                statement.execute(CREATE_ATTACHMENT_SQL);
                statement.execute(CREATE_ATTACHMENT_MESSAGE_INDEX_SQL);
                statement.execute(CREATE_FEEDBACK_SQL);
                statement.execute(CREATE_FEEDBACK_UQ_SQL);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot initialize sqlite message ledger", ex);
            }
            log.info("Message ledger ready at {}", dbPath);
        }
    }

    public LocalMessage appendMessage(LocalMessage message, String userId) {
        if (message == null || !StringUtils.hasText(message.sessionId()) || message.role() == null) {
            throw new IllegalArgumentException("message must carry a session id and a role");
        }
        String messageId = StringUtils.hasText(message.id()) ? message.id().trim() : UUID.randomUUID().toString();
        Instant createdAt = message.createdAt() == null ? Instant.now() : message.createdAt();
        LocalMessage stored = new LocalMessage(
                messageId,
                message.sessionId().trim(),
                message.role(),
                message.content() == null ? "" : message.content(),
                createdAt,
                SqliteFiles.nullable(message.agentId()),
                message.metadata()
        );
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         INSERT INTO MESSAGE_(
                           MESSAGE_ID_, SESSION_ID_, USER_ID_, ROLE_, CONTENT_, CONTENT_SIGNATURE_,
                           AGENT_ID_, METADATA_JSON_, CREATED_AT_
                         ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                         """)) {
                statement.setString(1, stored.id());
                statement.setString(2, stored.sessionId());
                statement.setString(3, SqliteFiles.nullable(userId));
                statement.setString(4, stored.role().wireName());
                statement.setString(5, stored.content());
                statement.setString(6, ContentText.signature(stored.content()));
                statement.setString(7, stored.agentId());
                statement.setString(8, writeMetadata(stored.metadata()));
                statement.setLong(9, createdAt.toEpochMilli());
                statement.executeUpdate();
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot append message to ledger messageId=" + messageId, ex);
            }
        }
        return stored;
    }

    /**
     * Records the stream started for a message, once the orchestration call has been issued.
     */
    public boolean attachStreamId(String messageId, String streamId) {
        return putMetadata(messageId, LocalMessage.META_STREAM_ID, streamId);
    }

    public boolean attachRunId(String messageId, String runId) {
        return putMetadata(messageId, LocalMessage.META_RUN_ID, runId);
    }

    public Attachment addAttachment(String messageId, Attachment attachment) {
        if (!StringUtils.hasText(messageId) || attachment == null) {
            throw new IllegalArgumentException("messageId and attachment are required");
        }
        String attachmentId = StringUtils.hasText(attachment.attachmentId())
                ? attachment.attachmentId().trim()
                : UUID.randomUUID().toString();
        Attachment stored = new Attachment(attachmentId, attachment.fileName(), attachment.fileSize(),
                attachment.contentType(), attachment.url());
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         INSERT OR REPLACE INTO ATTACHMENT_(
                           ATTACHMENT_ID_, MESSAGE_ID_, FILE_NAME_, FILE_SIZE_, CONTENT_TYPE_, URL_, CREATED_AT_
                         ) VALUES (?, ?, ?, ?, ?, ?, ?)
                         """)) {
                statement.setString(1, attachmentId);
                statement.setString(2, messageId.trim());
                statement.setString(3, stored.fileName());
                if (stored.fileSize() == null) {
                    statement.setNull(4, Types.INTEGER);
                } else {
                    statement.setLong(4, stored.fileSize());
                }
                statement.setString(5, stored.contentType());
                statement.setString(6, stored.url());
                statement.setLong(7, System.currentTimeMillis());
                statement.executeUpdate();
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot store attachment for messageId=" + messageId, ex);
            }
        }
        return stored;
    }

    /**
     * One reaction per user and message; a second call replaces the first.
     */
    public Feedback saveFeedback(String messageId, String userId, String rating, String comment) {
        if (!StringUtils.hasText(messageId) || !StringUtils.hasText(userId) || !StringUtils.hasText(rating)) {
            throw new IllegalArgumentException("messageId, userId and rating are required");
        }
        Feedback feedback = new Feedback(UUID.randomUUID().toString(), rating.trim(), SqliteFiles.nullable(comment),
                Instant.now());
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try (PreparedStatement delete = connection.prepareStatement("""
                        DELETE FROM FEEDBACK_ WHERE MESSAGE_ID_ = ? COLLATE NOCASE AND USER_ID_ = ?
                        """)) {
                    delete.setString(1, messageId.trim());
                    delete.setString(2, userId.trim());
                    delete.executeUpdate();
                }
                try (PreparedStatement insert = connection.prepareStatement("""
                        INSERT INTO FEEDBACK_(FEEDBACK_ID_, MESSAGE_ID_, USER_ID_, RATING_, COMMENT_, CREATED_AT_)
                        VALUES (?, ?, ?, ?, ?, ?)
                        """)) {
                    insert.setString(1, feedback.feedbackId());
                    insert.setString(2, messageId.trim());
                    insert.setString(3, userId.trim());
                    insert.setString(4, feedback.rating());
                    insert.setString(5, feedback.comment());
                    insert.setLong(6, feedback.createdAt().toEpochMilli());
                    insert.executeUpdate();
                }
                connection.commit();
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot save feedback for messageId=" + messageId, ex);
            }
        }
        return feedback;
    }

    @Override
    public List<LocalMessage> listMessages(String sessionId, String userId) {
        if (!StringUtils.hasText(sessionId)) {
            return List.of();
        }
        String sql = StringUtils.hasText(userId)
                ? """
                  SELECT MESSAGE_ID_, SESSION_ID_, ROLE_, CONTENT_, AGENT_ID_, METADATA_JSON_, CREATED_AT_
                  FROM MESSAGE_
                  WHERE SESSION_ID_ = ? AND USER_ID_ = ?
                  ORDER BY CREATED_AT_ ASC, ROWID ASC
                  """
                : """
                  SELECT MESSAGE_ID_, SESSION_ID_, ROLE_, CONTENT_, AGENT_ID_, METADATA_JSON_, CREATED_AT_
                  FROM MESSAGE_
                  WHERE SESSION_ID_ = ?
                  ORDER BY CREATED_AT_ ASC, ROWID ASC
                  """;
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, sessionId.trim());
                if (StringUtils.hasText(userId)) {
                    statement.setString(2, userId.trim());
                }
                List<LocalMessage> messages = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        LocalMessage message = mapMessage(resultSet);
                        if (message != null) {
                            messages.add(message);
                        }
                    }
                }
                return messages;
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot list ledger messages for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public List<Attachment> listAttachments(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return List.of();
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT ATTACHMENT_ID_, FILE_NAME_, FILE_SIZE_, CONTENT_TYPE_, URL_
                         FROM ATTACHMENT_
                         WHERE MESSAGE_ID_ = ? COLLATE NOCASE
                         ORDER BY CREATED_AT_ ASC, ROWID ASC
                         """)) {
                statement.setString(1, messageId.trim());
                return readAttachments(statement);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot list attachments for messageId=" + messageId, ex);
            }
        }
    }

    @Override
    public List<Attachment> findByContentSignature(String sessionId, String role, String contentPrefix) {
        if (!StringUtils.hasText(sessionId) || !StringUtils.hasText(role) || !StringUtils.hasText(contentPrefix)) {
            return List.of();
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT A.ATTACHMENT_ID_, A.FILE_NAME_, A.FILE_SIZE_, A.CONTENT_TYPE_, A.URL_
                         FROM ATTACHMENT_ A
                         JOIN MESSAGE_ M ON M.MESSAGE_ID_ = A.MESSAGE_ID_ COLLATE NOCASE
                         WHERE M.SESSION_ID_ = ? AND M.ROLE_ = ? AND M.CONTENT_SIGNATURE_ = ?
                         ORDER BY A.CREATED_AT_ ASC, A.ROWID ASC
                         """)) {
                statement.setString(1, sessionId.trim());
                statement.setString(2, role.trim().toLowerCase(Locale.ROOT));
                statement.setString(3, ContentText.signature(contentPrefix));
                return readAttachments(statement);
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot look up attachments by content for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public Optional<Feedback> getFeedback(String messageId, String userId) {
        if (!StringUtils.hasText(messageId) || !StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                         SELECT FEEDBACK_ID_, RATING_, COMMENT_, CREATED_AT_
                         FROM FEEDBACK_
                         WHERE MESSAGE_ID_ = ? COLLATE NOCASE AND USER_ID_ = ?
                         ORDER BY CREATED_AT_ DESC
                         LIMIT 1
                         """)) {
                statement.setString(1, messageId.trim());
                statement.setString(2, userId.trim());
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new Feedback(
                            resultSet.getString("FEEDBACK_ID_"),
                            resultSet.getString("RATING_"),
                            SqliteFiles.nullable(resultSet.getString("COMMENT_")),
                            Instant.ofEpochMilli(resultSet.getLong("CREATED_AT_"))
                    ));
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot read feedback for messageId=" + messageId, ex);
            }
        }
    }

    private boolean putMetadata(String messageId, String key, String value) {
        if (!StringUtils.hasText(messageId) || !StringUtils.hasText(value)) {
            return false;
        }
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                Map<String, Object> metadata;
                try (PreparedStatement select = connection.prepareStatement("""
                        SELECT METADATA_JSON_ FROM MESSAGE_ WHERE MESSAGE_ID_ = ?
                        """)) {
                    select.setString(1, messageId.trim());
                    try (ResultSet resultSet = select.executeQuery()) {
                        if (!resultSet.next()) {
                            connection.rollback();
                            return false;
                        }
                        metadata = readMetadata(messageId, resultSet.getString("METADATA_JSON_"));
                    }
                }
                metadata.put(key, value.trim());
                try (PreparedStatement update = connection.prepareStatement("""
                        UPDATE MESSAGE_ SET METADATA_JSON_ = ? WHERE MESSAGE_ID_ = ?
                        """)) {
                    update.setString(1, writeMetadata(metadata));
                    update.setString(2, messageId.trim());
                    update.executeUpdate();
                }
                connection.commit();
                return true;
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot update metadata for messageId=" + messageId, ex);
            }
        }
    }

    private LocalMessage mapMessage(ResultSet resultSet) throws SQLException {
        String messageId = resultSet.getString("MESSAGE_ID_");
        Optional<MessageRole> role = MessageRole.from(resultSet.getString("ROLE_"));
        if (role.isEmpty()) {
            log.warn("Skip ledger row with unknown role messageId={}, role={}", messageId, resultSet.getString("ROLE_"));
            return null;
        }
        return new LocalMessage(
                messageId,
                resultSet.getString("SESSION_ID_"),
                role.get(),
                resultSet.getString("CONTENT_"),
                Instant.ofEpochMilli(resultSet.getLong("CREATED_AT_")),
                SqliteFiles.nullable(resultSet.getString("AGENT_ID_")),
                readMetadata(messageId, resultSet.getString("METADATA_JSON_"))
        );
    }

    private List<Attachment> readAttachments(PreparedStatement statement) throws SQLException {
        List<Attachment> attachments = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                long size = resultSet.getLong("FILE_SIZE_");
                Long fileSize = resultSet.wasNull() ? null : size;
                attachments.add(new Attachment(
                        resultSet.getString("ATTACHMENT_ID_"),
                        resultSet.getString("FILE_NAME_"),
                        fileSize,
                        resultSet.getString("CONTENT_TYPE_"),
                        resultSet.getString("URL_")
                ));
            }
        }
        return attachments;
    }

    private Map<String, Object> readMetadata(String messageId, String json) {
        if (!StringUtils.hasText(json)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> metadata = objectMapper.readValue(json, METADATA_TYPE);
            return metadata == null ? new LinkedHashMap<>() : metadata;
        } catch (JsonProcessingException ex) {
            log.warn("Ignore unreadable metadata messageId={}", messageId, ex);
            return new LinkedHashMap<>();
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("message metadata is not serializable", ex);
        }
    }

    private Connection openConnection() throws SQLException {
        return SqliteFiles.open(SqliteFiles.resolve(properties.getSqliteFile()));
    }
}
