package com.ragsync.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgvector.PGvector;

public class JdbcDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentStore.class);
    private static final int ID_LOOKUP_PAGE_SIZE = 1000;

    static final String UPSERT_DOCUMENT = """
            insert into documents (id, source, title, url, content_hash, retrieved_at, is_active)
            values (?, ?, ?, ?, ?, ?, true)
            on conflict (id) do update set
              source = excluded.source,
              title = excluded.title,
              url = excluded.url,
              content_hash = excluded.content_hash,
              retrieved_at = excluded.retrieved_at,
              is_active = true
            """;
    static final String ONLY_IF_CHANGED = """
            where documents.content_hash is distinct from excluded.content_hash
               or not documents.is_active
            """;
    static final String DELETE_CHUNKS = "delete from chunks where doc_id = ?";
    static final String INSERT_CHUNK = """
            insert into chunks (doc_id, chunk_index, content, content_hash, embedding)
            values (?, ?, ?, ?, ?)
            """;
    static final String SELECT_HASHES = "select id, content_hash from documents where id = any(?) and is_active";
    static final String SELECT_ACTIVE = "select id, url from documents where source = ? and is_active";
    static final String DEACTIVATE = "update documents set is_active = false where id = any(?) and is_active";
    static final String SELECT_DOCUMENT = """
            select id, source, title, url, content_hash, retrieved_at, is_active
            from documents where id = ?
            """;
    static final String SELECT_CHUNKS = """
            select doc_id, chunk_index, content, content_hash, embedding::text as embedding
            from chunks where doc_id = ? order by chunk_index
            """;

    private final Connection connection;

    public JdbcDocumentStore(Connection connection) {
        this.connection = connection;
    }

    public static JdbcDocumentStore connect(String jdbcUrl, Properties properties) {
        try {
            return new JdbcDocumentStore(DriverManager.getConnection(jdbcUrl, properties));
        } catch (SQLException e) {
            throw new StoreException("Unable to connect to " + redact(jdbcUrl) + ": " + e.getMessage(), e);
        }
    }

    public void initializeSchema() {
        String script;
        try (InputStream in = JdbcDocumentStore.class.getResourceAsStream("/schema.sql")) {
            if (in == null) {
                throw new StoreException("schema.sql is missing from the classpath");
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Unable to read schema.sql", e);
        }
        inTransaction(transaction -> {
            try (Statement statement = connection.createStatement()) {
                for (String sql : script.split(";")) {
                    if (!sql.isBlank()) {
                        statement.execute(sql);
                    }
                }
            } catch (SQLException e) {
                throw new StoreException("Schema initialization failed: " + e.getMessage(), e);
            }
            return null;
        });
        log.info("Store schema initialized");
    }

    @Override
    public Map<String, String> loadContentHashes(Collection<String> documentIds) {
        Map<String, String> hashes = new HashMap<>();
        List<String> ids = new ArrayList<>(documentIds);
        try (PreparedStatement statement = connection.prepareStatement(SELECT_HASHES)) {
            for (int start = 0; start < ids.size(); start += ID_LOOKUP_PAGE_SIZE) {
                List<String> page = ids.subList(start, Math.min(ids.size(), start + ID_LOOKUP_PAGE_SIZE));
                Array array = connection.createArrayOf("text", page.toArray());
                statement.setArray(1, array);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        hashes.put(rs.getString("id"), rs.getString("content_hash"));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Unable to load stored content hashes: " + e.getMessage(), e);
        }
        return hashes;
    }

    @Override
    public Map<String, String> loadActiveDocuments(String source) {
        Map<String, String> active = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_ACTIVE)) {
            statement.setString(1, source);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    active.put(rs.getString("id"), rs.getString("url"));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Unable to load active documents for source " + source + ": " + e.getMessage(), e);
        }
        return active;
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreException("Unable to begin transaction: " + e.getMessage(), e);
        }
        try {
            T result = work.execute(new JdbcTransaction());
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            rollback(e);
            if (e instanceof StoreException) {
                throw (StoreException) e;
            }
            throw new StoreException("Transaction failed and was rolled back: " + e.getMessage(), e);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("Unable to restore autocommit: {}", e.getMessage());
            }
        }
    }

    @Override
    public Optional<DocumentRecord> findDocument(String documentId) {
        try (PreparedStatement statement = connection.prepareStatement(SELECT_DOCUMENT)) {
            statement.setString(1, documentId);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp retrievedAt = rs.getTimestamp("retrieved_at");
                return Optional.of(new DocumentRecord(
                        rs.getString("id"),
                        rs.getString("source"),
                        rs.getString("title"),
                        rs.getString("url"),
                        rs.getString("content_hash"),
                        retrievedAt == null ? null : retrievedAt.toInstant(),
                        rs.getBoolean("is_active")));
            }
        } catch (SQLException e) {
            throw new StoreException("Unable to load document " + documentId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ChunkRecord> loadChunks(String documentId) {
        List<ChunkRecord> chunks = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(SELECT_CHUNKS)) {
            statement.setString(1, documentId);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    chunks.add(new ChunkRecord(
                            rs.getString("doc_id"),
                            rs.getInt("chunk_index"),
                            rs.getString("content"),
                            rs.getString("content_hash"),
                            new PGvector(rs.getString("embedding")).toArray()));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Unable to load chunks for " + documentId + ": " + e.getMessage(), e);
        }
        return chunks;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Unable to close store connection: {}", e.getMessage());
        }
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
            log.error("Store transaction rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Store rollback failed: {}", e.getMessage());
        }
    }

    static String redact(String jdbcUrl) {
        return jdbcUrl.replaceAll("(?i)(password=)[^&]*", "$1***");
    }

    private final class JdbcTransaction implements StoreTransaction {

        @Override
        public boolean upsertDocument(DocumentRecord document, boolean force) {
            String sql = force ? UPSERT_DOCUMENT : UPSERT_DOCUMENT + ONLY_IF_CHANGED;
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, document.id());
                statement.setString(2, document.source());
                statement.setString(3, document.title());
                statement.setString(4, document.url());
                statement.setString(5, document.contentHash());
                statement.setTimestamp(6, Timestamp.from(document.retrievedAt()));
                return statement.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new StoreException("Upsert of document " + document.id() + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public int deleteChunks(String documentId) {
            try (PreparedStatement statement = connection.prepareStatement(DELETE_CHUNKS)) {
                statement.setString(1, documentId);
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Deleting chunks of " + documentId + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public int insertChunks(List<ChunkRecord> chunks) {
            if (chunks.isEmpty()) {
                return 0;
            }
            try (PreparedStatement statement = connection.prepareStatement(INSERT_CHUNK)) {
                for (ChunkRecord chunk : chunks) {
                    statement.setString(1, chunk.documentId());
                    statement.setInt(2, chunk.chunkIndex());
                    statement.setString(3, chunk.content());
                    statement.setString(4, chunk.contentHash());
                    statement.setObject(5, new PGvector(chunk.embedding()));
                    statement.addBatch();
                }
                statement.executeBatch();
                return chunks.size();
            } catch (SQLException e) {
                throw new StoreException("Inserting chunks of " + chunks.get(0).documentId() + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public int deactivate(Collection<String> documentIds) {
            if (documentIds.isEmpty()) {
                return 0;
            }
            try (PreparedStatement statement = connection.prepareStatement(DEACTIVATE)) {
                statement.setArray(1, connection.createArrayOf("text", documentIds.toArray()));
                return statement.executeUpdate();
            } catch (SQLException e) {
                throw new StoreException("Deactivating documents failed: " + e.getMessage(), e);
            }
        }
    }
}
