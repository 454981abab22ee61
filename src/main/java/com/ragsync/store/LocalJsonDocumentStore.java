package com.ragsync.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class LocalJsonDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonDocumentStore.class);

    private final Path path;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private Map<String, DocumentRecord> documents = new TreeMap<>();
    private Map<String, List<ChunkRecord>> chunks = new HashMap<>();

    private LocalJsonDocumentStore(Path path) {
        this.path = path;
    }

    public static LocalJsonDocumentStore open(Path path) {
        LocalJsonDocumentStore store = new LocalJsonDocumentStore(path);
        if (!Files.exists(path)) {
            return store;
        }
        try {
            Snapshot snapshot = store.objectMapper.readValue(path.toFile(), Snapshot.class);
            for (DocumentRecord document : snapshot.documents()) {
                store.documents.put(document.id(), document);
            }
            for (ChunkRecord chunk : snapshot.chunks()) {
                store.chunks.computeIfAbsent(chunk.documentId(), unused -> new ArrayList<>()).add(chunk);
            }
        } catch (IOException e) {
            throw new StoreException("Unable to read store file " + path + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} documents from {}", store.documents.size(), path);
        return store;
    }

    @Override
    public synchronized Map<String, String> loadContentHashes(Collection<String> documentIds) {
        Map<String, String> hashes = new HashMap<>();
        for (String id : documentIds) {
            DocumentRecord document = documents.get(id);
            if (document != null && document.active()) {
                hashes.put(id, document.contentHash());
            }
        }
        return hashes;
    }

    @Override
    public synchronized Map<String, String> loadActiveDocuments(String source) {
        Map<String, String> active = new HashMap<>();
        documents.values().stream()
                .filter(document -> document.active() && document.source().equals(source))
                .forEach(document -> active.put(document.id(), document.url()));
        return active;
    }

    @Override
    public synchronized <T> T inTransaction(TransactionWork<T> work) {
        LocalTransaction transaction = new LocalTransaction(new TreeMap<>(documents), new HashMap<>(chunks));
        T result;
        try {
            result = work.execute(transaction);
        } catch (StoreException e) {
            log.error("Store transaction rolled back: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Store transaction rolled back: {}", e.getMessage());
            throw new StoreException("Transaction failed and was rolled back: " + e.getMessage(), e);
        }
        persist(transaction.documents, transaction.chunks);
        documents = transaction.documents;
        chunks = transaction.chunks;
        return result;
    }

    @Override
    public synchronized Optional<DocumentRecord> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public synchronized List<ChunkRecord> loadChunks(String documentId) {
        return chunks.getOrDefault(documentId, List.of()).stream()
                .sorted(Comparator.comparingInt(ChunkRecord::chunkIndex))
                .toList();
    }

    @Override
    public void close() {
    }

    private void persist(Map<String, DocumentRecord> newDocuments, Map<String, List<ChunkRecord>> newChunks) {
        List<ChunkRecord> allChunks = new ArrayList<>();
        new TreeMap<>(newChunks).values().forEach(allChunks::addAll);
        Snapshot snapshot = new Snapshot(new ArrayList<>(newDocuments.values()), allChunks);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Unable to write store file " + path + ": " + e.getMessage(), e);
        }
    }

    public record Snapshot(List<DocumentRecord> documents, List<ChunkRecord> chunks) {

        public Snapshot {
            documents = documents == null ? List.of() : documents;
            chunks = chunks == null ? List.of() : chunks;
        }
    }

    private static final class LocalTransaction implements StoreTransaction {
        private final Map<String, DocumentRecord> documents;
        private final Map<String, List<ChunkRecord>> chunks;

        private LocalTransaction(Map<String, DocumentRecord> documents, Map<String, List<ChunkRecord>> chunks) {
            this.documents = documents;
            this.chunks = chunks;
        }

        @Override
        public boolean upsertDocument(DocumentRecord document, boolean force) {
            DocumentRecord existing = documents.get(document.id());
            if (!force && existing != null && existing.active()
                    && existing.contentHash().equals(document.contentHash())) {
                return false;
            }
            documents.put(document.id(), new DocumentRecord(
                    document.id(),
                    document.source(),
                    document.title(),
                    document.url(),
                    document.contentHash(),
                    document.retrievedAt(),
                    true));
            return true;
        }

        @Override
        public int deleteChunks(String documentId) {
            List<ChunkRecord> removed = chunks.remove(documentId);
            return removed == null ? 0 : removed.size();
        }

        @Override
        public int insertChunks(List<ChunkRecord> newChunks) {
            Map<String, List<ChunkRecord>> updated = new HashMap<>();
            Map<String, Set<Integer>> indexes = new HashMap<>();
            for (ChunkRecord chunk : newChunks) {
                String documentId = chunk.documentId();
                if (!documents.containsKey(documentId)) {
                    throw new StoreException("Chunk references unknown document " + documentId);
                }
                List<ChunkRecord> documentChunks = updated.computeIfAbsent(
                        documentId, id -> new ArrayList<>(chunks.getOrDefault(id, List.of())));
                Set<Integer> taken = indexes.computeIfAbsent(documentId, id -> documentChunks.stream()
                        .map(ChunkRecord::chunkIndex)
                        .collect(Collectors.toCollection(HashSet::new)));
                if (!taken.add(chunk.chunkIndex())) {
                    throw new StoreException("Duplicate chunk " + documentId + "#" + chunk.chunkIndex());
                }
                documentChunks.add(chunk);
            }
            chunks.putAll(updated);
            return newChunks.size();
        }

        @Override
        public int deactivate(Collection<String> documentIds) {
            int changed = 0;
            for (String id : documentIds) {
                DocumentRecord document = documents.get(id);
                if (document != null && document.active()) {
                    documents.put(id, new DocumentRecord(
                            document.id(),
                            document.source(),
                            document.title(),
                            document.url(),
                            document.contentHash(),
                            document.retrievedAt(),
                            false));
                    changed++;
                }
            }
            return changed;
        }
    }
}
