package com.purchasingpower.codegraph.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.embedding.SparseVectorCodec;
import com.purchasingpower.codegraph.exception.GraphStorageException;
import com.purchasingpower.codegraph.model.embedding.CodeChunk;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.storage.EmbeddingIndexStore;
import com.purchasingpower.codegraph.storage.PersistedChunk;
import com.purchasingpower.codegraph.storage.PersistedEmbeddingIndex;
import com.purchasingpower.codegraph.storage.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores the embedding index as {@code embeddings.json} with sparse vectors.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileEmbeddingIndexStore implements EmbeddingIndexStore {

    private final StorageLayout layout;
    private final ObjectMapper objectMapper;

    @Override
    public void save(Path root, EmbeddingIndex index) {
        Path indexFile = layout.indexFile(root);
        PersistedEmbeddingIndex persisted = PersistedEmbeddingIndex.builder()
            .chunks(index.getChunks().stream().map(FileEmbeddingIndexStore::toPersisted).collect(Collectors.toList()))
            .vocabulary(index.getVocabulary())
            .idf(index.getIdf())
            .version(index.getVersion())
            .createdAt(index.getCreatedAt())
            .chunkCount(index.getChunkCount())
            .vocabularySize(index.getVocabularySize())
            .build();
        try {
            Files.createDirectories(layout.directory(root));
            objectMapper.writeValue(indexFile.toFile(), persisted);
            log.info("💾 Saved embedding index ({} chunks, {} terms) to {}",
                index.getChunkCount(), index.getVocabularySize(), indexFile);
        } catch (IOException e) {
            throw new GraphStorageException(indexFile, "Failed to save embedding index", e);
        }
    }

    @Override
    public Optional<EmbeddingIndex> load(Path root) {
        Path indexFile = layout.indexFile(root);
        if (!Files.isRegularFile(indexFile)) {
            return Optional.empty();
        }
        PersistedEmbeddingIndex persisted;
        try {
            persisted = objectMapper.readValue(indexFile.toFile(), PersistedEmbeddingIndex.class);
        } catch (IOException e) {
            throw new GraphStorageException(indexFile, "Failed to load embedding index", e);
        }

        List<String> vocabulary = persisted.getVocabulary() != null ? persisted.getVocabulary() : List.of();
        int size = vocabulary.size();
        List<CodeChunk> chunks = persisted.getChunks() == null ? List.of() : persisted.getChunks().stream()
            .map(chunk -> CodeChunk.builder()
                .id(chunk.getId())
                .filePath(chunk.getFilePath())
                .kind(chunk.getType())
                .name(chunk.getName())
                .content(chunk.getContent())
                .startLine(chunk.getStartLine())
                .endLine(chunk.getEndLine())
                .embedding(SparseVectorCodec.decompress(chunk.getEmbedding(), size))
                .build())
            .collect(Collectors.toList());

        log.debug("📂 Loaded embedding index with {} chunks from {}", chunks.size(), indexFile);
        return Optional.of(EmbeddingIndex.builder()
            .chunks(chunks)
            .vocabulary(List.copyOf(vocabulary))
            .idf(persisted.getIdf() != null ? persisted.getIdf() : new double[size])
            .version(persisted.getVersion())
            .createdAt(persisted.getCreatedAt())
            .build());
    }

    @Override
    public boolean exists(Path root) {
        return Files.isRegularFile(layout.indexFile(root));
    }

    @Override
    public void delete(Path root) {
        try {
            Files.deleteIfExists(layout.indexFile(root));
        } catch (IOException e) {
            throw new GraphStorageException(layout.indexFile(root), "Failed to delete embedding index", e);
        }
    }

    @Override
    public boolean isStale(Path root) {
        Path graphFile = layout.graphFile(root);
        Path indexFile = layout.indexFile(root);
        if (!Files.isRegularFile(graphFile) || !Files.isRegularFile(indexFile)) {
            return true;
        }
        try {
            return Files.getLastModifiedTime(graphFile).compareTo(Files.getLastModifiedTime(indexFile)) > 0;
        } catch (IOException e) {
            log.warn("⚠️ Cannot compare modification times under {}: {}", layout.directory(root), e.getMessage());
            return true;
        }
    }

    private static PersistedChunk toPersisted(CodeChunk chunk) {
        return PersistedChunk.builder()
            .id(chunk.getId())
            .filePath(chunk.getFilePath())
            .type(chunk.getKind())
            .name(chunk.getName())
            .content(chunk.getContent())
            .startLine(chunk.getStartLine())
            .endLine(chunk.getEndLine())
            .embedding(SparseVectorCodec.compress(chunk.getEmbedding()))
            .build();
    }
}
