package com.purchasingpower.codegraph.embedding.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.embedding.ChunkContentBuilder;
import com.purchasingpower.codegraph.embedding.CodeTokenizer;
import com.purchasingpower.codegraph.embedding.EmbeddingIndexService;
import com.purchasingpower.codegraph.embedding.VectorMath;
import com.purchasingpower.codegraph.model.embedding.CodeChunk;
import com.purchasingpower.codegraph.model.embedding.EmbeddingIndex;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.KnowledgeGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Two-pass TF-IDF indexer.
 *
 * <p>Pass one tokenizes every document and counts document frequencies (in
 * parallel, merged before IDF is computed). Pass two emits
 * {@code tf * ln(N / df)} vectors, normalized to unit length.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TfIdfEmbeddingIndexService implements EmbeddingIndexService {

    private final CodeGraphProperties properties;

    @Override
    public EmbeddingIndex buildIndex(KnowledgeGraph graph) {
        long start = System.currentTimeMillis();
        List<GraphNode> nodes = new ArrayList<>(graph.getNodes().values());
        ChunkContentBuilder contentBuilder = new ChunkContentBuilder(graph, properties.getSearch().getRelatedNodeLimit());
        List<String> contents = nodes.stream().map(contentBuilder::build).collect(Collectors.toList());

        // Pass 1: tokens and document frequencies
        List<List<String>> documents = contents.parallelStream()
            .map(CodeTokenizer::tokenize)
            .collect(Collectors.toList());
        Map<String, Integer> documentFrequency = documents.parallelStream()
            .flatMap(tokens -> new HashSet<>(tokens).stream())
            .collect(Collectors.toConcurrentMap(term -> term, term -> 1, Integer::sum));

        List<String> vocabulary = new ArrayList<>(new TreeSet<>(documentFrequency.keySet()));
        int documentCount = documents.size();
        double[] idf = new double[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            idf[i] = Math.log((double) documentCount / documentFrequency.get(vocabulary.get(i)));
        }

        // Pass 2: vectors
        Map<String, Integer> positions = EmbeddingIndex.positionsOf(vocabulary);
        List<double[]> vectors = IntStream.range(0, documentCount)
            .parallel()
            .mapToObj(i -> vectorize(documents.get(i), positions, idf))
            .collect(Collectors.toList());

        List<CodeChunk> chunks = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            chunks.add(CodeChunk.builder()
                .id(node.getId())
                .filePath(node.getFilePath())
                .kind(node.getKind())
                .name(node.getName())
                .content(contents.get(i))
                .startLine(node.getLineStart())
                .endLine(node.getLineEnd())
                .embedding(vectors.get(i))
                .build());
        }

        log.info("✅ Built embedding index: {} chunks, vocabulary of {} terms in {}ms",
            chunks.size(), vocabulary.size(), System.currentTimeMillis() - start);
        return EmbeddingIndex.builder()
            .chunks(List.copyOf(chunks))
            .vocabulary(List.copyOf(vocabulary))
            .idf(idf)
            .version(EmbeddingIndex.CURRENT_VERSION)
            .createdAt(Instant.now())
            .build();
    }

    @Override
    public double[] embed(String text, EmbeddingIndex index) {
        return vectorize(CodeTokenizer.tokenize(text), index.getTermPositions(), index.getIdf());
    }

    static double[] vectorize(List<String> tokens, Map<String, Integer> positions, double[] idf) {
        double[] vector = new double[idf.length];
        if (tokens.isEmpty()) {
            return vector;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        double length = tokens.size();
        counts.forEach((term, count) -> {
            Integer position = positions.get(term);
            if (position != null) {
                vector[position] = (count / length) * idf[position];
            }
        });
        return VectorMath.normalize(vector);
    }
}
