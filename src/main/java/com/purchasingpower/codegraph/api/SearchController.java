package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.core.SearchMode;
import com.purchasingpower.codegraph.exception.GraphNotFoundException;
import com.purchasingpower.codegraph.exception.IndexNotFoundException;
import com.purchasingpower.codegraph.search.SearchOutcome;
import com.purchasingpower.codegraph.search.impl.DefaultSearchOptions;
import com.purchasingpower.codegraph.service.KnowledgeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Locale;

/**
 * REST controller for search API.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final KnowledgeService knowledgeService;
    private final CodeGraphProperties properties;

    /**
     * Keyword, semantic or hybrid search.
     *
     * POST /api/v1/search
     */
    @PostMapping
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        try {
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("Query is required"));
            }
            if (request.getRootPath() == null || request.getRootPath().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("Root path is required"));
            }
            if (request.getLimit() != null && request.getLimit() < 1) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("Limit must be positive"));
            }

            SearchMode mode = request.getMode() != null
                ? SearchMode.valueOf(request.getMode().toUpperCase(Locale.ROOT))
                : properties.getSearch().getDefaultMode();

            log.info("Search: {} ({})", request.getQuery(), mode);

            DefaultSearchOptions options = DefaultSearchOptions.builder()
                .mode(mode)
                .limit(request.getLimit() != null ? request.getLimit() : properties.getSearch().getDefaultLimit())
                .build();

            SearchOutcome outcome = knowledgeService.search(Path.of(request.getRootPath()), request.getQuery(), options);
            return ResponseEntity.ok(SearchResponse.success(outcome));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                .body(SearchResponse.error("Invalid search request: " + e.getMessage()));
        } catch (GraphNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(SearchResponse.error(e.getMessage()));
        } catch (IndexNotFoundException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(SearchResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Search failed", e);
            return ResponseEntity.internalServerError()
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }
}
