package com.purchasingpower.codegraph.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Query Expander Tests")
class QueryExpanderTest {

    @Test
    @DisplayName("Should split on separators and drop one-letter words")
    void splitsQuery() {
        assertEquals(List.of("order", "total"), QueryExpander.expand("Order.total"));
        assertEquals(List.of("payment"), QueryExpander.expand("a payment/x"));
        assertTrue(QueryExpander.expand("  ").isEmpty());
        assertTrue(QueryExpander.expand(null).isEmpty());
    }

    @Test
    @DisplayName("Should add synonyms after the original word")
    void expandsSynonyms() {
        List<String> expanded = QueryExpander.expand("config");

        assertEquals("config", expanded.get(0));
        assertThat(expanded).contains("configuration", "settings", "properties").doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should include entries that list the word as a synonym")
    void reverseSynonyms() {
        assertThat(QueryExpander.expand("jwt")).contains("jwt", "auth", "session", "token");
    }
}
