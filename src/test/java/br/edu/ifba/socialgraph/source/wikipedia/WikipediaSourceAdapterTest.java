package br.edu.ifba.socialgraph.source.wikipedia;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.stream.Collectors;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.source.DiscoveredRelationship;
import br.edu.ifba.socialgraph.source.EntityNotFoundException;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;

@QuarkusTest
class WikipediaSourceAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    WikipediaSourceAdapter adapter;

    @InjectMock
    @RestClient
    WikipediaApiClient client;

    private static JsonNode json(String body) throws JsonProcessingException {
        return MAPPER.readTree(body);
    }

    @Test
    void testNormalizesTitles() {
        assertEquals("Graph theory", WikipediaSourceAdapter.normalizeTitle("https://en.wikipedia.org/wiki/Graph_theory"));
        assertEquals("Graph theory", WikipediaSourceAdapter.normalizeTitle("  Graph_theory "));
        assertThrows(IllegalArgumentException.class, () -> WikipediaSourceAdapter.normalizeTitle("_"));
    }

    @Nested
    @DisplayName("Resolving pages")
    class Resolve {

        @Test
        @DisplayName("should key a page by its page id")
        void testResolvePage() throws Exception {
            when(client.getPage("Graph theory")).thenReturn(json(
                "{\"query\":{\"pages\":[{\"pageid\":12401,\"ns\":0,\"title\":\"Graph theory\","
                    + "\"extract\":\"Graph theory is the study of graphs.\","
                    + "\"fullurl\":\"https://en.wikipedia.org/wiki/Graph_theory\",\"length\":54321}]}}"));

            EntityRecord page = adapter.resolveEntity("Graph_theory");

            assertEquals(SourceType.WIKIPEDIA, page.getSource());
            assertEquals(EntityType.PAGE, page.getEntityType());
            assertEquals("12401", page.getEntityId());
            assertEquals("Graph theory", page.getDisplayName());
            assertEquals("https://en.wikipedia.org/wiki/Graph_theory", page.getMetadata().get("url"));
            assertEquals(54321L, page.getMetadata().get("length"));
        }

        @Test
        @DisplayName("should report missing pages as not found")
        void testMissingPage() throws Exception {
            when(client.getPage("Nope")).thenReturn(json(
                "{\"query\":{\"pages\":[{\"ns\":0,\"title\":\"Nope\",\"missing\":true}]}}"));

            assertThrows(EntityNotFoundException.class, () -> adapter.resolveEntity("Nope"));
        }
    }

    @Nested
    @DisplayName("Expanding pages")
    class Expand {

        @Test
        @DisplayName("should link to article pages in title order and to visible categories")
        void testExpandPage() throws Exception {
            when(client.getLinkedPages(eq("Graph theory"), anyInt())).thenReturn(json(
                "{\"query\":{\"pages\":{"
                    + "\"3\":{\"pageid\":3,\"ns\":0,\"title\":\"Vertex\"},"
                    + "\"1\":{\"pageid\":1,\"ns\":0,\"title\":\"Edge\"},"
                    + "\"7\":{\"pageid\":7,\"ns\":10,\"title\":\"Template:Math\"},"
                    + "\"-1\":{\"ns\":0,\"title\":\"Red link\",\"missing\":true}}}}"));
            when(client.getCategories(eq("Graph theory"), anyInt())).thenReturn(json(
                "{\"query\":{\"pages\":[{\"pageid\":12401,\"title\":\"Graph theory\","
                    + "\"categories\":[{\"ns\":14,\"title\":\"Category:Graph theory\"}]}]}}"));
            EntityRecord page = EntityRecord.builder()
                .source(SourceType.WIKIPEDIA)
                .entityType(EntityType.PAGE)
                .entityId("12401")
                .displayName("Graph theory")
                .putMetadata("title", "Graph theory")
                .build();

            List<DiscoveredRelationship> relationships = adapter.fetchRelationships(page);

            assertEquals(List.of("Edge", "Vertex", "Graph theory"), relationships.stream()
                .map(r -> r.to().getDisplayName()).collect(Collectors.toList()));
            assertEquals(WikipediaSourceAdapter.LINKS_TO, relationships.get(0).relationshipType());
            DiscoveredRelationship category = relationships.get(2);
            assertEquals(WikipediaSourceAdapter.IN_CATEGORY, category.relationshipType());
            assertEquals(EntityType.CATEGORY, category.to().getEntityType());
            assertEquals("graph theory", category.to().getEntityId());
            assertTrue(relationships.stream().allMatch(r -> r.from() == page));
        }

        @Test
        @DisplayName("should not expand categories")
        void testCategoryIsLeaf() {
            EntityRecord category = EntityRecord.builder()
                .source(SourceType.WIKIPEDIA)
                .entityType(EntityType.CATEGORY)
                .entityId("graph theory")
                .build();

            assertTrue(adapter.fetchRelationships(category).isEmpty());
        }
    }
}
