package br.edu.ifba.socialgraph.source.reddit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;

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
class RedditSourceAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    RedditSourceAdapter adapter;

    @InjectMock
    @RestClient
    RedditApiClient client;

    private static JsonNode json(String body) throws JsonProcessingException {
        return MAPPER.readTree(body);
    }

    private static String listing(String... posts) {
        StringBuilder children = new StringBuilder();
        for (String post : posts) {
            if (children.length() > 0) {
                children.append(',');
            }
            children.append("{\"kind\":\"t3\",\"data\":").append(post).append('}');
        }
        return "{\"kind\":\"Listing\",\"data\":{\"children\":[" + children + "]}}";
    }

    @Test
    void testParsesReferences() {
        assertEquals(new RedditSourceAdapter.Reference(EntityType.COMMUNITY, "java"),
            RedditSourceAdapter.parseReference("r/Java"));
        assertEquals(new RedditSourceAdapter.Reference(EntityType.COMMUNITY, "java"),
            RedditSourceAdapter.parseReference("https://www.reddit.com/r/java/"));
        assertEquals(new RedditSourceAdapter.Reference(EntityType.USER, "spez"),
            RedditSourceAdapter.parseReference("u/spez"));
        assertThrows(IllegalArgumentException.class, () -> RedditSourceAdapter.parseReference("r/"));
    }

    @Nested
    @DisplayName("Resolving references")
    class Resolve {

        @Test
        @DisplayName("should resolve a community")
        void testResolveCommunity() throws Exception {
            when(client.getCommunity(eq("java"), anyString())).thenReturn(json(
                "{\"kind\":\"t5\",\"data\":{\"display_name\":\"java\",\"subscribers\":300000}}"));

            EntityRecord entity = adapter.resolveEntity("r/java");

            assertEquals(SourceType.REDDIT, entity.getSource());
            assertEquals(EntityType.COMMUNITY, entity.getEntityType());
            assertEquals("java", entity.getEntityId());
            assertEquals("r/java", entity.getDisplayName());
            assertEquals(300000L, entity.getMetadata().get("subscribers"));
        }

        @Test
        @DisplayName("should treat a payload of the wrong kind as not found")
        void testWrongKind() throws Exception {
            when(client.getUser(eq("nobody"), anyString())).thenReturn(json("{\"kind\":\"Listing\",\"data\":{}}"));

            assertThrows(EntityNotFoundException.class, () -> adapter.resolveEntity("u/nobody"));
        }
    }

    @Nested
    @DisplayName("Expanding entities")
    class Expand {

        @Test
        @DisplayName("should link each distinct author to the community once")
        void testExpandCommunity() throws Exception {
            when(client.getTopPosts(eq("java"), anyInt(), eq("week"), anyString())).thenReturn(json(listing(
                "{\"author\":\"Alice\",\"score\":250,\"title\":\"first\",\"id\":\"p1\"}",
                "{\"author\":\"[deleted]\",\"score\":90}",
                "{\"author\":\"bob\",\"score\":30}",
                "{\"author\":\"alice\",\"score\":10}")));
            EntityRecord java = EntityRecord.builder()
                .source(SourceType.REDDIT).entityType(EntityType.COMMUNITY).entityId("java").build();

            List<DiscoveredRelationship> relationships = adapter.fetchRelationships(java);

            assertEquals(2, relationships.size());
            DiscoveredRelationship alice = relationships.get(0);
            assertEquals("alice", alice.from().getEntityId());
            assertSame(java, alice.to());
            assertEquals(RedditSourceAdapter.POSTS_IN, alice.relationshipType());
            assertEquals(1.0, alice.weight(), 1e-9);
            assertEquals(2L, alice.metadata().get("post_count"));
            assertEquals("first", alice.metadata().get("post_title"));
            assertEquals(0.3, relationships.get(1).weight(), 1e-9);
        }

        @Test
        @DisplayName("should link a user to the communities they post in most")
        void testExpandUser() throws Exception {
            when(client.getSubmittedPosts(eq("alice"), anyInt(), anyString())).thenReturn(json(listing(
                "{\"subreddit\":\"Kotlin\"}",
                "{\"subreddit\":\"java\"}",
                "{\"subreddit\":\"Java\"}")));
            EntityRecord alice = EntityRecord.builder()
                .source(SourceType.REDDIT).entityType(EntityType.USER).entityId("alice").build();

            List<DiscoveredRelationship> relationships = adapter.fetchRelationships(alice);

            assertEquals(2, relationships.size());
            assertEquals("java", relationships.get(0).to().getEntityId());
            assertEquals(0.2, relationships.get(0).weight(), 1e-9);
            assertEquals("kotlin", relationships.get(1).to().getEntityId());
            assertTrue(relationships.stream().allMatch(r -> r.from() == alice));
        }
    }
}
