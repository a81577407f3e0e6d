package br.edu.ifba.socialgraph.source.reddit;

import static br.edu.ifba.socialgraph.source.JsonPayloads.copy;
import static br.edu.ifba.socialgraph.source.JsonPayloads.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.databind.JsonNode;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.source.DiscoveredRelationship;
import br.edu.ifba.socialgraph.source.EntityNotFoundException;
import br.edu.ifba.socialgraph.source.SourceAdapter;
import br.edu.ifba.socialgraph.source.SourceRequestExecutor;
import br.edu.ifba.socialgraph.source.SourcesConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Walks Reddit communities and the users posting in them.
 *
 * <p>References: {@code r/name} or a bare name for a community, {@code u/name} for a user.
 * Every edge is {@code posts_in} from a user to a community.</p>
 */
@ApplicationScoped
public class RedditSourceAdapter implements SourceAdapter {

    private static final Logger LOG = Logger.getLogger(RedditSourceAdapter.class);

    static final String POSTS_IN = "posts_in";
    static final String DELETED_AUTHOR = "[deleted]";

    private static final String TOP_TIMEFRAME = "week";

    private final RedditApiClient client;
    private final SourceRequestExecutor executor;
    private final SourcesConfig.RedditConfig config;

    @Inject
    public RedditSourceAdapter(@RestClient RedditApiClient client, SourceRequestExecutor executor,
            SourcesConfig config) {
        this.client = client;
        this.executor = executor;
        this.config = config.reddit();
    }

    @Override
    public SourceType source() {
        return SourceType.REDDIT;
    }

    @Override
    public @NotNull EntityRecord resolveEntity(@NotNull String reference) {
        Reference ref = parseReference(reference);
        if (ref.type() == EntityType.USER) {
            JsonNode json = call("reddit.getUser", ref.name(), () -> client.getUser(ref.name(), config.userAgent()));
            return toUser(requireThing(json, "t2", reference));
        }
        JsonNode json = call("reddit.getCommunity", ref.name(),
            () -> client.getCommunity(ref.name(), config.userAgent()));
        return toCommunity(requireThing(json, "t5", reference));
    }

    @Override
    public @NotNull List<DiscoveredRelationship> fetchRelationships(@NotNull EntityRecord entity) {
        switch (entity.getEntityType()) {
            case COMMUNITY:
                return expandCommunity(entity);
            case USER:
                return expandUser(entity);
            default:
                return List.of();
        }
    }

    private List<DiscoveredRelationship> expandCommunity(EntityRecord community) {
        String name = community.getEntityId();
        JsonNode listing = call("reddit.getTopPosts", name,
            () -> client.getTopPosts(name, config.postsPerCommunity(), TOP_TIMEFRAME, config.userAgent()));

        // first (highest scoring) post per author wins; later ones only bump the count
        Map<String, AuthorActivity> byAuthor = new LinkedHashMap<>();
        for (JsonNode post : children(listing)) {
            String author = text(post, "author");
            if (author == null || DELETED_AUTHOR.equals(author)) {
                continue;
            }
            byAuthor.computeIfAbsent(author.toLowerCase(Locale.ROOT), key -> new AuthorActivity(author, post))
                .postCount++;
        }

        List<DiscoveredRelationship> result = new ArrayList<>(byAuthor.size());
        for (AuthorActivity activity : byAuthor.values()) {
            long score = activity.topPost.path("score").asLong(0);
            Map<String, Object> meta = new LinkedHashMap<>();
            copy(activity.topPost, "title", meta, "post_title");
            copy(activity.topPost, "id", meta, "post_id");
            meta.put("score", score);
            meta.put("post_count", activity.postCount);
            result.add(DiscoveredRelationship.incoming(community, userStub(activity.author), POSTS_IN,
                scoreWeight(score), meta));
        }
        LOG.debugf("Expanded r/%s into %d authors", name, result.size());
        return result;
    }

    private List<DiscoveredRelationship> expandUser(EntityRecord user) {
        String name = user.getEntityId();
        JsonNode listing = call("reddit.getSubmittedPosts", name,
            () -> client.getSubmittedPosts(name, config.postsPerUser(), config.userAgent()));

        Map<String, Long> postsPerCommunity = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (JsonNode post : children(listing)) {
            String subreddit = text(post, "subreddit");
            if (subreddit == null) {
                continue;
            }
            String key = subreddit.toLowerCase(Locale.ROOT);
            postsPerCommunity.merge(key, 1L, Long::sum);
            displayNames.putIfAbsent(key, subreddit);
        }

        List<DiscoveredRelationship> result = new ArrayList<>();
        postsPerCommunity.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(config.communitiesPerUser())
            .forEach(entry -> result.add(DiscoveredRelationship.outgoing(user,
                communityStub(displayNames.get(entry.getKey())), POSTS_IN,
                activityWeight(entry.getValue()), Map.of("post_count", entry.getValue()))));
        return result;
    }

    static double scoreWeight(long score) {
        return Math.min(Math.max(score, 0) / 100.0, 1.0);
    }

    static double activityWeight(long postCount) {
        return Math.min(postCount / 10.0, 1.0);
    }

    private EntityRecord toCommunity(JsonNode data) {
        String name = text(data, "display_name");
        if (name == null) {
            throw new EntityNotFoundException(SourceType.REDDIT, "Community payload without display_name");
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        copy(data, "title", meta);
        copy(data, "subscribers", meta);
        copy(data, "public_description", meta, "description");
        copy(data, "created_utc", meta);
        copy(data, "over18", meta);
        return EntityRecord.builder()
            .source(SourceType.REDDIT)
            .entityType(EntityType.COMMUNITY)
            .entityId(name.toLowerCase(Locale.ROOT))
            .displayName("r/" + name)
            .metadata(meta)
            .build();
    }

    private EntityRecord toUser(JsonNode data) {
        String name = text(data, "name");
        if (name == null) {
            throw new EntityNotFoundException(SourceType.REDDIT, "User payload without name");
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        copy(data, "link_karma", meta);
        copy(data, "comment_karma", meta);
        copy(data, "created_utc", meta);
        return EntityRecord.builder()
            .source(SourceType.REDDIT)
            .entityType(EntityType.USER)
            .entityId(name.toLowerCase(Locale.ROOT))
            .displayName("u/" + name)
            .metadata(meta)
            .build();
    }

    private static EntityRecord userStub(String author) {
        return EntityRecord.builder()
            .source(SourceType.REDDIT)
            .entityType(EntityType.USER)
            .entityId(author.toLowerCase(Locale.ROOT))
            .displayName("u/" + author)
            .build();
    }

    private static EntityRecord communityStub(String subreddit) {
        return EntityRecord.builder()
            .source(SourceType.REDDIT)
            .entityType(EntityType.COMMUNITY)
            .entityId(subreddit.toLowerCase(Locale.ROOT))
            .displayName("r/" + subreddit)
            .build();
    }

    private static JsonNode requireThing(JsonNode json, String kind, String reference) {
        if (json == null || !kind.equals(text(json, "kind")) || !json.path("data").isObject()) {
            throw new EntityNotFoundException(SourceType.REDDIT, "Reddit has no " + reference);
        }
        return json.get("data");
    }

    private static List<JsonNode> children(JsonNode listing) {
        List<JsonNode> posts = new ArrayList<>();
        if (listing == null) {
            return posts;
        }
        for (JsonNode child : listing.path("data").path("children")) {
            JsonNode data = child.get("data");
            if (data != null && data.isObject()) {
                posts.add(data);
            }
        }
        return posts;
    }

    static Reference parseReference(String reference) {
        String value = reference == null ? "" : reference.trim();
        value = value.replaceFirst("^https?://(www\\.|old\\.)?reddit\\.com", "");
        value = value.replaceAll("^/+|/+$", "");
        EntityType type = EntityType.COMMUNITY;
        if (value.startsWith("u/") || value.startsWith("user/")) {
            type = EntityType.USER;
            value = value.substring(value.indexOf('/') + 1);
        } else if (value.startsWith("r/")) {
            value = value.substring(2);
        }
        if (value.isEmpty() || value.contains("/")) {
            throw new IllegalArgumentException("Invalid Reddit reference: " + reference);
        }
        return new Reference(type, value.toLowerCase(Locale.ROOT));
    }

    private JsonNode call(String operation, String reference, Supplier<JsonNode> request) {
        return executor.call(SourceType.REDDIT, operation, reference, request);
    }

    record Reference(EntityType type, String name) {
    }

    private static final class AuthorActivity {
        private final String author;
        private final JsonNode topPost;
        private long postCount;

        private AuthorActivity(String author, JsonNode topPost) {
            this.author = author;
            this.topPost = topPost;
        }
    }
}
