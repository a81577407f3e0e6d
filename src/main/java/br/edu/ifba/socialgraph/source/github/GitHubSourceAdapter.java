package br.edu.ifba.socialgraph.source.github;

import static br.edu.ifba.socialgraph.source.JsonPayloads.copy;
import static br.edu.ifba.socialgraph.source.JsonPayloads.text;

import java.util.ArrayList;
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
import br.edu.ifba.socialgraph.source.JsonPayloads;
import br.edu.ifba.socialgraph.source.SourceAdapter;
import br.edu.ifba.socialgraph.source.SourceRequestExecutor;
import br.edu.ifba.socialgraph.source.SourcesConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Walks the GitHub social graph.
 *
 * <p>References: {@code login} for a user, {@code owner/name} for a repository (a leading
 * {@code https://github.com/} is accepted). Identifiers are lower-cased.</p>
 *
 * <p>Edges produced:</p>
 * <ul>
 *   <li>{@code owns}: user to repository</li>
 *   <li>{@code follows}: follower to user</li>
 *   <li>{@code contributes_to}: user to repository, weighted by contribution count</li>
 * </ul>
 */
@ApplicationScoped
public class GitHubSourceAdapter implements SourceAdapter {

    private static final Logger LOG = Logger.getLogger(GitHubSourceAdapter.class);

    static final String OWNS = "owns";
    static final String FOLLOWS = "follows";
    static final String CONTRIBUTES_TO = "contributes_to";

    private static final String URL_PREFIX = "https://github.com/";

    private final GitHubApiClient client;
    private final SourceRequestExecutor executor;
    private final SourcesConfig.GitHubConfig config;

    @Inject
    public GitHubSourceAdapter(@RestClient GitHubApiClient client, SourceRequestExecutor executor,
            SourcesConfig config) {
        this.client = client;
        this.executor = executor;
        this.config = config.github();
    }

    @Override
    public SourceType source() {
        return SourceType.GITHUB;
    }

    @Override
    public @NotNull EntityRecord resolveEntity(@NotNull String reference) {
        String normalized = normalizeReference(reference);
        int slash = normalized.indexOf('/');
        if (slash > 0) {
            String owner = normalized.substring(0, slash);
            String repo = normalized.substring(slash + 1);
            JsonNode json = call("github.getRepository", normalized,
                () -> client.getRepository(owner, repo, authorization()));
            return toRepository(json, normalized);
        }
        JsonNode json = call("github.getUser", normalized, () -> client.getUser(normalized, authorization()));
        return toUser(json, normalized);
    }

    @Override
    public @NotNull List<DiscoveredRelationship> fetchRelationships(@NotNull EntityRecord entity) {
        switch (entity.getEntityType()) {
            case USER:
                return expandUser(entity);
            case REPO:
                return expandRepository(entity);
            default:
                return List.of();
        }
    }

    private List<DiscoveredRelationship> expandUser(EntityRecord user) {
        String login = user.getEntityId();
        List<DiscoveredRelationship> result = new ArrayList<>();

        JsonNode repos = call("github.getUserRepositories", login,
            () -> client.getUserRepositories(login, config.reposPerUser(), "updated", authorization()));
        if (JsonPayloads.isArray(repos)) {
            for (JsonNode repoJson : repos) {
                if (text(repoJson, "full_name") == null) {
                    continue;
                }
                EntityRecord repo = toRepository(repoJson, login);
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("is_fork", repoJson.path("fork").asBoolean(false));
                meta.put("is_private", repoJson.path("private").asBoolean(false));
                result.add(DiscoveredRelationship.outgoing(user, repo, OWNS, 1.0, meta));
            }
        }

        JsonNode followers = call("github.getFollowers", login,
            () -> client.getFollowers(login, config.followersPerUser(), authorization()));
        if (JsonPayloads.isArray(followers)) {
            for (JsonNode followerJson : followers) {
                if (text(followerJson, "login") == null) {
                    continue;
                }
                EntityRecord follower = toUser(followerJson, login);
                result.add(DiscoveredRelationship.incoming(user, follower, FOLLOWS, 1.0, Map.of()));
            }
        }

        LOG.debugf("Expanded GitHub user %s into %d relationships", login, result.size());
        return result;
    }

    private List<DiscoveredRelationship> expandRepository(EntityRecord repository) {
        String fullName = repository.getEntityId();
        int slash = fullName.indexOf('/');
        if (slash <= 0) {
            throw new EntityNotFoundException(SourceType.GITHUB, "Not a repository full name: " + fullName);
        }
        String owner = fullName.substring(0, slash);
        String repo = fullName.substring(slash + 1);

        JsonNode contributors = call("github.getContributors", fullName,
            () -> client.getContributors(owner, repo, config.contributorsPerRepo(), authorization()));
        List<DiscoveredRelationship> result = new ArrayList<>();
        if (JsonPayloads.isArray(contributors)) {
            for (JsonNode contributorJson : contributors) {
                if (text(contributorJson, "login") == null) {
                    continue;
                }
                long contributions = contributorJson.path("contributions").asLong(0);
                EntityRecord user = toUser(contributorJson, fullName);
                result.add(DiscoveredRelationship.incoming(repository, user, CONTRIBUTES_TO,
                    contributionWeight(contributions), Map.of("contributions", contributions)));
            }
        }
        return result;
    }

    static double contributionWeight(long contributions) {
        return Math.min(Math.max(contributions, 0) / 100.0, 1.0);
    }

    EntityRecord toUser(JsonNode json, String reference) {
        String login = text(json, "login");
        if (login == null) {
            throw new EntityNotFoundException(SourceType.GITHUB, "GitHub user payload without login for " + reference);
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("login", login);
        copy(json, "name", meta);
        copy(json, "bio", meta);
        copy(json, "company", meta);
        copy(json, "location", meta);
        copy(json, "public_repos", meta);
        copy(json, "followers", meta);
        copy(json, "following", meta);
        copy(json, "created_at", meta);
        copy(json, "html_url", meta);
        copy(json, "avatar_url", meta);

        String name = text(json, "name");
        return EntityRecord.builder()
            .source(SourceType.GITHUB)
            .entityType(EntityType.USER)
            .entityId(login.toLowerCase(Locale.ROOT))
            .displayName(name != null ? name : login)
            .metadata(meta)
            .build();
    }

    EntityRecord toRepository(JsonNode json, String reference) {
        String fullName = text(json, "full_name");
        if (fullName == null) {
            throw new EntityNotFoundException(SourceType.GITHUB, "GitHub repository payload without full_name for " + reference);
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        copy(json, "name", meta);
        String owner = text(json.path("owner"), "login");
        if (owner != null) {
            meta.put("owner", owner);
        }
        copy(json, "description", meta);
        copy(json, "language", meta);
        copy(json, "stargazers_count", meta, "stars");
        copy(json, "forks_count", meta, "forks");
        copy(json, "open_issues_count", meta, "open_issues");
        copy(json, "fork", meta, "is_fork");
        copy(json, "created_at", meta);
        copy(json, "updated_at", meta);
        copy(json, "html_url", meta);

        return EntityRecord.builder()
            .source(SourceType.GITHUB)
            .entityType(EntityType.REPO)
            .entityId(fullName.toLowerCase(Locale.ROOT))
            .displayName(fullName)
            .metadata(meta)
            .build();
    }

    static String normalizeReference(String reference) {
        String value = reference == null ? "" : reference.trim();
        if (value.startsWith(URL_PREFIX)) {
            value = value.substring(URL_PREFIX.length());
        }
        if (value.startsWith("@")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty() || value.chars().filter(c -> c == '/').count() > 1) {
            throw new IllegalArgumentException("Invalid GitHub reference: " + reference);
        }
        return value.toLowerCase(Locale.ROOT);
    }

    private String authorization() {
        return config.token()
            .filter(token -> !token.isBlank())
            .map(token -> "Bearer " + token)
            .orElse(null);
    }

    private JsonNode call(String operation, String reference, Supplier<JsonNode> request) {
        return executor.call(SourceType.GITHUB, operation, reference, request);
    }
}
