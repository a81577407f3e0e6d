package br.edu.ifba.socialgraph.source.wikipedia;

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
import br.edu.ifba.socialgraph.source.JsonPayloads;
import br.edu.ifba.socialgraph.source.SourceAdapter;
import br.edu.ifba.socialgraph.source.SourceRequestExecutor;
import br.edu.ifba.socialgraph.source.SourcesConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Walks the Wikipedia link graph.
 *
 * <p>Pages are keyed by numeric page id so that redirects and title variants collapse
 * into one node. Expanding a page yields {@code links_to} edges to linked articles and
 * {@code in_category} edges to its visible categories; categories are leaves.</p>
 */
@ApplicationScoped
public class WikipediaSourceAdapter implements SourceAdapter {

    private static final Logger LOG = Logger.getLogger(WikipediaSourceAdapter.class);

    static final String LINKS_TO = "links_to";
    static final String IN_CATEGORY = "in_category";

    private static final String CATEGORY_PREFIX = "Category:";
    private static final int MAX_EXTRACT_LENGTH = 500;
    private static final int MAIN_NAMESPACE = 0;

    private final WikipediaApiClient client;
    private final SourceRequestExecutor executor;
    private final SourcesConfig.WikipediaConfig config;

    @Inject
    public WikipediaSourceAdapter(@RestClient WikipediaApiClient client, SourceRequestExecutor executor,
            SourcesConfig config) {
        this.client = client;
        this.executor = executor;
        this.config = config.wikipedia();
    }

    @Override
    public SourceType source() {
        return SourceType.WIKIPEDIA;
    }

    @Override
    public @NotNull EntityRecord resolveEntity(@NotNull String reference) {
        String title = normalizeTitle(reference);
        JsonNode json = call("wikipedia.getPage", title, () -> client.getPage(title));
        JsonNode page = firstPage(json);
        if (page == null || page.path("missing").asBoolean(false) || page.path("invalid").asBoolean(false)
                || !page.hasNonNull("pageid")) {
            throw new EntityNotFoundException(SourceType.WIKIPEDIA, "Wikipedia has no page titled '" + title + "'");
        }
        return toPage(page);
    }

    @Override
    public @NotNull List<DiscoveredRelationship> fetchRelationships(@NotNull EntityRecord entity) {
        if (entity.getEntityType() != EntityType.PAGE) {
            return List.of();
        }
        Object storedTitle = entity.getMetadata().get("title");
        String title = storedTitle != null ? storedTitle.toString() : entity.getDisplayName();
        List<DiscoveredRelationship> result = new ArrayList<>();

        JsonNode linked = call("wikipedia.getLinkedPages", title,
            () -> client.getLinkedPages(title, config.linksPerPage()));
        List<JsonNode> pages = new ArrayList<>();
        for (JsonNode page : pages(linked)) {
            if (page.hasNonNull("pageid") && !page.path("missing").asBoolean(false)
                    && page.path("ns").asInt(MAIN_NAMESPACE) == MAIN_NAMESPACE) {
                pages.add(page);
            }
        }
        // the generator returns pages in no useful order
        pages.sort(Comparator.comparing(page -> page.path("title").asText()));
        for (JsonNode page : pages) {
            result.add(DiscoveredRelationship.outgoing(entity, toPage(page), LINKS_TO, 1.0, Map.of()));
        }

        JsonNode categories = call("wikipedia.getCategories", title,
            () -> client.getCategories(title, config.categoriesPerPage()));
        JsonNode page = firstPage(categories);
        if (page != null && JsonPayloads.isArray(page.get("categories"))) {
            for (JsonNode category : page.get("categories")) {
                String categoryTitle = text(category, "title");
                if (categoryTitle != null) {
                    result.add(DiscoveredRelationship.outgoing(entity, toCategory(categoryTitle),
                        IN_CATEGORY, 1.0, Map.of()));
                }
            }
        }
        LOG.debugf("Expanded Wikipedia page '%s' into %d relationships", title, result.size());
        return result;
    }

    private EntityRecord toPage(JsonNode page) {
        String title = text(page, "title");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("title", title);
        String extract = text(page, "extract");
        if (extract != null) {
            meta.put("extract", JsonPayloads.truncate(extract, MAX_EXTRACT_LENGTH));
        }
        copy(page, "fullurl", meta, "url");
        copy(page, "length", meta);
        copy(page, "touched", meta);
        return EntityRecord.builder()
            .source(SourceType.WIKIPEDIA)
            .entityType(EntityType.PAGE)
            .entityId(String.valueOf(page.get("pageid").asLong()))
            .displayName(title)
            .metadata(meta)
            .build();
    }

    private static EntityRecord toCategory(String categoryTitle) {
        String name = categoryTitle.startsWith(CATEGORY_PREFIX)
            ? categoryTitle.substring(CATEGORY_PREFIX.length())
            : categoryTitle;
        return EntityRecord.builder()
            .source(SourceType.WIKIPEDIA)
            .entityType(EntityType.CATEGORY)
            .entityId(name.toLowerCase(Locale.ROOT))
            .displayName(name)
            .putMetadata("title", categoryTitle)
            .build();
    }

    private static JsonNode firstPage(JsonNode json) {
        List<JsonNode> pages = pages(json);
        return pages.isEmpty() ? null : pages.get(0);
    }

    private static List<JsonNode> pages(JsonNode json) {
        List<JsonNode> result = new ArrayList<>();
        if (json == null) {
            return result;
        }
        JsonNode pages = json.path("query").path("pages");
        // format version 2 returns an array, version 1 an object keyed by page id
        if (pages.isArray() || pages.isObject()) {
            pages.forEach(result::add);
        }
        return result;
    }

    static String normalizeTitle(String reference) {
        String value = reference == null ? "" : reference.trim();
        int wikiPath = value.indexOf("/wiki/");
        if (wikiPath >= 0) {
            value = value.substring(wikiPath + "/wiki/".length());
        }
        value = value.replace('_', ' ').trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Wikipedia reference must not be blank");
        }
        return value;
    }

    private JsonNode call(String operation, String reference, Supplier<JsonNode> request) {
        return executor.call(SourceType.WIKIPEDIA, operation, reference, request);
    }
}
