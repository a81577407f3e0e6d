package br.edu.ifba.socialgraph.source;

import java.time.Duration;
import java.util.Optional;

import br.edu.ifba.socialgraph.core.SourceType;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Per-source settings, prefix {@code socialgraph.sources}.
 *
 * <p>Example configuration:
 * <pre>
 * socialgraph.sources.github.rate-limit=1.0
 * socialgraph.sources.github.capacity=5
 * socialgraph.sources.github.max-wait=60s
 * socialgraph.sources.github.token=${GITHUB_TOKEN}
 * socialgraph.sources.reddit.user-agent=SocialGraphCrawler/1.0
 * </pre>
 */
@ConfigMapping(prefix = "socialgraph.sources")
public interface SourcesConfig {

    GitHubConfig github();

    RedditConfig reddit();

    WikipediaConfig wikipedia();

    default ThrottleConfig throttle(SourceType source) {
        switch (source) {
            case GITHUB:
                return github();
            case REDDIT:
                return reddit();
            case WIKIPEDIA:
                return wikipedia();
            default:
                throw new IllegalArgumentException("No throttle configured for " + source);
        }
    }

    /**
     * Token bucket settings shared by every source.
     */
    interface ThrottleConfig {

        /**
         * Tokens added per second.
         */
        @WithName("rate-limit")
        @WithDefault("1.0")
        double rateLimit();

        /**
         * Bucket size, i.e. the largest burst allowed.
         */
        @WithDefault("5")
        int capacity();

        /**
         * How long a caller may wait for a token before failing.
         */
        @WithName("max-wait")
        @WithDefault("60s")
        Duration maxWait();
    }

    interface GitHubConfig extends ThrottleConfig {

        Optional<String> token();

        @WithName("repos-per-user")
        @WithDefault("20")
        int reposPerUser();

        @WithName("followers-per-user")
        @WithDefault("15")
        int followersPerUser();

        @WithName("contributors-per-repo")
        @WithDefault("25")
        int contributorsPerRepo();
    }

    interface RedditConfig extends ThrottleConfig {

        @WithName("user-agent")
        @WithDefault("SocialGraphCrawler/1.0")
        String userAgent();

        @WithName("posts-per-community")
        @WithDefault("25")
        int postsPerCommunity();

        @WithName("posts-per-user")
        @WithDefault("50")
        int postsPerUser();

        @WithName("communities-per-user")
        @WithDefault("5")
        int communitiesPerUser();
    }

    interface WikipediaConfig extends ThrottleConfig {

        @WithName("links-per-page")
        @WithDefault("20")
        int linksPerPage();

        @WithName("categories-per-page")
        @WithDefault("5")
        int categoriesPerPage();
    }
}
