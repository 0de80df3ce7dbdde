package authzen.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for subject, resource and action search.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code authzen.search.page-size} - candidates examined per page when the request sets no limit</li>
 * </ul>
 */
@ConfigMapping(prefix = "authzen.search")
public interface SearchConfig {

    /**
     * Number of candidates examined per search page.
     *
     * @return the default page size
     */
    @WithDefault("100")
    int pageSize();
}
