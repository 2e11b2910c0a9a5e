package dev.jobharvest.fetch;

import dev.jobharvest.model.PageContent;

/**
 * Retrieves rendered markup and outbound links for a URL.
 */
public interface PageFetcher {

    /**
     * Fetch a page.
     *
     * @param url absolute page URL
     * @return normalized page content
     * @throws dev.jobharvest.error.FetchException on network failure, non-2xx status,
     *                                              malformed body or a service-reported failure
     */
    PageContent fetch(String url);
}
