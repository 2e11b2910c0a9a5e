package dev.jobharvest.model;

import java.util.List;

/**
 * Normalized result of a page fetch.
 *
 * @param url       the URL that was requested
 * @param html      rendered markup, never null
 * @param anchors   outbound links in document order
 * @param canonical canonical URL reported by the fetch service, or null
 */
public record PageContent(String url, String html, List<Anchor> anchors, String canonical) {

    public PageContent {
        html = html == null ? "" : html;
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
    }

    public String canonicalOr(String fallback) {
        return canonical != null && !canonical.isBlank() ? canonical : fallback;
    }
}
