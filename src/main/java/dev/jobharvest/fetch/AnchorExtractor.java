package dev.jobharvest.fetch;

import dev.jobharvest.model.Anchor;
import dev.jobharvest.model.PageContent;

import java.util.ArrayList;
import java.util.List;

public final class AnchorExtractor {

    private AnchorExtractor() {
    }

    /**
     * (href, text) pairs of a page in document order, without blank hrefs.
     */
    public static List<Anchor> extract(PageContent page) {
        if (page == null) {
            return List.of();
        }
        List<Anchor> anchors = new ArrayList<>(page.anchors().size());
        for (Anchor anchor : page.anchors()) {
            if (anchor == null || anchor.href() == null || anchor.href().isBlank()) {
                continue;
            }
            anchors.add(new Anchor(anchor.href().strip(), anchor.text().strip()));
        }
        return anchors;
    }
}
