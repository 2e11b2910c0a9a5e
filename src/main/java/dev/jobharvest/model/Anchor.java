package dev.jobharvest.model;

/**
 * An outbound link found on a page. {@code href} is never blank.
 */
public record Anchor(String href, String text) {

    public Anchor {
        text = text == null ? "" : text;
    }
}
