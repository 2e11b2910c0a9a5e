package dev.jobharvest.model;

import java.util.List;

/**
 * Candidate URLs for one Source and the tier that produced them.
 */
public record CandidateSelection(List<String> urls, SelectionTier tier) {

    public CandidateSelection {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static CandidateSelection none() {
        return new CandidateSelection(List.of(), SelectionTier.NONE);
    }
}
