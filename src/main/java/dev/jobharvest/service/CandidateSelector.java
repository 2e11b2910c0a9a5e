package dev.jobharvest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.ai.ExtractionOracle;
import dev.jobharvest.ai.JobSchemas;
import dev.jobharvest.ai.OracleRequest;
import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.fetch.AnchorExtractor;
import dev.jobharvest.fetch.PageFetcher;
import dev.jobharvest.model.Anchor;
import dev.jobharvest.model.CandidateSelection;
import dev.jobharvest.model.PageContent;
import dev.jobharvest.model.SelectionTier;
import dev.jobharvest.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Narrows a careers page's anchors to likely job-posting URLs.
 * <p>
 * Tiers are tried in order and the first one with a non-empty absolutized result wins:
 * oracle-selected indices, then href/text heuristics, then a heuristic pass over
 * the first linked ATS board page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateSelector {

    static final int SOFT_SELECTION_CAP = 30;

    static final List<String> JOB_KEYWORDS = List.of(
            "/careers/", "/career/", "/jobs/", "/job/", "/positions/", "/position/",
            "/opportunities/", "/opportunity/", "/opening/", "/openings/",
            "greenhouse.io", "lever.co", "ashbyhq.com", "workable.com");

    static final List<String> EXCLUDED_SUBSTRINGS = List.of(
            "?", "#", "/teams", "/departments", "/locations", "/search", "/filters",
            "/pages/", "/page/", "/category/", "/categories/");

    static final List<String> APPLY_PHRASES = List.of("apply", "view role", "view job", "see role", "see job");

    static final List<String> BOARD_HOSTS = List.of(
            "greenhouse.io", "lever.co", "ashbyhq.com", "workable.com", "jobs.ashbyhq.com");

    static final List<String> BOARD_APPLY_PHRASES = List.of("apply", "view job", "view role", "see job", "job details");

    static final List<String> BOARD_JOB_SEGMENTS = List.of("/job/", "/jobs/", "/positions/", "/careers/");

    private static final String SELECTION_INSTRUCTION =
            "Select ONLY the indices of anchors that are individual job postings. "
                    + "Be VERY selective - choose maximum 30 indices. "
                    + "Exclude category, team, filter, search, pagination, and general navigation links. "
                    + "Focus on links that clearly lead to specific job descriptions.";

    private final ExtractionOracle oracle;
    private final PageFetcher pageFetcher;
    private final JobSchemas schemas;
    private final HarvestProperties harvestProperties;
    private final OracleProperties oracleProperties;
    private final ObjectMapper objectMapper;

    /**
     * @param sourceUrl careers page the anchors were taken from
     * @param anchors   all anchors of the page, in document order
     */
    public CandidateSelection select(String sourceUrl, List<Anchor> anchors) {
        List<Anchor> limited = anchors.size() > harvestProperties.getAnchorLimit()
                ? anchors.subList(0, harvestProperties.getAnchorLimit())
                : anchors;

        return Stream.<Supplier<Optional<CandidateSelection>>>of(
                        () -> tier(SelectionTier.ORACLE, selectWithOracle(sourceUrl, anchors.size(), limited), sourceUrl),
                        () -> tier(SelectionTier.HEURISTIC, heuristicMatches(limited), sourceUrl),
                        () -> selectFromBoard(sourceUrl, limited))
                .map(Supplier::get)
                .flatMap(Optional::stream)
                .findFirst()
                .orElseGet(CandidateSelection::none);
    }

    private Optional<CandidateSelection> tier(SelectionTier tier, List<String> hrefs, String baseUrl) {
        List<String> urls = UrlUtils.absolutizeAndDedupe(hrefs, baseUrl);
        if (urls.isEmpty()) {
            return Optional.empty();
        }
        if (tier == SelectionTier.HEURISTIC) {
            log.info("heuristic_fallback_used matches={}", hrefs.size());
        }
        return Optional.of(new CandidateSelection(urls, tier));
    }

    List<String> selectWithOracle(String sourceUrl, int totalAnchors, List<Anchor> anchors) {
        if (anchors.isEmpty()) {
            return List.of();
        }
        try {
            JsonNode schema = schemas.jobUrlIndices();
            JsonNode response = oracle.completeJson(new OracleRequest(
                    selectionSystemPrompt(schemas.text(schema)),
                    selectionUserPrompt(sourceUrl, anchors),
                    schema,
                    oracleProperties.getModelJobLinks(),
                    null));
            List<String> hrefs = hrefsForIndices(response, anchors);
            log.info("anchors_info total={} limited={} selected={}", totalAnchors, anchors.size(),
                    response.path("indices").size());
            if (response.path("indices").size() > SOFT_SELECTION_CAP) {
                log.warn("oracle_selection_oversized url={} selected={} cap={}", sourceUrl,
                        response.path("indices").size(), SOFT_SELECTION_CAP);
            }
            return hrefs;
        } catch (RuntimeException e) {
            log.warn("oracle_selection_error url={} error={}", sourceUrl, e.getMessage());
            return List.of();
        }
    }

    private String selectionSystemPrompt(String schemaText) {
        return "You are a precise job posting selector. Given a list of anchors with href and text, "
                + "return ONLY a JSON object that conforms to this JSON Schema (Draft 2020-12):\n" + schemaText + "\n"
                + "CRITICAL RULES:\n"
                + "- Select MAXIMUM 30 indices (preferably 10-20)\n"
                + "- Only choose anchors that are clearly individual job postings\n"
                + "- Exclude category/team/filter/search/pagination links\n"
                + "- Be conservative - when in doubt, exclude it\n"
                + "- Output must be valid JSON with 'indices' array containing integers only";
    }

    private String selectionUserPrompt(String sourceUrl, List<Anchor> anchors) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Origin", sourceUrl);
        payload.put("Anchors", anchors);
        payload.put("Instruction", SELECTION_INSTRUCTION);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Could not serialize anchors of " + sourceUrl, e);
        }
    }

    /**
     * Maps selected indices back to hrefs, discarding non-integers and indices outside the anchor list.
     */
    static List<String> hrefsForIndices(JsonNode response, List<Anchor> anchors) {
        List<String> hrefs = new ArrayList<>();
        for (JsonNode index : response.path("indices")) {
            if (!index.isIntegralNumber() || !index.canConvertToInt()) {
                continue;
            }
            int i = index.asInt();
            if (i >= 0 && i < anchors.size()) {
                hrefs.add(anchors.get(i).href());
            }
        }
        return hrefs;
    }

    static List<String> heuristicMatches(List<Anchor> anchors) {
        List<String> matches = new ArrayList<>();
        for (Anchor anchor : anchors) {
            String href = anchor.href();
            if (href == null || href.isEmpty()) {
                continue;
            }
            String hrefLower = href.toLowerCase(Locale.ROOT);
            String text = anchor.text().toLowerCase(Locale.ROOT);
            boolean jobPath = JOB_KEYWORDS.stream().anyMatch(hrefLower::contains)
                    && EXCLUDED_SUBSTRINGS.stream().noneMatch(hrefLower::contains);
            if (jobPath || APPLY_PHRASES.stream().anyMatch(text::contains)) {
                matches.add(href);
            }
        }
        return matches;
    }

    private Optional<CandidateSelection> selectFromBoard(String sourceUrl, List<Anchor> anchors) {
        List<String> boards = UrlUtils.absolutizeAndDedupe(boardLinks(anchors), sourceUrl);
        if (boards.isEmpty()) {
            return Optional.empty();
        }
        String boardUrl = boards.get(0);
        log.info("ats_board_fallback url={}", boardUrl);
        try {
            PageContent board = pageFetcher.fetch(boardUrl);
            List<Anchor> boardAnchors = AnchorExtractor.extract(board);
            if (boardAnchors.size() > harvestProperties.getBoardAnchorLimit()) {
                boardAnchors = boardAnchors.subList(0, harvestProperties.getBoardAnchorLimit());
            }
            List<String> urls = UrlUtils.absolutizeAndDedupe(boardJobLinks(boardAnchors), boardUrl);
            return urls.isEmpty() ? Optional.empty() : Optional.of(new CandidateSelection(urls, SelectionTier.ATS_BOARD));
        } catch (RuntimeException e) {
            log.warn("ats_board_error url={} error={}", boardUrl, e.getMessage());
            return Optional.empty();
        }
    }

    static List<String> boardLinks(List<Anchor> anchors) {
        return anchors.stream()
                .map(Anchor::href)
                .filter(href -> href != null && !href.isEmpty())
                .filter(href -> BOARD_HOSTS.stream().anyMatch(href.toLowerCase(Locale.ROOT)::contains))
                .toList();
    }

    static List<String> boardJobLinks(List<Anchor> anchors) {
        List<String> matches = new ArrayList<>();
        for (Anchor anchor : anchors) {
            String href = anchor.href();
            if (href == null || href.isEmpty()) {
                continue;
            }
            String hrefLower = href.toLowerCase(Locale.ROOT);
            String text = anchor.text().toLowerCase(Locale.ROOT);
            boolean applyText = BOARD_APPLY_PHRASES.stream().anyMatch(text::contains) && hrefLower.contains("/job");
            if (applyText || BOARD_JOB_SEGMENTS.stream().anyMatch(hrefLower::contains)) {
                matches.add(href);
            }
        }
        return matches;
    }
}
