package dev.jobharvest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.ai.ExtractionOracle;
import dev.jobharvest.ai.JobSchemas;
import dev.jobharvest.ai.OracleRequest;
import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.fetch.PageFetcher;
import dev.jobharvest.model.Anchor;
import dev.jobharvest.model.CandidateSelection;
import dev.jobharvest.model.PageContent;
import dev.jobharvest.model.SelectionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateSelectorTest {

    private static final String SOURCE = "https://acme.com/careers/";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ExtractionOracle oracle;

    @Mock
    private PageFetcher pageFetcher;

    private HarvestProperties harvestProperties;
    private CandidateSelector selector;

    @BeforeEach
    void setUp() {
        harvestProperties = new HarvestProperties();
        OracleProperties oracleProperties = new OracleProperties();
        oracleProperties.setModelJobLinks("links/model");
        selector = new CandidateSelector(oracle, pageFetcher, new JobSchemas(objectMapper), harvestProperties,
                oracleProperties, objectMapper);
    }

    private void oracleReturns(String json) throws Exception {
        when(oracle.completeJson(any(OracleRequest.class))).thenReturn(objectMapper.readTree(json));
    }

    @Nested
    @DisplayName("Oracle tier")
    class OracleTierTests {

        @Test
        @DisplayName("Should map selected indices to absolute URLs and drop out-of-range ones")
        void shouldUseOracleSelection() throws Exception {
            oracleReturns("{\"indices\": [0, 2, 99, -1, 0]}");
            List<Anchor> anchors = List.of(
                    new Anchor("/jobs/1", "Engineer"),
                    new Anchor("/about", "About"),
                    new Anchor("https://acme.com/jobs/2", "Designer"));

            CandidateSelection selection = selector.select(SOURCE, anchors);

            assertThat(selection.tier()).isEqualTo(SelectionTier.ORACLE);
            assertThat(selection.urls()).containsExactly("https://acme.com/jobs/1", "https://acme.com/jobs/2");
            verifyNoInteractions(pageFetcher);
        }

        @Test
        @DisplayName("Should only send the first anchor-limit anchors to the oracle")
        void shouldLimitAnchorsSentToOracle() throws Exception {
            harvestProperties.setAnchorLimit(2);
            oracleReturns("{\"indices\": [1]}");
            List<Anchor> anchors = List.of(
                    new Anchor("/jobs/first", "One"),
                    new Anchor("/jobs/second", "Two"),
                    new Anchor("/jobs/third", "Three"));

            CandidateSelection selection = selector.select(SOURCE, anchors);

            ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
            verify(oracle).completeJson(captor.capture());
            OracleRequest request = captor.getValue();
            assertThat(request.userPrompt()).contains("/jobs/second").doesNotContain("/jobs/third");
            assertThat(request.model()).isEqualTo("links/model");
            assertThat(request.systemPrompt()).contains("\"indices\"");
            assertThat(selection.urls()).containsExactly("https://acme.com/jobs/second");
        }

        @Test
        void shouldSkipOracleWhenThereAreNoAnchors() {
            CandidateSelection selection = selector.select(SOURCE, List.of());

            assertThat(selection).isEqualTo(CandidateSelection.none());
            verifyNoInteractions(oracle, pageFetcher);
        }
    }

    @Nested
    @DisplayName("Fallback tiers")
    class FallbackTests {

        @Test
        @DisplayName("Should fall back to heuristics when the oracle fails")
        void shouldUseHeuristicsAfterOracleFailure() {
            when(oracle.completeJson(any(OracleRequest.class)))
                    .thenThrow(new ExtractionException("openrouter failed to produce valid JSON"));
            List<Anchor> anchors = List.of(
                    new Anchor("/jobs/backend-engineer", "Backend Engineer"),
                    new Anchor("/jobs?team=eng", "Engineering"),
                    new Anchor("/roles/42", "Apply now"),
                    new Anchor("/blog", "Blog"));

            CandidateSelection selection = selector.select(SOURCE, anchors);

            assertThat(selection.tier()).isEqualTo(SelectionTier.HEURISTIC);
            assertThat(selection.urls()).containsExactly(
                    "https://acme.com/jobs/backend-engineer", "https://acme.com/roles/42");
        }

        @Test
        @DisplayName("Should fall back to the linked ATS board when only a board link exists")
        void shouldUseBoardWhenOnlyBoardLinkExists() throws Exception {
            oracleReturns("{\"indices\": []}");
            String boardUrl = "https://boards.greenhouse.io/acme?gh_src=site";
            when(pageFetcher.fetch(boardUrl)).thenReturn(new PageContent(boardUrl, "<html/>", List.of(
                    new Anchor("/acme/jobs/101", "Platform Engineer"),
                    new Anchor("/acme/jobs/102", "Data Engineer"),
                    new Anchor("https://acme.com", "Back to site")), null));

            CandidateSelection selection = selector.select(SOURCE, List.of(
                    new Anchor("/about", "About us"),
                    new Anchor(boardUrl, "Open roles")));

            assertThat(selection.tier()).isEqualTo(SelectionTier.ATS_BOARD);
            assertThat(selection.urls()).containsExactly(
                    "https://boards.greenhouse.io/acme/jobs/101", "https://boards.greenhouse.io/acme/jobs/102");
        }

        @Test
        @DisplayName("Should yield no candidates when the board page cannot be fetched")
        void shouldYieldNothingWhenBoardFetchFails() throws Exception {
            oracleReturns("{\"indices\": []}");
            when(pageFetcher.fetch(anyString())).thenThrow(new FetchException("Firecrawl error: blocked"));

            CandidateSelection selection = selector.select(SOURCE, List.of(
                    new Anchor("https://apply.workable.com/acme/#jobs", "Roles")));

            assertThat(selection.tier()).isEqualTo(SelectionTier.NONE);
            assertThat(selection.urls()).isEmpty();
        }

        @Test
        void shouldYieldNothingWhenNoTierMatches() throws Exception {
            oracleReturns("{\"indices\": []}");

            CandidateSelection selection = selector.select(SOURCE, List.of(
                    new Anchor("/about", "About"), new Anchor("mailto:hr@acme.com", "Contact")));

            assertThat(selection.tier()).isEqualTo(SelectionTier.NONE);
            verify(pageFetcher, never()).fetch(anyString());
        }
    }

    @Nested
    @DisplayName("Static matchers")
    class MatcherTests {

        @Test
        void shouldDiscardNonIntegerIndices() throws Exception {
            List<Anchor> anchors = List.of(new Anchor("/a", "A"), new Anchor("/b", "B"));

            assertThat(CandidateSelector.hrefsForIndices(
                    objectMapper.readTree("{\"indices\": [1, \"0\", 1.5, 0]}"), anchors))
                    .containsExactly("/b", "/a");
        }

        @Test
        void shouldMatchBoardJobLinks() {
            List<Anchor> anchors = List.of(
                    new Anchor("/acme/jobs/1", "Engineer"),
                    new Anchor("/acme/j/abc", "View job"),
                    new Anchor("/acme/job-details/9", "Job details"),
                    new Anchor("/acme/benefits", "Apply"));

            assertThat(CandidateSelector.boardJobLinks(anchors))
                    .containsExactly("/acme/jobs/1", "/acme/job-details/9");
        }

        @Test
        void shouldDetectBoardHosts() {
            assertThat(CandidateSelector.boardLinks(List.of(
                    new Anchor("https://jobs.lever.co/acme", "Jobs"),
                    new Anchor("https://acme.com/team", "Team"))))
                    .containsExactly("https://jobs.lever.co/acme");
        }
    }
}
