package dev.jobharvest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.ai.ExtractionOracle;
import dev.jobharvest.ai.JobSchemas;
import dev.jobharvest.ai.OracleRequest;
import dev.jobharvest.ats.AtsParser;
import dev.jobharvest.ats.AtsParserRegistry;
import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.fetch.PageFetcher;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.ExtractedJob;
import dev.jobharvest.model.JobFields;
import dev.jobharvest.model.PageContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobFieldExtractorTest {

    private static final String JOB_URL = "https://acme.com/jobs/1";
    private static final String FIELDS_JSON = """
            {
              "title": "Platform Engineer",
              "company_name": "Acme",
              "location": "Berlin",
              "remote_ok": null,
              "job_type": "Full Time",
              "description_html": "<p>Run the platform</p>",
              "min_salary": 70000,
              "max_salary": null,
              "application_link": "/apply"
            }
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private AtsParserRegistry parserRegistry;

    @Mock
    private AtsParser parser;

    @Mock
    private PageFetcher pageFetcher;

    @Mock
    private ExtractionOracle oracle;

    @Mock
    private HarvestMetrics metrics;

    private HarvestProperties harvestProperties;
    private JobFieldExtractor extractor;

    @BeforeEach
    void setUp() {
        harvestProperties = new HarvestProperties();
        OracleProperties oracleProperties = new OracleProperties();
        oracleProperties.setModelJobFields("fields/model");
        extractor = new JobFieldExtractor(parserRegistry, pageFetcher, oracle, new JobSchemas(objectMapper),
                harvestProperties, oracleProperties, metrics, objectMapper);
    }

    @Test
    @DisplayName("Should use a matching ATS parser without fetching the page")
    void shouldPreferAtsParser() {
        ExtractedJob parsed = new ExtractedJob(JobFields.builder().title("Machinist").build(),
                "https://acme.bamboohr.com/careers/1", "", "bamboohr");
        when(parserRegistry.find(JOB_URL)).thenReturn(Optional.of(parser));
        when(parser.parse(JOB_URL)).thenReturn(parsed);

        ExtractedJob job = extractor.extract(JOB_URL);

        assertThat(job).isSameAs(parsed);
        verifyNoInteractions(pageFetcher, oracle);
        verify(metrics).recordExtraction("bamboohr");
    }

    @Test
    @DisplayName("Should fall back to generic extraction when the parser fails")
    void shouldFallBackWhenParserFails() throws Exception {
        when(parserRegistry.find(JOB_URL)).thenReturn(Optional.of(parser));
        when(parser.getName()).thenReturn("bamboohr");
        when(parser.parse(JOB_URL)).thenThrow(new FetchException("BambooHR detail payload missing 'jobOpening'"));
        when(pageFetcher.fetch(JOB_URL)).thenReturn(
                new PageContent(JOB_URL, "<html>Remote role</html>", List.of(), "https://acme.com/jobs/platform"));
        when(oracle.completeJson(any(OracleRequest.class))).thenReturn(objectMapper.readTree(FIELDS_JSON));

        ExtractedJob job = extractor.extract(JOB_URL);

        assertThat(job.extractor()).isEqualTo("generic");
        assertThat(job.canonicalUrl()).isEqualTo("https://acme.com/jobs/platform");
        assertThat(job.pageHtml()).isEqualTo("<html>Remote role</html>");
        assertThat(job.fields().getTitle()).isEqualTo("Platform Engineer");
        assertThat(job.fields().getRemoteOk()).isNull();
        assertThat(job.fields().getMinSalary()).isEqualTo(70000.0);
        assertThat(job.fields().getMaxSalary()).isNull();
        verify(metrics).recordExtraction("generic");
    }

    @Test
    @DisplayName("Should send a truncated page payload and the field model to the oracle")
    void shouldBuildGenericRequest() throws Exception {
        harvestProperties.setHtmlPayloadLimit(10);
        when(parserRegistry.find(JOB_URL)).thenReturn(Optional.empty());
        when(pageFetcher.fetch(JOB_URL)).thenReturn(
                new PageContent(JOB_URL, "0123456789abcdef", List.of(), null));
        when(oracle.completeJson(any(OracleRequest.class))).thenReturn(objectMapper.readTree(FIELDS_JSON));

        ExtractedJob job = extractor.extract(JOB_URL);

        ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
        verify(oracle).completeJson(captor.capture());
        OracleRequest request = captor.getValue();
        assertThat(request.model()).isEqualTo("fields/model");
        assertThat(request.userPrompt())
                .contains("\"Job URL\":\"" + JOB_URL + "\"")
                .contains("\"Canonical URL\":\"" + JOB_URL + "\"")
                .contains("\"HTML\":\"0123456789\"")
                .doesNotContain("abcdef");
        assertThat(request.systemPrompt()).contains("description_html");
        assertThat(job.canonicalUrl()).isEqualTo(JOB_URL);
    }

    @Test
    void shouldPropagateOracleFailure() {
        when(parserRegistry.find(JOB_URL)).thenReturn(Optional.empty());
        when(pageFetcher.fetch(JOB_URL)).thenReturn(new PageContent(JOB_URL, "<html/>", List.of(), null));
        when(oracle.completeJson(any(OracleRequest.class)))
                .thenThrow(new ExtractionException("openrouter failed to produce valid JSON after 5 attempts"));

        assertThatThrownBy(() -> extractor.extract(JOB_URL))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("after 5 attempts");
    }

    @Test
    void shouldPropagatePageFetchFailure() {
        when(parserRegistry.find(JOB_URL)).thenReturn(Optional.empty());
        when(pageFetcher.fetch(JOB_URL)).thenThrow(new FetchException("Firecrawl error: timeout"));

        assertThatThrownBy(() -> extractor.extract(JOB_URL))
                .isInstanceOf(FetchException.class);
        verifyNoInteractions(oracle);
    }
}
