package dev.jobharvest.sink;

import dev.jobharvest.config.SheetsProperties;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.JobRow;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class GoogleSheetsRowSinkTest {

    private MockWebServer mockWebServer;
    private GoogleSheetsRowSink sink;

    @Mock
    private HarvestMetrics metrics;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        SheetsProperties properties = new SheetsProperties();
        properties.setBaseUrl("http://localhost:" + mockWebServer.getPort());
        properties.setAccessToken("sheets-token");
        properties.setTimeoutSeconds(5);
        sink = new GoogleSheetsRowSink(WebClient.builder(), properties, metrics, "sheet123", "Jobs");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockWebServer.enqueue(new MockResponse().setBody(body).addHeader("Content-Type", "application/json"));
    }

    private static String decodedPath(RecordedRequest request) {
        return URLDecoder.decode(request.getPath(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should write and freeze the header when the first row is empty")
    void shouldWriteMissingHeader() throws InterruptedException {
        enqueueJson("{\"range\": \"'Jobs'!A1:I1\", \"majorDimension\": \"ROWS\"}");
        enqueueJson("{\"spreadsheetId\": \"sheet123\"}");
        enqueueJson("""
                {"sheets": [
                  {"properties": {"sheetId": 0, "title": "Leads"}},
                  {"properties": {"sheetId": 42, "title": "Jobs"}}
                ]}
                """);
        enqueueJson("{\"spreadsheetId\": \"sheet123\", \"replies\": [{}]}");

        sink.ensureHeader();

        RecordedRequest read = mockWebServer.takeRequest();
        assertThat(read.getMethod()).isEqualTo("GET");
        assertThat(decodedPath(read)).isEqualTo("/v4/spreadsheets/sheet123/values/'Jobs'!A1:I1");
        assertThat(read.getHeader("Authorization")).isEqualTo("Bearer sheets-token");

        RecordedRequest write = mockWebServer.takeRequest();
        assertThat(write.getMethod()).isEqualTo("POST");
        assertThat(decodedPath(write))
                .startsWith("/v4/spreadsheets/sheet123/values/'Jobs'!A1:I:append")
                .contains("valueInputOption=RAW")
                .contains("insertDataOption=INSERT_ROWS");
        assertThat(write.getBody().readUtf8()).contains("\"Title\"", "\"Application Link\"", "\"ROWS\"");

        RecordedRequest list = mockWebServer.takeRequest();
        assertThat(list.getMethod()).isEqualTo("GET");
        assertThat(decodedPath(list)).startsWith("/v4/spreadsheets/sheet123?fields=sheets.properties");

        RecordedRequest freeze = mockWebServer.takeRequest();
        assertThat(decodedPath(freeze)).isEqualTo("/v4/spreadsheets/sheet123:batchUpdate");
        String freezeBody = freeze.getBody().readUtf8();
        assertThat(freezeBody).contains("updateSheetProperties", "\"sheetId\":42", "\"frozenRowCount\":1",
                "gridProperties.frozenRowCount");
    }

    @Test
    @DisplayName("Should create a missing worksheet, then write and freeze its header")
    void shouldCreateMissingWorksheet() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(400)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"error\": {\"code\": 400, \"message\": \"Unable to parse range: 'Jobs'!A1:I1\"}}"));
        enqueueJson("""
                {"replies": [{"addSheet": {"properties": {"sheetId": 777, "title": "Jobs"}}}]}
                """);
        enqueueJson("{\"spreadsheetId\": \"sheet123\"}");
        enqueueJson("{\"replies\": [{}]}");

        sink.ensureHeader();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(4);
        mockWebServer.takeRequest();

        RecordedRequest addSheet = mockWebServer.takeRequest();
        assertThat(decodedPath(addSheet)).isEqualTo("/v4/spreadsheets/sheet123:batchUpdate");
        assertThat(addSheet.getBody().readUtf8()).contains("addSheet", "\"title\":\"Jobs\"",
                "\"rowCount\":1000", "\"columnCount\":9");

        assertThat(decodedPath(mockWebServer.takeRequest())).contains(":append");

        RecordedRequest freeze = mockWebServer.takeRequest();
        assertThat(freeze.getBody().readUtf8()).contains("\"sheetId\":777", "\"frozenRowCount\":1");
    }

    @Test
    void shouldFailOnOtherBadRequests() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(400)
                .setBody("{\"error\": {\"message\": \"Invalid spreadsheet\"}}"));

        assertThatThrownBy(() -> sink.ensureHeader())
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("Sheets read header failed: HTTP 400");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave an existing header alone")
    void shouldKeepExistingHeader() {
        enqueueJson("{\"range\": \"'Jobs'!A1:I1\", \"values\": [[\"Title\", \"Company Name\"]]}");

        sink.ensureHeader();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldAppendRowsInOrder() throws InterruptedException {
        enqueueJson("{\"updates\": {\"updatedRows\": 2}}");

        int appended = sink.append(List.of(
                new JobRow("Engineer", "Acme", "Berlin", "TRUE", "Full Time", "<p>x</p>", "70000", "", "https://a/1"),
                new JobRow("Designer", "Acme", "Paris", "FALSE", "", "<p>y</p>", "", "", "https://a/2")));

        assertThat(appended).isEqualTo(2);
        String body = mockWebServer.takeRequest().getBody().readUtf8();
        assertThat(body.indexOf("Engineer")).isLessThan(body.indexOf("Designer"));
    }

    @Test
    void shouldNotCallApiForEmptyBatch() {
        assertThat(sink.append(List.of())).isZero();
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void shouldFailWithStatusAndBodyOnHttpError() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(403)
                .setBody("{\"error\": {\"status\": \"PERMISSION_DENIED\"}}"));

        assertThatThrownBy(() -> sink.append(List.of(
                new JobRow("Engineer", "Acme", "", "FALSE", "", "", "", "", "https://a/1"))))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("Sheets append rows failed: HTTP 403")
                .hasMessageContaining("PERMISSION_DENIED");
    }

    @Test
    void shouldNormalizeSpreadsheetUrls() {
        assertThat(GoogleSheetsRowSink.normalizeSpreadsheetId(
                "https://docs.google.com/spreadsheets/d/1AbC_dEf/edit#gid=0")).isEqualTo("1AbC_dEf");
        assertThat(GoogleSheetsRowSink.normalizeSpreadsheetId(" 1AbC_dEf/ ")).isEqualTo("1AbC_dEf");
        assertThat(sink.describe()).isEqualTo("sheets:sheet123/Jobs");
    }
}
