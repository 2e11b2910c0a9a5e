package dev.jobharvest.sink;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import dev.jobharvest.config.SheetsProperties;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.JobRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Appends rows to a worksheet through the Sheets REST v4 values API.
 * A missing worksheet is created on {@link #ensureHeader()}; a freshly written
 * header row is frozen.
 */
@Slf4j
public class GoogleSheetsRowSink implements RowSink {

    private static final String SERVICE = "sheets";
    private static final String LAST_COLUMN = "I";
    private static final int NEW_SHEET_ROWS = 1000;
    private static final int NEW_SHEET_COLUMNS = 9;
    private static final ValueRange MISSING_WORKSHEET = new ValueRange(null, null, null);

    private final WebClient webClient;
    private final HarvestMetrics metrics;
    private final String spreadsheetId;
    private final String worksheet;
    private final Duration timeout;

    public GoogleSheetsRowSink(WebClient.Builder webClientBuilder, SheetsProperties properties, HarvestMetrics metrics,
                               String spreadsheetId, String worksheet) {
        this.metrics = metrics;
        this.spreadsheetId = normalizeSpreadsheetId(spreadsheetId);
        this.worksheet = worksheet;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(properties.getBaseUrl()))
                .defaultHeader("Authorization", "Bearer " + properties.getAccessToken())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    /**
     * Accepts a bare key or a full {@code docs.google.com/.../d/{id}/...} URL.
     */
    public static String normalizeSpreadsheetId(String value) {
        String id = value == null ? "" : value.strip();
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        if (id.contains("docs.google.com") && id.contains("/d/")) {
            String rest = id.substring(id.indexOf("/d/") + 3);
            int slash = rest.indexOf('/');
            id = slash == -1 ? rest : rest.substring(0, slash);
        }
        return id;
    }

    @Override
    public void ensureHeader() {
        ValueRange existing = call(webClient.get()
                .uri("/v4/spreadsheets/{id}/values/{range}", spreadsheetId, headerRange())
                .retrieve()
                .bodyToMono(ValueRange.class)
                .onErrorResume(WebClientResponseException.class, e -> isMissingWorksheet(e)
                        ? Mono.just(MISSING_WORKSHEET)
                        : Mono.<ValueRange>error(e)), "read header");

        Integer sheetId = null;
        if (existing == MISSING_WORKSHEET) {
            sheetId = addWorksheet();
        } else if (existing != null && existing.values() != null && !existing.values().isEmpty()) {
            return;
        }
        appendValues(List.of(JobRow.HEADER));
        log.info("Wrote header to worksheet '{}'", worksheet);

        if (sheetId == null) {
            sheetId = findSheetId();
        }
        if (sheetId == null) {
            log.warn("Worksheet '{}' not listed in spreadsheet {}; header row left unfrozen", worksheet, spreadsheetId);
            return;
        }
        freezeHeaderRow(sheetId);
    }

    static boolean isMissingWorksheet(WebClientResponseException e) {
        return e.getStatusCode().value() == 400 && e.getResponseBodyAsString().contains("Unable to parse range");
    }

    private Integer addWorksheet() {
        Map<String, Object> properties = Map.of(
                "title", worksheet,
                "gridProperties", Map.of("rowCount", NEW_SHEET_ROWS, "columnCount", NEW_SHEET_COLUMNS));
        JsonNode reply = batchUpdate(Map.of("addSheet", Map.of("properties", properties)), "add worksheet");
        JsonNode sheetId = reply == null ? null : reply.path("replies").path(0).path("addSheet")
                .path("properties").get("sheetId");
        log.info("Created worksheet '{}' in spreadsheet {}", worksheet, spreadsheetId);
        return sheetId != null && sheetId.canConvertToInt() ? sheetId.asInt() : null;
    }

    private Integer findSheetId() {
        JsonNode spreadsheet = call(webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/v4/spreadsheets/{id}")
                        .queryParam("fields", "sheets.properties(sheetId,title)")
                        .build(spreadsheetId))
                .retrieve()
                .bodyToMono(JsonNode.class), "list worksheets");
        if (spreadsheet == null) {
            return null;
        }
        for (JsonNode sheet : spreadsheet.path("sheets")) {
            JsonNode properties = sheet.path("properties");
            if (worksheet.equals(properties.path("title").asText()) && properties.has("sheetId")) {
                return properties.get("sheetId").asInt();
            }
        }
        return null;
    }

    private void freezeHeaderRow(int sheetId) {
        Map<String, Object> properties = Map.of(
                "sheetId", sheetId,
                "gridProperties", Map.of("frozenRowCount", 1));
        batchUpdate(Map.of("updateSheetProperties", Map.of(
                "properties", properties,
                "fields", "gridProperties.frozenRowCount")), "freeze header");
    }

    private JsonNode batchUpdate(Map<String, Object> request, String action) {
        return call(webClient.post()
                .uri("/v4/spreadsheets/{id}:batchUpdate", spreadsheetId)
                .bodyValue(Map.of("requests", List.of(request)))
                .retrieve()
                .bodyToMono(JsonNode.class), action);
    }

    @Override
    public synchronized int append(List<JobRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        appendValues(rows.stream().map(JobRow::cells).toList());
        log.info("Appended {} rows to worksheet '{}'", rows.size(), worksheet);
        return rows.size();
    }

    @Override
    public String describe() {
        return "sheets:" + spreadsheetId + "/" + worksheet;
    }

    private void appendValues(List<List<String>> values) {
        call(webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/v4/spreadsheets/{id}/values/{range}:append")
                        .queryParam("valueInputOption", "RAW")
                        .queryParam("insertDataOption", "INSERT_ROWS")
                        .build(spreadsheetId, tableRange()))
                .bodyValue(new ValueRange(tableRange(), "ROWS", values))
                .retrieve()
                .bodyToMono(String.class), "append rows");
    }

    private String headerRange() {
        return quotedWorksheet() + "!A1:" + LAST_COLUMN + "1";
    }

    private String tableRange() {
        return quotedWorksheet() + "!A1:" + LAST_COLUMN;
    }

    private String quotedWorksheet() {
        return "'" + worksheet.replace("'", "''") + "'";
    }

    private <T> T call(Mono<T> request, String action) {
        long start = System.currentTimeMillis();
        try {
            return request
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new FetchException(
                            "Sheets " + action + " timed out after " + timeout.toSeconds() + "s", e))
                    .doOnTerminate(() -> metrics.recordCallLatency(SERVICE, System.currentTimeMillis() - start))
                    .block();
        } catch (WebClientResponseException e) {
            throw new FetchException("Sheets " + action + " failed: HTTP " + e.getStatusCode().value()
                    + " - " + e.getResponseBodyAsString(), e);
        } catch (WebClientException e) {
            throw new FetchException("Sheets " + action + " failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValueRange(String range, String majorDimension, List<List<String>> values) {
    }
}
