package dev.jobharvest.sink;

import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.config.SheetsProperties;
import dev.jobharvest.error.ConfigurationException;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.PipelineRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;

/**
 * Chooses the sink of a run: the dry-run file when requested, else the configured sink type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowSinkFactory {

    private final WebClient.Builder webClientBuilder;
    private final HarvestProperties harvestProperties;
    private final SheetsProperties sheetsProperties;
    private final HarvestMetrics metrics;

    /**
     * @throws ConfigurationException when the sheets sink lacks a spreadsheet id or access token
     */
    public RowSink create(PipelineRequest request) {
        HarvestProperties.Sink sink = harvestProperties.getSink();
        RowSink rowSink;
        if (request.dryRun()) {
            rowSink = new CsvRowSink(Path.of(sink.getDryRunPath()));
        } else {
            rowSink = switch (sink.getType()) {
                case NONE -> new NoOpRowSink();
                case CSV -> new CsvRowSink(Path.of(sink.getCsvPath()));
                case SHEETS -> createSheetsSink(request);
            };
        }
        log.info("Rows will be written to {}", rowSink.describe());
        return rowSink;
    }

    private RowSink createSheetsSink(PipelineRequest request) {
        String spreadsheetId = firstNonBlank(request.spreadsheetId(), sheetsProperties.getSpreadsheetId());
        if (spreadsheetId == null) {
            throw new ConfigurationException("A spreadsheet id is required unless running in dry-run mode "
                    + "(set sheets.spreadsheet-id)");
        }
        if (sheetsProperties.getAccessToken() == null || sheetsProperties.getAccessToken().isBlank()) {
            throw new ConfigurationException("Sheets access token is missing (set GOOGLE_SHEETS_ACCESS_TOKEN)");
        }
        String worksheet = firstNonBlank(request.worksheet(), sheetsProperties.getWorksheet());
        return new GoogleSheetsRowSink(webClientBuilder.clone(), sheetsProperties, metrics, spreadsheetId,
                worksheet == null ? "Jobs" : worksheet);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
