package dev.jobharvest.sink;

import dev.jobharvest.error.HarvestException;
import dev.jobharvest.model.JobRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Append-only CSV file with the row header written once.
 */
@Slf4j
public class CsvRowSink implements RowSink {

    private final Path path;

    public CsvRowSink(Path path) {
        this.path = path;
    }

    @Override
    public synchronized void ensureHeader() {
        if (Files.exists(path) && sizeOf(path) > 0) {
            return;
        }
        write(List.of(JobRow.HEADER));
        log.info("Created {} with header", path);
    }

    @Override
    public synchronized int append(List<JobRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        ensureHeader();
        write(rows.stream().map(JobRow::cells).toList());
        log.info("Appended {} rows to {}", rows.size(), path);
        return rows.size();
    }

    @Override
    public String describe() {
        return "csv:" + path;
    }

    public Path getPath() {
        return path;
    }

    private void write(List<List<String>> records) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                for (List<String> record : records) {
                    printer.printRecord(record);
                }
            }
        } catch (IOException e) {
            throw new HarvestException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new HarvestException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
