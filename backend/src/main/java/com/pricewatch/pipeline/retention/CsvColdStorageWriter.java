package com.pricewatch.pipeline.retention;

import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.ArchiveCategory;
import com.pricewatch.pipeline.model.Snapshot;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Writes archive batches as CSV files under {@code <cold-storage-dir>/<tenant>/<category>/}.
 */
@Component
public class CsvColdStorageWriter implements ColdStorageWriter {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    static final String[] SNAPSHOT_HEADER = {
        "id", "tenant_id", "job_id", "job_run_id", "entity_ref", "price", "currency", "in_stock", "observed_at",
        "raw_metadata", "created_at"
    };
    static final String[] ALERT_HEADER = {
        "id", "event_id", "tenant_id", "snapshot_id", "entity_ref", "rule_id", "rule_type", "previous_price",
        "current_price", "delta_percent", "severity", "detected_at", "delivery_status"
    };

    private final Path root;

    public CsvColdStorageWriter(PipelineProperties properties) {
        this.root = Paths.get(properties.getRetention().getColdStorageDir());
    }

    @Override
    public String writeSnapshots(String tenantId, List<Snapshot> snapshots) throws IOException {
        Path file = newBatchFile(tenantId, ArchiveCategory.SNAPSHOTS);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(SNAPSHOT_HEADER).build())) {
            for (Snapshot snapshot : snapshots) {
                printer.printRecord(
                    snapshot.id(),
                    snapshot.tenantId(),
                    snapshot.jobId(),
                    snapshot.jobRunId(),
                    snapshot.entityRef(),
                    snapshot.price(),
                    snapshot.currency(),
                    snapshot.inStock(),
                    snapshot.observedAt(),
                    snapshot.rawMetadata(),
                    snapshot.createdAt()
                );
            }
        }
        return file.toString();
    }

    @Override
    public String writeAlerts(String tenantId, List<Alert> alerts) throws IOException {
        Path file = newBatchFile(tenantId, ArchiveCategory.ALERTS);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(ALERT_HEADER).build())) {
            for (Alert alert : alerts) {
                printer.printRecord(
                    alert.id(),
                    alert.eventId(),
                    alert.tenantId(),
                    alert.snapshotId(),
                    alert.entityRef(),
                    alert.ruleId(),
                    alert.ruleType(),
                    alert.previousPrice(),
                    alert.currentPrice(),
                    alert.deltaPercent(),
                    alert.severity(),
                    alert.detectedAt(),
                    alert.deliveryStatus() == null ? null : alert.deliveryStatus().dbValue()
                );
            }
        }
        return file.toString();
    }

    private Path newBatchFile(String tenantId, ArchiveCategory category) throws IOException {
        Path directory = root.resolve(safeSegment(tenantId)).resolve(category.dbValue());
        Files.createDirectories(directory);
        String name = FILE_STAMP.format(Instant.now()) + "-" + UUID.randomUUID() + ".csv";
        return directory.resolve(name);
    }

    private String safeSegment(String value) {
        return value == null ? "unknown" : value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
