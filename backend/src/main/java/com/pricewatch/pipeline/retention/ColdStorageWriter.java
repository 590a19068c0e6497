package com.pricewatch.pipeline.retention;

import com.pricewatch.pipeline.model.Alert;
import com.pricewatch.pipeline.model.Snapshot;

import java.io.IOException;
import java.util.List;

/**
 * Durable destination for rows leaving the live tables under the {@code archive} strategy. Each call writes
 * one self-contained batch and returns where it went.
 */
public interface ColdStorageWriter {

    String writeSnapshots(String tenantId, List<Snapshot> snapshots) throws IOException;

    String writeAlerts(String tenantId, List<Alert> alerts) throws IOException;
}
