package com.pricewatch.pipeline.catalog;

import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.TrackedEntity;

import java.util.List;

/**
 * Read-only view of the tenant's product and competitor catalog.
 */
public interface EntityCatalog {

    /**
     * Resolves the job's target into the concrete entities a run should observe.
     *
     * @throws EntityCatalogException when the catalog cannot be queried
     */
    List<TrackedEntity> resolveEntities(Job job);
}
