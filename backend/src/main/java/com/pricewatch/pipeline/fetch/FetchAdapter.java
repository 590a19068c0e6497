package com.pricewatch.pipeline.fetch;

import com.pricewatch.pipeline.model.FetchResult;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TrackedEntity;

import java.util.List;

/**
 * Retrieves observations for a batch of entities from one kind of external source. Implementations are
 * selected by the job's {@link SourceType}.
 */
public interface FetchAdapter {

    SourceType sourceType();

    /**
     * Number of entities handed to a single {@link #fetch} call for this job.
     */
    default int batchSize(Job job) {
        return 1;
    }

    /**
     * Fetches one batch. Entities that could not be observed are reported in the result's error map; a failure
     * that affects the whole batch is thrown.
     */
    FetchResult fetch(Job job, List<TrackedEntity> entities) throws FetchAdapterException;
}
