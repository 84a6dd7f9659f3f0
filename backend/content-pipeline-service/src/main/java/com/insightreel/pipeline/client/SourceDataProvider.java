package com.insightreel.pipeline.client;

import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.entity.ResearchSource;

/**
 * Raw collector contract. Implementations throw
 * {@link com.insightreel.pipeline.exception.TransientExternalException} for
 * retryable failures and
 * {@link com.insightreel.pipeline.exception.PermanentExternalException} otherwise.
 */
public interface SourceDataProvider {

    RawDataset collect(ResearchSource source, String query, int maxItems);
}
