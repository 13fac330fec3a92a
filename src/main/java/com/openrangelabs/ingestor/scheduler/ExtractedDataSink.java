package com.openrangelabs.ingestor.scheduler;

import com.openrangelabs.ingestor.entity.IngestionJobDefinition;
import com.openrangelabs.ingestor.model.DataRow;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Receives the rows a job run produced, after transformation.
 */
public interface ExtractedDataSink {

    Mono<Void> accept(IngestionJobDefinition job, List<DataRow> rows);
}
