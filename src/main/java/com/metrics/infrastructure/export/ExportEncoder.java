package com.metrics.infrastructure.export;

import com.metrics.domain.model.AggregationResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serialises a result set into one export format.
 */
public interface ExportEncoder {
    
    ExportFormat format();
    
    void write(AggregationResult result, OutputStream out) throws IOException;
}
