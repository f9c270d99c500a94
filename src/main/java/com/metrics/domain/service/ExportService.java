package com.metrics.domain.service;

import com.metrics.domain.exception.InvalidRequestException;
import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.model.MetricsViewSpec;
import com.metrics.infrastructure.export.ExportEncoder;
import com.metrics.infrastructure.export.ExportFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Exports an aggregation through the encoder registered for the format.
 * 
 * The output filename derives from the view's table name, suffixed with
 * {@code _filtered} when the request constrains rows. The pre-write hook
 * sees the filename before any byte is written.
 */
@Slf4j
@Service
public class ExportService {
    
    private final AggregationService aggregationService;
    private final MetricsViewCatalog catalog;
    private final Map<ExportFormat, ExportEncoder> encoders = new EnumMap<>(ExportFormat.class);
    
    public ExportService(AggregationService aggregationService, MetricsViewCatalog catalog,
                         List<ExportEncoder> encoders) {
        this.aggregationService = aggregationService;
        this.catalog = catalog;
        for (ExportEncoder encoder : encoders) {
            this.encoders.put(encoder.format(), encoder);
        }
    }
    
    public void export(AggregationRequest request, String format, OutputStream out, PreWriteHook preWriteHook)
            throws IOException {
        ExportFormat exportFormat = ExportFormat.parse(format);
        ExportEncoder encoder = encoders.get(exportFormat);
        if (encoder == null) {
            throw new InvalidRequestException("export format '" + exportFormat.extension() + "' not supported");
        }
        
        AggregationResult result = aggregationService.resolve(request);
        
        String filename = filename(catalog.get(request.getMetricsView()), request);
        if (preWriteHook != null) {
            preWriteHook.beforeWrite(filename);
        }
        
        encoder.write(result, out);
        
        log.info("Exported {} rows of {} as {}", result.getData().size(), request.getMetricsView(), exportFormat);
    }
    
    static String filename(MetricsViewSpec view, AggregationRequest request) {
        String filename = view.getTable().replace("\"", "_");
        if (request.isConstrained()) {
            filename += "_filtered";
        }
        return filename;
    }
    
    @FunctionalInterface
    public interface PreWriteHook {
        
        void beforeWrite(String filename) throws IOException;
    }
}
