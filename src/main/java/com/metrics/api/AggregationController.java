package com.metrics.api;

import com.metrics.domain.model.AggregationRequest;
import com.metrics.domain.model.AggregationResult;
import com.metrics.domain.service.AggregationService;
import com.metrics.domain.service.ExportService;
import com.metrics.infrastructure.export.ExportFormat;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

/**
 * REST API for metrics view aggregations.
 * 
 * Endpoints:
 * - POST /api/v1/metrics-views/{view}/aggregation - Run an aggregation (optionally pivoted)
 * - POST /api/v1/metrics-views/{view}/export?format=csv - Export an aggregation
 * - GET /api/v1/health - Health check
 * 
 * The request body carries the security policy already resolved for the
 * caller by the upstream API layer.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AggregationController {
    
    private final AggregationService aggregationService;
    private final ExportService exportService;
    
    /**
     * Run an aggregation.
     * 
     * POST /api/v1/metrics-views/ad_bids/aggregation
     * 
     * Request body:
     * {
     *   "dimensions": [{"name": "domain"}, {"name": "timestamp", "timeGrain": "DAY", "timeZone": "Asia/Kolkata"}],
     *   "measures": [{"name": "impressions"}, {"name": "rows", "builtinMeasure": "COUNT"}],
     *   "where": {"cond": {"op": "IN", "exprs": [{"ident": "domain"}, {"val": "msn.com"}]}},
     *   "sort": [{"name": "impressions", "desc": true}],
     *   "limit": 10,
     *   "pivotOn": []
     * }
     * 
     * Response:
     * - schema: column names and portable types
     * - data: rows keyed by column name
     * - cached: whether result was cached
     * - queryTimeMs: execution time
     */
    @PostMapping("/metrics-views/{view}/aggregation")
    public ResponseEntity<AggregationResult> aggregate(
            @PathVariable String view,
            @Valid @RequestBody AggregationRequest request) {
        
        request.setMetricsView(view);
        log.info("Aggregate: view={}, columns={}, pivot={}", view, request.getColumnCount(), request.isPivot());
        
        return ResponseEntity.ok(aggregationService.resolve(request));
    }
    
    /**
     * Export an aggregation.
     * 
     * POST /api/v1/metrics-views/ad_bids/export?format=csv
     * 
     * The attachment filename is set just before the body is streamed.
     */
    @PostMapping("/metrics-views/{view}/export")
    public void export(
            @PathVariable String view,
            @RequestParam String format,
            @Valid @RequestBody AggregationRequest request,
            HttpServletResponse response) throws IOException {
        
        request.setMetricsView(view);
        log.info("Export: view={}, format={}", view, format);
        
        exportService.export(request, format, response.getOutputStream(), filename -> {
            String extension = ExportFormat.parse(format).extension();
            response.setHeader(HttpHeaders.CONTENT_DISPOSITION,
                    "attachment; filename=\"" + filename + "." + extension + "\"");
            response.setContentType("csv".equals(extension) ? "text/csv" : "application/octet-stream");
        });
    }
    
    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
