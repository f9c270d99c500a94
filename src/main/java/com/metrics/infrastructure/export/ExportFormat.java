package com.metrics.infrastructure.export;

import com.metrics.domain.exception.InvalidRequestException;

import java.util.Locale;

public enum ExportFormat {
    CSV("csv"),
    XLSX("xlsx"),
    PARQUET("parquet");
    
    private final String extension;
    
    ExportFormat(String extension) {
        this.extension = extension;
    }
    
    public String extension() {
        return extension;
    }
    
    public static ExportFormat parse(String format) {
        if (format == null || format.isBlank()) {
            throw new InvalidRequestException("unspecified format");
        }
        try {
            return ExportFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("unknown export format '" + format + "'");
        }
    }
}
