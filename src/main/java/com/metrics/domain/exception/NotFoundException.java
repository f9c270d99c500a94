package com.metrics.domain.exception;

public class NotFoundException extends MetricsQueryException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public static NotFoundException dimension(String view, String name) {
        return new NotFoundException("dimension '" + name + "' not found in metrics view '" + view + "'");
    }
    
    public static NotFoundException measure(String view, String name) {
        return new NotFoundException("measure '" + name + "' not found in metrics view '" + view + "'");
    }
    
    public static NotFoundException view(String name) {
        return new NotFoundException("metrics view '" + name + "' not found");
    }
}
