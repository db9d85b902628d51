package com.shoptalk.catalog.exception;

import org.springframework.http.HttpStatus;

public class CatalogException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CatalogException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public CatalogException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static CatalogException sourceUnavailable(String location, Throwable cause) {
        return new CatalogException(
                String.format("Catalog source unavailable: %s", location),
                HttpStatus.SERVICE_UNAVAILABLE,
                "CATALOG_SOURCE_UNAVAILABLE",
                cause
        );
    }

    public static CatalogException sourceUnreadable(String location, Throwable cause) {
        return new CatalogException(
                String.format("Catalog source could not be parsed: %s", location),
                HttpStatus.SERVICE_UNAVAILABLE,
                "CATALOG_SOURCE_UNREADABLE",
                cause
        );
    }

    public static CatalogException syncInProgress() {
        return new CatalogException("Catalog sync already in progress", HttpStatus.CONFLICT, "CATALOG_SYNC_IN_PROGRESS");
    }
}
