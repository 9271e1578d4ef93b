package com.elssolution.meterhistory.service;

import lombok.Getter;

/** Backend-side failure that could not be served from a stale cache entry. Reported as 503. */
@Getter
public class HistoryServiceException extends RuntimeException {

    public enum Reason {
        BACKEND_UNAVAILABLE("backend_unavailable"),
        QUERY_TIMEOUT_EXHAUSTED("query_timeout_exhausted");

        private final String code;

        Reason(String code) { this.code = code; }

        public String code() { return code; }
    }

    private final Reason reason;

    public HistoryServiceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
