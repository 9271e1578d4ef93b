package com.elssolution.meterhistory.service;

import lombok.Getter;

/** Caller error; reported as 400 and never retried. */
@Getter
public class HistoryValidationException extends RuntimeException {

    public enum Reason {
        START_AFTER_END("start_after_end"),
        RANGE_TOO_LONG("range_too_long"),
        INVALID_PERIOD_KEY("invalid_period_key"),
        INVALID_TIMESTAMP("invalid_timestamp"),
        INVALID_INTERVAL("invalid_interval");

        private final String code;

        Reason(String code) { this.code = code; }

        public String code() { return code; }
    }

    private final Reason reason;

    public HistoryValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
