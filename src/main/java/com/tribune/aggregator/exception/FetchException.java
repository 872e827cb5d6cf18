package com.tribune.aggregator.exception;

import com.tribune.aggregator.domain.enums.FetchFailureReason;
import lombok.Getter;

@Getter
public class FetchException extends RuntimeException {

    private final FetchFailureReason reason;

    public FetchException(FetchFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FetchException(String message, Throwable cause) {
        this(null, message, cause);
    }
}
