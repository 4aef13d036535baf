package com.portfolioanalysis.optimizer.domain.exception;

/**
 * Base exception for all portfolio engine failures.
 * Each subclass carries a stable error code that the REST layer reports to clients.
 */
public class PortfolioEngineException extends RuntimeException {

    private final String errorCode;

    public PortfolioEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PortfolioEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
