package com.feedblend.common.exception;

/**
 * Raised when an injection strategy type is not one of the recognised values.
 * This is the only hard failure in the merge path.
 */
public class UnknownStrategyException extends BlendException {
    private final String strategyType;

    public UnknownStrategyException(String strategyType) {
        super("TimelineMerger", "Unknown injection strategy: '" + strategyType + "'");
        this.strategyType = strategyType;
    }

    public String getStrategyType() {
        return strategyType;
    }
}
