package com.feedblend.common.exception;

/**
 * Raised when a {@link com.feedblend.common.model.WeightConfig} carries a negative
 * weight or a negative decay window.
 */
public class InvalidWeightConfigException extends BlendException {

    public InvalidWeightConfigException(String message) {
        super("ScoreModel", message);
    }
}
