package com.modelregistry.api.model.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a store attempt. {@code modelId} is null when the model already existed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StoreModelResult {

    private final boolean stored;
    private final String modelId;

    public static StoreModelResult stored(String modelId) {
        return new StoreModelResult(true, modelId);
    }

    public static StoreModelResult duplicate() {
        return new StoreModelResult(false, null);
    }
}
