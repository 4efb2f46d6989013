package com.platform.wafoperator.store;

import com.platform.wafoperator.model.Resource;

/**
 * Outcome of an upsert: the write performed and the object as stored.
 */
public record UpsertResult<T extends Resource<T>>(UpsertOperation operation, T resource) {
}
