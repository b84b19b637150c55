package com.analytics.session.pool;

import com.analytics.session.engine.DocumentHandle;

/**
 * Work run against a pooled document handle by {@link SessionPool#executeWithRetry}.
 */
@FunctionalInterface
public interface HandleOperation<H extends DocumentHandle, T> {

    T apply(H handle);
}
