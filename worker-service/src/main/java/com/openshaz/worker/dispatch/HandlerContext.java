package com.openshaz.worker.dispatch;

import com.openshaz.worker.similarity.FeatureCache;

/**
 * State the dispatcher hands to every task handler along with the message.
 *
 * @param featureCache reference set and fitted engine, owned by the dispatcher
 * @param retryCount   how many times this job has been retried before
 */
public record HandlerContext(
        FeatureCache featureCache,
        int retryCount
) {
}
