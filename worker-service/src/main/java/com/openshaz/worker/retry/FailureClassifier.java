package com.openshaz.worker.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openshaz.common.exception.JobValidationException;

/**
 * Splits handler failures into terminal ones, which fail the same way on every attempt, and
 * everything else, which is worth retrying.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static boolean isTerminal(Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof JobValidationException
                    || current instanceof IllegalArgumentException
                    || current instanceof JsonProcessingException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
