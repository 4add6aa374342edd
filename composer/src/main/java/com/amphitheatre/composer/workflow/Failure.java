package com.amphitheatre.composer.workflow;

import com.amphitheatre.composer.model.ErrorClass;

/**
 * A failure the engine decided on.
 *
 * @param consumeRetry whether the failure uses one unit of the retry budget
 */
public record Failure(ErrorClass errorClass, String message, boolean retryable, boolean consumeRetry) {
}
