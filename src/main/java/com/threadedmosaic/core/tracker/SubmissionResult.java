package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.exception.MosaicValidationException;

import java.util.List;

/**
 * Outcome of {@link OperationTracker#submit}. A rejected submission has no operation id.
 */
public record SubmissionResult(boolean accepted, String operationId, List<String> errors) {

    public SubmissionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SubmissionResult accepted(String operationId) {
        return new SubmissionResult(true, operationId, List.of());
    }

    public static SubmissionResult rejected(List<String> errors) {
        return new SubmissionResult(false, null, errors);
    }

    /**
     * The operation id of an accepted submission.
     *
     * @throws MosaicValidationException when the submission was rejected
     */
    public String orThrow() {
        if (!accepted) {
            throw new MosaicValidationException(errors);
        }
        return operationId;
    }
}
