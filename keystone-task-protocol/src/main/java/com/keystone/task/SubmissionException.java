package com.keystone.task;

/** Thrown when a task specification is malformed (missing tool or script) or the queue refuses it. */
public final class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
