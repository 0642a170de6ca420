package com.williamcallahan.baptismdesk.queue;

import java.util.Objects;

/**
 * Result of one admitted job, delivered to the job's requester exactly once.
 *
 * <p>Failures thrown by the job body are captured here instead of escaping the worker thread, so
 * the requester always hears back and the controller always reclaims the slot.</p>
 *
 * @param <R> value produced by a successful job
 */
public sealed interface JobOutcome<R> {

    static <R> JobOutcome<R> success(R value) {
        return new Success<>(value);
    }

    static <R> JobOutcome<R> failure(Exception error) {
        return new Failure<>(error);
    }

    record Success<R>(R value) implements JobOutcome<R> {}

    record Failure<R>(Exception error) implements JobOutcome<R> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }
}
