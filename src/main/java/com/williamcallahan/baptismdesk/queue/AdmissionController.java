package com.williamcallahan.baptismdesk.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded-concurrency job queue shared by the upload, extraction and certificate pipelines.
 *
 * <p>Submissions land in a FIFO backlog and never block the caller. After every submission and
 * every completion the controller drains the backlog until {@code capacity} jobs are running, so
 * no slot sits idle while work is pending and no more than {@code capacity} jobs ever run at once.
 * Dispatch order follows submission order; completion order does not.</p>
 *
 * <p>Each job runs on the supplied executor. Whatever the job body does, its outcome is handed to
 * the requester as a {@link JobOutcome} and the slot is released in a {@code finally} block.</p>
 *
 * <p>Two optional limits:</p>
 * <ul>
 *   <li>{@code maxBacklog > 0} sheds submissions once that many jobs are waiting; the requester
 *       receives a failure carrying {@link AdmissionRejectedException}.</li>
 *   <li>{@code exclusivePerKey} keeps two jobs with the same key from running concurrently. A
 *       waiting job whose key is busy is skipped over until that key completes.</li>
 * </ul>
 */
public class AdmissionController {
    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final String name;
    private final int capacity;
    private final int maxBacklog;
    private final boolean exclusivePerKey;
    private final Executor executor;

    private final Object lock = new Object();
    private final Deque<AdmittedJob<?>> backlog = new ArrayDeque<>();
    private final Map<Long, AdmittedJob<?>> active = new HashMap<>();
    private final Map<String, Integer> activeKeys = new HashMap<>();
    private final AtomicLong ticketSequence = new AtomicLong();

    /**
     * Creates a controller.
     *
     * @param name queue name used in logs and status
     * @param capacity maximum concurrently running jobs, at least 1
     * @param maxBacklog maximum waiting jobs, or 0 for an unbounded backlog
     * @param exclusivePerKey whether jobs sharing a key must run one at a time
     * @param executor runs dispatched jobs; must not run them on the submitting thread
     */
    public AdmissionController(String name, int capacity, int maxBacklog, boolean exclusivePerKey, Executor executor) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (maxBacklog < 0) {
            throw new IllegalArgumentException("maxBacklog must not be negative");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.maxBacklog = maxBacklog;
        this.exclusivePerKey = exclusivePerKey;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Queues a job and returns immediately.
     *
     * @param key job key (usually a profile id), may be null for jobs with no id yet
     * @param work job body
     * @param requester receives the job outcome exactly once
     * @param <R> job result type
     * @return true when the job was admitted, false when it was shed because the backlog is full
     */
    public <R> boolean submit(String key, Callable<R> work, Consumer<JobOutcome<R>> requester) {
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(requester, "requester");
        AdmittedJob<R> job = new AdmittedJob<>(ticketSequence.incrementAndGet(), key, work, requester);
        List<AdmittedJob<?>> ready;
        synchronized (lock) {
            if (maxBacklog > 0 && backlog.size() >= maxBacklog) {
                ready = null;
            } else {
                backlog.addLast(job);
                ready = drainLocked();
            }
        }
        if (ready == null) {
            log.warn("[{}] Rejecting job {} - backlog at limit {}", name, describe(key), maxBacklog);
            deliver(requester, JobOutcome.failure(new AdmissionRejectedException(name, maxBacklog)), key);
            return false;
        }
        start(ready);
        return true;
    }

    /**
     * Returns the current capacity, active and queued counts.
     */
    public QueueStatus status() {
        synchronized (lock) {
            return new QueueStatus(name, capacity, active.size(), backlog.size());
        }
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getMaxBacklog() {
        return maxBacklog;
    }

    private void onCompletion(long ticket) {
        List<AdmittedJob<?>> ready;
        synchronized (lock) {
            AdmittedJob<?> finished = active.remove(ticket);
            if (finished != null && finished.key != null) {
                activeKeys.computeIfPresent(finished.key, (ignored, count) -> count > 1 ? count - 1 : null);
            }
            ready = drainLocked();
        }
        start(ready);
    }

    /**
     * Moves backlog entries to the active set while capacity allows. Caller holds {@link #lock}.
     */
    private List<AdmittedJob<?>> drainLocked() {
        List<AdmittedJob<?>> ready = new ArrayList<>();
        Iterator<AdmittedJob<?>> pending = backlog.iterator();
        while (active.size() < capacity && pending.hasNext()) {
            AdmittedJob<?> candidate = pending.next();
            if (exclusivePerKey && candidate.key != null && activeKeys.containsKey(candidate.key)) {
                continue;
            }
            pending.remove();
            active.put(candidate.ticket, candidate);
            if (candidate.key != null) {
                activeKeys.merge(candidate.key, 1, Integer::sum);
            }
            ready.add(candidate);
            log.info("[{}] Started job {} ({}/{} active, {} queued)",
                    name, describe(candidate.key), active.size(), capacity, backlog.size());
        }
        return ready;
    }

    private void start(List<AdmittedJob<?>> ready) {
        for (AdmittedJob<?> job : ready) {
            try {
                executor.execute(() -> run(job));
            } catch (RejectedExecutionException rejected) {
                log.error("[{}] Executor refused job {}", name, describe(job.key), rejected);
                job.fail(rejected);
                onCompletion(job.ticket);
            }
        }
    }

    private <R> void run(AdmittedJob<R> job) {
        try {
            JobOutcome<R> outcome;
            try {
                outcome = JobOutcome.success(job.work.call());
            } catch (Exception failure) {
                log.warn("[{}] Job {} failed: {}", name, describe(job.key), failure.getMessage());
                outcome = JobOutcome.failure(failure);
            }
            deliver(job.requester, outcome, job.key);
        } finally {
            onCompletion(job.ticket);
        }
    }

    private <R> void deliver(Consumer<JobOutcome<R>> requester, JobOutcome<R> outcome, String key) {
        try {
            requester.accept(outcome);
        } catch (RuntimeException callbackFailure) {
            log.error("[{}] Requester callback for job {} threw", name, describe(key), callbackFailure);
        }
    }

    private static String describe(String key) {
        return key == null ? "<unkeyed>" : key;
    }

    private static final class AdmittedJob<R> {
        private final long ticket;
        private final String key;
        private final Callable<R> work;
        private final Consumer<JobOutcome<R>> requester;

        private AdmittedJob(long ticket, String key, Callable<R> work, Consumer<JobOutcome<R>> requester) {
            this.ticket = ticket;
            this.key = key;
            this.work = work;
            this.requester = requester;
        }

        private void fail(Exception failure) {
            try {
                requester.accept(JobOutcome.failure(failure));
            } catch (RuntimeException callbackFailure) {
                log.error("Requester callback threw while reporting executor refusal", callbackFailure);
            }
        }
    }
}
