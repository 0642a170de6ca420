package com.williamcallahan.baptismdesk.queue;

/**
 * Point-in-time view of one admission controller.
 *
 * @param name queue name
 * @param capacity maximum concurrently running jobs
 * @param active jobs currently running
 * @param queued jobs waiting in the backlog
 */
public record QueueStatus(String name, int capacity, int active, int queued) {}
