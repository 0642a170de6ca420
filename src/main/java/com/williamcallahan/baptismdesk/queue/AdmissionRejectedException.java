package com.williamcallahan.baptismdesk.queue;

/**
 * Signals that a controller's backlog is at its configured limit and a submission was shed.
 */
public class AdmissionRejectedException extends RuntimeException {

    private final String queueName;

    public AdmissionRejectedException(String queueName, int backlogLimit) {
        super("Queue '" + queueName + "' is full (backlog limit " + backlogLimit + ")");
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
