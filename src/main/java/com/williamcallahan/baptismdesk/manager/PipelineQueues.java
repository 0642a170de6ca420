package com.williamcallahan.baptismdesk.manager;

import com.williamcallahan.baptismdesk.queue.AdmissionController;
import com.williamcallahan.baptismdesk.queue.QueueStatus;
import java.util.List;
import java.util.Objects;

/**
 * The three admission controllers the profile manager feeds.
 *
 * @param upload uploads, profile deletions and template replacement
 * @param extraction inference calls
 * @param certificate certificate rendering, one job per profile at a time
 */
public record PipelineQueues(AdmissionController upload, AdmissionController extraction,
        AdmissionController certificate) {

    public PipelineQueues {
        Objects.requireNonNull(upload, "upload");
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(certificate, "certificate");
    }

    public List<QueueStatus> statuses() {
        return List.of(upload.status(), extraction.status(), certificate.status());
    }
}
