package com.williamcallahan.baptismdesk.manager;

import com.williamcallahan.baptismdesk.domain.ExtractionFields;
import com.williamcallahan.baptismdesk.domain.ManagerState;
import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.domain.ProfileEvent;
import com.williamcallahan.baptismdesk.domain.ProfileStatus;
import com.williamcallahan.baptismdesk.pipeline.CertificatePipeline;
import com.williamcallahan.baptismdesk.pipeline.CertificateResult;
import com.williamcallahan.baptismdesk.pipeline.CertificateStepException;
import com.williamcallahan.baptismdesk.pipeline.ExtractionPipeline;
import com.williamcallahan.baptismdesk.pipeline.IdReservations;
import com.williamcallahan.baptismdesk.pipeline.ScratchWorkspace;
import com.williamcallahan.baptismdesk.pipeline.UploadPipeline;
import com.williamcallahan.baptismdesk.pipeline.UploadPipelineException;
import com.williamcallahan.baptismdesk.queue.AdmissionRejectedException;
import com.williamcallahan.baptismdesk.queue.JobOutcome;
import com.williamcallahan.baptismdesk.queue.QueueStatus;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Sole owner of the profile collection and its configuration.
 *
 * <p>All state lives on one thread. Every public method posts a task to that thread and returns a
 * {@link CompletableFuture}; pipeline completions are posted back the same way, so mutations are
 * applied strictly in arrival order and never race. Slow work (storage, inference, rendering)
 * runs in the admission controllers, never here.</p>
 *
 * <p>Each accepted mutation updates the collection, notifies the registered subscriber and hands
 * the new snapshot to the {@link SnapshotStore}. A failing task fails only its own future.</p>
 */
public class ProfileManager {

    private static final Logger log = LoggerFactory.getLogger(ProfileManager.class);

    static final String THREAD_NAME_PREFIX = "profile-manager-";

    private final PipelineQueues queues;
    private final UploadPipeline uploadPipeline;
    private final ExtractionPipeline extractionPipeline;
    private final CertificatePipeline certificatePipeline;
    private final ObjectStorage storage;
    private final SnapshotStore snapshotStore;
    private final ScratchWorkspace workspace;
    private final String defaultInferenceUrl;
    private final IdReservations reservations = new IdReservations();
    private final ExecutorService actor =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory(THREAD_NAME_PREFIX));

    // Confined to the actor thread.
    private ManagerState state = ManagerState.empty();
    private ProfileEventListener subscriber;
    private final Set<String> pendingDeletes = new HashSet<>();

    public ProfileManager(
            PipelineQueues queues,
            UploadPipeline uploadPipeline,
            ExtractionPipeline extractionPipeline,
            CertificatePipeline certificatePipeline,
            ObjectStorage storage,
            SnapshotStore snapshotStore,
            ScratchWorkspace workspace,
            String defaultInferenceUrl) {
        this.queues = Objects.requireNonNull(queues, "queues");
        this.uploadPipeline = Objects.requireNonNull(uploadPipeline, "uploadPipeline");
        this.extractionPipeline = Objects.requireNonNull(extractionPipeline, "extractionPipeline");
        this.certificatePipeline = Objects.requireNonNull(certificatePipeline, "certificatePipeline");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.defaultInferenceUrl = Objects.requireNonNull(defaultInferenceUrl, "defaultInferenceUrl");
    }

    /**
     * Replaces the in-memory state with the persisted snapshot.
     */
    public CompletableFuture<Integer> loadSnapshot() {
        return onActor(() -> {
            state = snapshotStore.load();
            reservations.reserveAll(profileIds(state.profiles()));
            log.info("Profile manager ready with {} profiles", state.profiles().size());
            return state.profiles().size();
        });
    }

    /**
     * Stops accepting tasks and lets queued ones and pending snapshot writes finish.
     */
    public void shutdown() {
        actor.shutdown();
        try {
            if (!actor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Profile manager did not drain within 10s");
                actor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            actor.shutdownNow();
        }
        snapshotStore.close();
    }

    // Reads

    public CompletableFuture<List<Profile>> listProfiles() {
        return onActor(() -> state.profiles());
    }

    public CompletableFuture<Profile> getProfile(String profileId) {
        return onActor(() -> requireProfile(profileId));
    }

    public CompletableFuture<ManagerState> snapshot() {
        return onActor(() -> state);
    }

    /**
     * Effective inference endpoint: the stored override, else the configured default.
     */
    public CompletableFuture<String> getInferenceUrl() {
        return onActor(this::effectiveInferenceUrl);
    }

    public CompletableFuture<Map<String, String>> getCertificateConfig() {
        return onActor(() -> state.certificateConfig());
    }

    /**
     * Ids of reviewed profiles among {@code requestedIds}, in collection order. An empty request
     * selects every reviewed profile.
     */
    public CompletableFuture<List<String>> reviewedProfileIds(Collection<String> requestedIds) {
        return onActor(() -> selectIds(requestedIds, profile -> profile.status() == ProfileStatus.REVIEWED));
    }

    public List<QueueStatus> queueStatuses() {
        return queues.statuses();
    }

    // Subscriber

    /**
     * Makes {@code listener} the only subscriber, replacing any previous one. The new subscriber
     * first receives the current collection so it never starts from an empty view.
     */
    public CompletableFuture<Void> registerSubscriber(ProfileEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        return onActor(() -> {
            ProfileEventListener previous = subscriber;
            subscriber = listener;
            if (previous != null && previous != listener) {
                log.info("Replacing profile event subscriber");
                try {
                    previous.onReplaced();
                } catch (RuntimeException e) {
                    log.warn("Replaced subscriber failed to detach: {}", e.getMessage());
                }
            }
            publish(new ProfileEvent.ProfilesUpdated(state.profiles()));
            return null;
        });
    }

    /**
     * Detaches {@code listener} if it is still the current subscriber.
     */
    public CompletableFuture<Boolean> clearSubscriber(ProfileEventListener listener) {
        return onActor(() -> {
            if (subscriber != null && subscriber == listener) {
                subscriber = null;
                return true;
            }
            return false;
        });
    }

    // Upload

    /**
     * Stages the upload and queues it. The staged copy is taken before returning, so the caller
     * may discard its stream right away.
     *
     * @param content uploaded image bytes
     * @return completed future, or one failed with {@link AdmissionRejectedException} when the
     *     upload queue is full
     */
    public CompletableFuture<Void> createProfile(InputStream content) {
        Path staged = workspace.stage(content, ".jpg");
        boolean admitted = queues.upload().submit(null,
                () -> uploadPipeline.upload(staged, reservations),
                outcome -> post(() -> onUploadFinished(outcome)));
        if (!admitted) {
            workspace.deleteQuietly(staged);
            return CompletableFuture.failedFuture(
                    new AdmissionRejectedException(queues.upload().getName(), queues.upload().getMaxBacklog()));
        }
        return CompletableFuture.completedFuture(null);
    }

    // Edits

    /**
     * Applies a manual field edit. Status is not editable.
     */
    public CompletableFuture<Profile> updateProfile(String profileId, Map<String, String> attributes) {
        return onActor(() -> {
            Profile updated = requireProfile(profileId).merge(attributes);
            state = state.replace(profileId, ignored -> updated);
            publish(new ProfileEvent.ProfileUpdated(updated));
            persist();
            return updated;
        });
    }

    /**
     * Removes a profile's stored artifacts, then the profile itself. The returned future
     * completes once the profile has left the collection.
     *
     * <p>Artifact removal goes through the certificate queue under the profile's key, so it runs
     * after any certificate job already queued for that profile and cannot be undone by one.
     * No new extraction or certificate job is accepted for the profile meanwhile.</p>
     */
    public CompletableFuture<Void> deleteProfile(String profileId) {
        CompletableFuture<Void> removed = new CompletableFuture<>();
        onActor(() -> {
            requireProfile(profileId);
            pendingDeletes.add(profileId);
            queues.certificate().submit(profileId,
                    () -> deleteArtifacts(profileId),
                    outcome -> {
                        if (outcome instanceof JobOutcome.Failure<Integer> failure) {
                            post(() -> pendingDeletes.remove(profileId));
                            removed.completeExceptionally(failure.error());
                        } else {
                            post(() -> {
                                onArtifactsDeleted(profileId);
                                removed.complete(null);
                            });
                        }
                    });
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                removed.completeExceptionally(unwrap(error));
            }
        });
        return removed;
    }

    // Extraction

    /**
     * Queues extraction for each eligible id: {@code uploaded} profiles, or {@code extracted}
     * ones being re-read. An empty request extracts every {@code uploaded} profile.
     *
     * @return ids actually queued
     */
    public CompletableFuture<List<String>> extractProfiles(Collection<String> requestedIds) {
        return onActor(() -> {
            List<String> eligible = requestedIds == null || requestedIds.isEmpty()
                    ? selectIds(List.of(), profile -> profile.status() == ProfileStatus.UPLOADED
                            && !pendingDeletes.contains(profile.id()))
                    : selectRequested(requestedIds, profile -> profile.status() == ProfileStatus.UPLOADED
                            || profile.status() == ProfileStatus.EXTRACTED);
            String inferenceUrl = effectiveInferenceUrl();
            List<String> queued = new ArrayList<>(eligible.size());
            for (String profileId : eligible) {
                boolean admitted = queues.extraction().submit(profileId,
                        () -> extractionPipeline.extract(profileId, inferenceUrl),
                        outcome -> post(() -> onExtractionFinished(profileId, outcome)));
                if (admitted) {
                    queued.add(profileId);
                }
            }
            log.info("Queued extraction for {} of {} requested profiles", queued.size(), eligible.size());
            return queued;
        });
    }

    // Certificates

    /**
     * Queues certificate generation for each {@code extracted} or {@code generated} id, using the
     * profile fields and layout configuration as they are now. An empty request queues nothing.
     *
     * @return ids actually queued
     */
    public CompletableFuture<List<String>> generateCertificates(Collection<String> requestedIds) {
        return onActor(() -> {
            Map<String, String> layout = state.certificateConfig();
            List<String> queued = new ArrayList<>();
            for (String profileId : selectRequested(requestedIds, profile -> profile.status() == ProfileStatus.EXTRACTED
                    || profile.status() == ProfileStatus.GENERATED)) {
                Profile profile = state.find(profileId).orElseThrow();
                boolean admitted = queues.certificate().submit(profileId,
                        () -> certificatePipeline.generate(profile, layout),
                        outcome -> post(() -> onCertificateFinished(profileId, outcome)));
                if (admitted) {
                    queued.add(profileId);
                }
            }
            log.info("Queued certificate generation for {} profiles", queued.size());
            return queued;
        });
    }

    // Review

    /**
     * Moves {@code generated} profiles among the ids to {@code reviewed}. An empty request
     * changes nothing.
     *
     * @return ids that changed
     */
    public CompletableFuture<List<String>> markReviewed(Collection<String> requestedIds) {
        return onActor(() -> transitionAll(requestedIds, ProfileStatus.GENERATED, ProfileStatus.REVIEWED));
    }

    /**
     * Moves {@code reviewed} profiles among the ids back to {@code generated}. An empty request
     * changes nothing.
     *
     * @return ids that changed
     */
    public CompletableFuture<List<String>> unmarkReviewed(Collection<String> requestedIds) {
        return onActor(() -> transitionAll(requestedIds, ProfileStatus.REVIEWED, ProfileStatus.GENERATED));
    }

    // Configuration

    /**
     * Stores an inference endpoint override; blank clears it back to the default.
     *
     * @return the effective URL after the change
     */
    public CompletableFuture<String> setInferenceUrl(String url) {
        return onActor(() -> {
            String override = url == null || url.isBlank() ? null : url.trim();
            state = state.withInferenceUrl(override);
            String effective = effectiveInferenceUrl();
            publish(new ProfileEvent.InferenceUrlUpdated(effective));
            persist();
            return effective;
        });
    }

    /**
     * Replaces the layout configuration. Blank values are dropped so the built-in default applies.
     */
    public CompletableFuture<Map<String, String>> setCertificateConfig(Map<String, String> config) {
        return onActor(() -> {
            Map<String, String> cleaned = new LinkedHashMap<>();
            if (config != null) {
                config.forEach((field, spec) -> {
                    if (field != null && spec != null && !spec.isBlank()) {
                        cleaned.put(field, spec.trim());
                    }
                });
            }
            state = state.withCertificateConfig(cleaned);
            publish(new ProfileEvent.CertificateConfigUpdated(state.certificateConfig()));
            persist();
            return state.certificateConfig();
        });
    }

    /**
     * Stores a new certificate template and drops the locally cached copy.
     */
    public CompletableFuture<Void> replaceTemplate(byte[] template) {
        CompletableFuture<Void> stored = new CompletableFuture<>();
        queues.upload().submit(StorageKeys.TEMPLATE,
                () -> {
                    storage.put(StorageKeys.TEMPLATE, template, StorageKeys.CONTENT_TYPE_PPTX);
                    certificatePipeline.invalidateTemplateCache();
                    return template.length;
                },
                outcome -> {
                    if (outcome instanceof JobOutcome.Failure<Integer> failure) {
                        stored.completeExceptionally(failure.error());
                    } else {
                        log.info("Certificate template replaced ({} bytes)", template.length);
                        stored.complete(null);
                    }
                });
        return stored;
    }

    // Completions, always run on the actor thread

    private void onUploadFinished(JobOutcome<Profile> outcome) {
        if (outcome instanceof JobOutcome.Success<Profile> success) {
            Profile profile = success.value();
            if (state.contains(profile.id())) {
                log.warn("Upload produced id {} that is already present, ignoring", profile.id());
                return;
            }
            state = state.prepend(profile);
            publish(new ProfileEvent.ProfilesUpdated(state.profiles()));
            persist();
        } else if (outcome instanceof JobOutcome.Failure<Profile> failure) {
            Exception error = failure.error();
            String profileId = error instanceof UploadPipelineException uploadFailure ? uploadFailure.getProfileId() : null;
            log.warn("Upload failed{}: {}", profileId == null ? "" : " for " + profileId, error.getMessage());
            publish(new ProfileEvent.UploadFailed(profileId, error.getMessage()));
        }
    }

    private void onExtractionFinished(String profileId, JobOutcome<ExtractionFields> outcome) {
        Optional<Profile> current = state.find(profileId);
        if (current.isEmpty()) {
            log.debug("Dropping extraction result for deleted profile {}", profileId);
            return;
        }
        if (outcome instanceof JobOutcome.Failure<ExtractionFields> failure) {
            publish(new ProfileEvent.ExtractionFailed(profileId, failure.error().getMessage()));
            return;
        }
        ExtractionFields fields = ((JobOutcome.Success<ExtractionFields>) outcome).value();
        Profile profile = current.get();
        Profile updated;
        if (profile.status() == ProfileStatus.UPLOADED) {
            updated = profile.withExtraction(fields).withStatus(ProfileStatus.EXTRACTED);
        } else if (profile.status() == ProfileStatus.EXTRACTED) {
            updated = profile.withExtraction(fields);
        } else {
            log.info("Ignoring extraction result for {} in status {}", profileId, profile.status().wireName());
            return;
        }
        state = state.replace(profileId, ignored -> updated);
        publish(new ProfileEvent.ProfileUpdated(updated));
        persist();
    }

    private void onCertificateFinished(String profileId, JobOutcome<CertificateResult> outcome) {
        Optional<Profile> current = state.find(profileId);
        if (current.isEmpty()) {
            log.debug("Dropping certificate result for deleted profile {}", profileId);
            return;
        }
        if (outcome instanceof JobOutcome.Failure<CertificateResult> failure) {
            Exception error = failure.error();
            String step = error instanceof CertificateStepException stepFailure ? stepFailure.getStep() : "queue";
            publish(new ProfileEvent.CertificateFailed(profileId, step, error.getMessage()));
            return;
        }
        Profile profile = current.get();
        if (profile.status() == ProfileStatus.EXTRACTED) {
            Profile updated = profile.withStatus(ProfileStatus.GENERATED);
            state = state.replace(profileId, ignored -> updated);
            publish(new ProfileEvent.ProfileUpdated(updated));
            persist();
        } else if (profile.status() == ProfileStatus.GENERATED) {
            // Regenerated: artifacts changed, state did not.
            publish(new ProfileEvent.ProfileUpdated(profile));
        } else {
            log.info("Ignoring certificate result for {} in status {}", profileId, profile.status().wireName());
        }
    }

    private void onArtifactsDeleted(String profileId) {
        if (!state.contains(profileId)) {
            pendingDeletes.remove(profileId);
            return;
        }
        pendingDeletes.remove(profileId);
        state = state.remove(profileId);
        reservations.release(profileId);
        log.info("Deleted profile {}", profileId);
        publish(new ProfileEvent.ProfilesUpdated(state.profiles()));
        persist();
    }

    // Helpers

    private int deleteArtifacts(String profileId) {
        int failures = 0;
        for (String key : StorageKeys.profileArtifacts(profileId)) {
            try {
                storage.delete(key);
            } catch (ObjectStorageException e) {
                failures++;
                log.warn("Failed to delete {} for profile {}: {}", key, profileId, e.getMessage());
            }
        }
        return failures;
    }

    private List<String> transitionAll(Collection<String> requestedIds, ProfileStatus from, ProfileStatus to) {
        List<String> eligible = selectRequested(requestedIds, profile -> profile.status() == from);
        if (eligible.isEmpty()) {
            return List.of();
        }
        Set<String> changing = new LinkedHashSet<>(eligible);
        List<Profile> updated = state.profiles().stream()
                .map(profile -> changing.contains(profile.id()) && profile.status().canTransitionTo(to)
                        ? profile.withStatus(to)
                        : profile)
                .collect(Collectors.toList());
        state = state.withProfiles(updated);
        publish(new ProfileEvent.ProfilesUpdated(state.profiles()));
        persist();
        return eligible;
    }

    /**
     * Ids of profiles matching {@code eligible}, in collection order. An empty request means all
     * profiles; unknown ids are dropped.
     */
    private List<String> selectIds(Collection<String> requestedIds, Predicate<Profile> eligible) {
        Set<String> requested = requestedIds == null ? Set.of() : new LinkedHashSet<>(requestedIds);
        return state.profiles().stream()
                .filter(profile -> requested.isEmpty() || requested.contains(profile.id()))
                .filter(eligible)
                .map(Profile::id)
                .collect(Collectors.toList());
    }

    /**
     * Ids among {@code requestedIds} matching {@code eligible}, in collection order. Unlike
     * {@link #selectIds}, an empty request selects nothing, and profiles being deleted are skipped.
     */
    private List<String> selectRequested(Collection<String> requestedIds, Predicate<Profile> eligible) {
        if (requestedIds == null || requestedIds.isEmpty()) {
            return List.of();
        }
        return selectIds(requestedIds, eligible.and(profile -> !pendingDeletes.contains(profile.id())));
    }

    private Profile requireProfile(String profileId) {
        return state.find(profileId).orElseThrow(() -> new ProfileNotFoundException(profileId));
    }

    private String effectiveInferenceUrl() {
        return state.inferenceUrl() == null ? defaultInferenceUrl : state.inferenceUrl();
    }

    private void publish(ProfileEvent event) {
        ProfileEventListener current = subscriber;
        if (current == null) {
            return;
        }
        try {
            current.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed to handle {}: {}", event.type(), e.getMessage());
        }
    }

    private void persist() {
        snapshotStore.save(state);
    }

    private static List<String> profileIds(List<Profile> profiles) {
        return profiles.stream().map(Profile::id).collect(Collectors.toList());
    }

    private <T> CompletableFuture<T> onActor(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            actor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Profile manager is shut down", e));
        }
        return result;
    }

    /**
     * Posts a completion message. Failures are logged since nobody waits on the result.
     */
    private void post(Runnable message) {
        onActor(() -> {
            message.run();
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Profile manager task failed", error);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
    }
}
