package com.williamcallahan.baptismdesk.manager;

import static com.williamcallahan.baptismdesk.manager.ManagerTestSupport.image;
import static com.williamcallahan.baptismdesk.manager.ManagerTestSupport.join;
import static com.williamcallahan.baptismdesk.manager.ManagerTestSupport.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.baptismdesk.config.AppProperties;
import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.domain.ProfileEvent;
import com.williamcallahan.baptismdesk.domain.ProfileStatus;
import com.williamcallahan.baptismdesk.manager.ManagerTestSupport.RecordingListener;
import com.williamcallahan.baptismdesk.pipeline.CertificateCombiner;
import com.williamcallahan.baptismdesk.pipeline.CertificatePipeline;
import com.williamcallahan.baptismdesk.pipeline.ExtractionPipeline;
import com.williamcallahan.baptismdesk.pipeline.ImageCompressor;
import com.williamcallahan.baptismdesk.pipeline.ProfileIdGenerator;
import com.williamcallahan.baptismdesk.pipeline.ScratchWorkspace;
import com.williamcallahan.baptismdesk.pipeline.ScriptedCommandRunner;
import com.williamcallahan.baptismdesk.pipeline.UploadPipeline;
import com.williamcallahan.baptismdesk.queue.AdmissionController;
import com.williamcallahan.baptismdesk.service.ContentHasher;
import com.williamcallahan.baptismdesk.service.InferenceClient;
import com.williamcallahan.baptismdesk.service.OcrResult;
import com.williamcallahan.baptismdesk.storage.InMemoryObjectStorage;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Walks two profiles from upload to a combined deck with every pipeline wired for real except
 * the inference endpoint and the external render tools, then restarts from the snapshot.
 */
class ProfileLifecycleScenarioTest {

    private static final String INFERENCE_URL = "http://inference.test";

    @TempDir
    Path tempDir;

    private final InferenceClient inferenceClient = mock(InferenceClient.class);
    private final ContentHasher hasher = new ContentHasher();
    private final ScriptedCommandRunner commandRunner = new ScriptedCommandRunner();

    private ExecutorService executor;
    private InMemoryObjectStorage storage;
    private ScratchWorkspace workspace;
    private AppProperties.Certificate certificateSettings;
    private ProfileManager manager;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        storage = new InMemoryObjectStorage();
        workspace = new ScratchWorkspace();
        certificateSettings = new AppProperties.Certificate();
        certificateSettings.setWorkDir(tempDir.resolve("certificates").toString());
        storage.put(StorageKeys.TEMPLATE, "template".getBytes(StandardCharsets.UTF_8), StorageKeys.CONTENT_TYPE_PPTX);
        manager = startManager();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        executor.shutdownNow();
    }

    @Test
    void profilesTravelFromUploadToCombinedDeckAndSurviveRestart() {
        RecordingListener listener = new RecordingListener();
        join(manager.registerSubscriber(listener));
        byte[] firstImage = image(0x102030);
        byte[] secondImage = image(0x405060);
        String first = hasher.sha256(firstImage).substring(0, 8);
        String second = hasher.sha256(secondImage).substring(0, 8);
        given(inferenceClient.extract(eq(INFERENCE_URL), anyString()))
                .willReturn(new OcrResult("孙建芬", "Sun Jian Fen", "1990-01-02", "2024-04-07"));

        // Upload
        join(manager.createProfile(new ByteArrayInputStream(firstImage)));
        join(manager.createProfile(new ByteArrayInputStream(secondImage)));
        waitUntil("both uploads", () -> join(manager.listProfiles()).size() == 2);
        assertTrue(statuses().values().stream().allMatch(ProfileStatus.UPLOADED::equals));

        // Extract
        assertEquals(2, join(manager.extractProfiles(List.of())).size());
        waitUntil("both extractions", () -> statuses().values().stream().allMatch(ProfileStatus.EXTRACTED::equals));
        Profile extracted = join(manager.getProfile(first));
        assertEquals("Sun, JianFen", extracted.namePinyin());
        assertEquals(LocalDate.of(1990, 1, 2), extracted.birthday());

        // Certificates need the headshot produced outside this service
        storage.put(StorageKeys.headshot(first), new byte[] {1}, StorageKeys.CONTENT_TYPE_JPEG);
        storage.put(StorageKeys.headshot(second), new byte[] {2}, StorageKeys.CONTENT_TYPE_JPEG);
        assertEquals(2, join(manager.generateCertificates(List.of(first, second))).size());
        waitUntil("both certificates", () -> statuses().values().stream().allMatch(ProfileStatus.GENERATED::equals));
        assertTrue(storage.exists(StorageKeys.certificate(first)));
        assertTrue(storage.exists(StorageKeys.certificatePreview(second)));

        // Review one and combine
        assertEquals(List.of(second), join(manager.markReviewed(List.of(second))));
        List<String> reviewed = join(manager.reviewedProfileIds(List.of()));
        assertEquals(List.of(second), reviewed);
        CertificateCombiner combiner = new CertificateCombiner(storage, commandRunner, workspace, certificateSettings);
        assertEquals("pptx:output_" + second + ".pptx|",
                new String(combiner.combine(reviewed), StandardCharsets.UTF_8));

        // Delete the other
        join(manager.deleteProfile(first));
        assertFalse(storage.exists(StorageKeys.rawImage(first)));
        assertFalse(storage.exists(StorageKeys.certificate(first)));
        assertTrue(listener.eventsOf(ProfileEvent.ExtractionFailed.class).isEmpty());
        assertTrue(listener.eventsOf(ProfileEvent.CertificateFailed.class).isEmpty());

        // Restart from the persisted snapshot
        manager.shutdown();
        manager = startManager();
        assertEquals(1, join(manager.loadSnapshot()));
        Profile restored = join(manager.getProfile(second));
        assertEquals(ProfileStatus.REVIEWED, restored.status());
        assertEquals("孙建芬", restored.nameCn());
        assertEquals(LocalDate.of(2024, 4, 7), restored.baptismDate());
    }

    @Test
    void reuploadAfterDeleteGetsOriginalIdBack() {
        byte[] bytes = image(0x777777);
        String id = hasher.sha256(bytes).substring(0, 8);

        join(manager.createProfile(new ByteArrayInputStream(bytes)));
        waitUntil("first upload", () -> join(manager.listProfiles()).size() == 1);
        join(manager.createProfile(new ByteArrayInputStream(bytes)));
        waitUntil("duplicate upload", () -> join(manager.listProfiles()).size() == 2);
        assertTrue(join(manager.listProfiles()).get(0).id().startsWith("dup_"));

        join(manager.deleteProfile(id));
        join(manager.createProfile(new ByteArrayInputStream(bytes)));
        waitUntil("re-upload", () -> join(manager.listProfiles()).stream().anyMatch(p -> p.id().equals(id)));
    }

    private ProfileManager startManager() {
        PipelineQueues queues = new PipelineQueues(
                new AdmissionController("upload", 3, 0, false, executor),
                new AdmissionController("extraction", 2, 0, false, executor),
                new AdmissionController("certificate", 3, 0, true, executor));
        UploadPipeline uploadPipeline = new UploadPipeline(storage,
                new ProfileIdGenerator(hasher, new Random()), new ImageCompressor(), workspace);
        CertificatePipeline certificatePipeline =
                new CertificatePipeline(storage, commandRunner, workspace, certificateSettings, Clock.systemUTC());
        SnapshotStore snapshotStore = new SnapshotStore(storage, new ObjectMapper(), Clock.systemUTC());
        ProfileManager started = new ProfileManager(queues, uploadPipeline, new ExtractionPipeline(inferenceClient),
                certificatePipeline, storage, snapshotStore, workspace, INFERENCE_URL);
        join(started.loadSnapshot());
        return started;
    }

    private Map<String, ProfileStatus> statuses() {
        return join(manager.listProfiles()).stream().collect(Collectors.toMap(Profile::id, Profile::status));
    }
}
