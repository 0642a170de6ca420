package com.williamcallahan.baptismdesk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.baptismdesk.manager.PipelineQueues;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import com.williamcallahan.baptismdesk.manager.SnapshotStore;
import com.williamcallahan.baptismdesk.pipeline.CertificateCombiner;
import com.williamcallahan.baptismdesk.pipeline.CertificatePipeline;
import com.williamcallahan.baptismdesk.pipeline.ExtractionPipeline;
import com.williamcallahan.baptismdesk.pipeline.ImageCompressor;
import com.williamcallahan.baptismdesk.pipeline.ProfileIdGenerator;
import com.williamcallahan.baptismdesk.pipeline.ScratchWorkspace;
import com.williamcallahan.baptismdesk.pipeline.UploadPipeline;
import com.williamcallahan.baptismdesk.queue.AdmissionController;
import com.williamcallahan.baptismdesk.service.ContentHasher;
import com.williamcallahan.baptismdesk.service.ExternalCommandRunner;
import com.williamcallahan.baptismdesk.service.InferenceClient;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the admission controllers, pipelines and the profile manager.
 *
 * <p>Each controller runs its jobs on a dedicated pool sized to its capacity, so a slow
 * certificate render can never take a thread an upload needs.</p>
 */
@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    static final String UPLOAD_QUEUE = "upload";
    static final String EXTRACTION_QUEUE = "extraction";
    static final String CERTIFICATE_QUEUE = "certificate";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    // Executors

    @Bean
    public ThreadPoolTaskExecutor uploadExecutor(AppProperties appProperties) {
        return poolFor(UPLOAD_QUEUE, appProperties.getQueues().getUpload());
    }

    @Bean
    public ThreadPoolTaskExecutor extractionExecutor(AppProperties appProperties) {
        return poolFor(EXTRACTION_QUEUE, appProperties.getQueues().getExtraction());
    }

    @Bean
    public ThreadPoolTaskExecutor certificateExecutor(AppProperties appProperties) {
        return poolFor(CERTIFICATE_QUEUE, appProperties.getQueues().getCertificate());
    }

    // Admission controllers

    @Bean
    public AdmissionController uploadQueue(AppProperties appProperties,
            @Qualifier("uploadExecutor") ThreadPoolTaskExecutor executor) {
        AppProperties.Queue limits = appProperties.getQueues().getUpload();
        return new AdmissionController(UPLOAD_QUEUE, limits.getCapacity(), limits.getMaxBacklog(), false, executor);
    }

    @Bean
    public AdmissionController extractionQueue(AppProperties appProperties,
            @Qualifier("extractionExecutor") ThreadPoolTaskExecutor executor) {
        AppProperties.Queue limits = appProperties.getQueues().getExtraction();
        return new AdmissionController(EXTRACTION_QUEUE, limits.getCapacity(), limits.getMaxBacklog(), false, executor);
    }

    /**
     * Certificate jobs for the same profile share scratch file names, so they run one at a time.
     */
    @Bean
    public AdmissionController certificateQueue(AppProperties appProperties,
            @Qualifier("certificateExecutor") ThreadPoolTaskExecutor executor) {
        AppProperties.Queue limits = appProperties.getQueues().getCertificate();
        return new AdmissionController(CERTIFICATE_QUEUE, limits.getCapacity(), limits.getMaxBacklog(), true, executor);
    }

    @Bean
    public PipelineQueues pipelineQueues(
            @Qualifier("uploadQueue") AdmissionController uploadQueue,
            @Qualifier("extractionQueue") AdmissionController extractionQueue,
            @Qualifier("certificateQueue") AdmissionController certificateQueue,
            ObjectProvider<MeterRegistry> meterRegistry) {
        PipelineQueues queues = new PipelineQueues(uploadQueue, extractionQueue, certificateQueue);
        meterRegistry.ifAvailable(registry -> {
            registerGauges(registry, uploadQueue);
            registerGauges(registry, extractionQueue);
            registerGauges(registry, certificateQueue);
        });
        return queues;
    }

    // Pipelines

    @Bean
    public RestTemplate inferenceRestTemplate(RestTemplateBuilder restTemplateBuilder, AppProperties appProperties) {
        return restTemplateBuilder
                .connectTimeout(appProperties.getInference().getConnectTimeout())
                .readTimeout(appProperties.getInference().getReadTimeout())
                .build();
    }

    @Bean
    public InferenceClient inferenceClient(@Qualifier("inferenceRestTemplate") RestTemplate inferenceRestTemplate,
                                           ObjectMapper objectMapper) {
        return new InferenceClient(inferenceRestTemplate, objectMapper);
    }

    @Bean
    public ProfileIdGenerator profileIdGenerator(ContentHasher contentHasher) {
        return new ProfileIdGenerator(contentHasher, new SecureRandom());
    }

    @Bean
    public UploadPipeline uploadPipeline(ObjectStorage objectStorage, ProfileIdGenerator profileIdGenerator,
            ImageCompressor imageCompressor, ScratchWorkspace scratchWorkspace) {
        return new UploadPipeline(objectStorage, profileIdGenerator, imageCompressor, scratchWorkspace);
    }

    @Bean
    public ExtractionPipeline extractionPipeline(InferenceClient inferenceClient) {
        return new ExtractionPipeline(inferenceClient);
    }

    @Bean
    public CertificatePipeline certificatePipeline(ObjectStorage objectStorage, ExternalCommandRunner commandRunner,
            ScratchWorkspace scratchWorkspace, AppProperties appProperties, Clock clock) {
        return new CertificatePipeline(objectStorage, commandRunner, scratchWorkspace, appProperties.getCertificate(),
                clock);
    }

    @Bean
    public CertificateCombiner certificateCombiner(ObjectStorage objectStorage, ExternalCommandRunner commandRunner,
            ScratchWorkspace scratchWorkspace, AppProperties appProperties) {
        return new CertificateCombiner(objectStorage, commandRunner, scratchWorkspace, appProperties.getCertificate());
    }

    // State owner

    @Bean
    public SnapshotStore snapshotStore(ObjectStorage objectStorage, ObjectMapper objectMapper, Clock clock) {
        return new SnapshotStore(objectStorage, objectMapper, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ProfileManager profileManager(
            PipelineQueues pipelineQueues,
            UploadPipeline uploadPipeline,
            ExtractionPipeline extractionPipeline,
            CertificatePipeline certificatePipeline,
            ObjectStorage objectStorage,
            SnapshotStore snapshotStore,
            ScratchWorkspace scratchWorkspace,
            AppProperties appProperties) {
        ProfileManager manager = new ProfileManager(pipelineQueues, uploadPipeline, extractionPipeline,
                certificatePipeline, objectStorage, snapshotStore, scratchWorkspace,
                appProperties.getInference().getDefaultUrl());
        if (appProperties.getSnapshot().isLoadOnStartup()) {
            manager.loadSnapshot().join();
        } else {
            logger.info("Snapshot loading disabled; starting with an empty profile collection");
        }
        return manager;
    }

    private static ThreadPoolTaskExecutor poolFor(String queueName, AppProperties.Queue limits) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(limits.getCapacity());
        executor.setMaxPoolSize(limits.getCapacity());
        executor.setThreadNamePrefix(queueName + "-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    private static void registerGauges(MeterRegistry registry, AdmissionController controller) {
        Gauge.builder("baptismdesk.queue.active", controller, queue -> queue.status().active())
                .tag("queue", controller.getName())
                .description("Jobs currently running")
                .register(registry);
        Gauge.builder("baptismdesk.queue.queued", controller, queue -> queue.status().queued())
                .tag("queue", controller.getName())
                .description("Jobs waiting for a free slot")
                .register(registry);
        Gauge.builder("baptismdesk.queue.capacity", controller, AdmissionController::getCapacity)
                .tag("queue", controller.getName())
                .register(registry);
    }
}
