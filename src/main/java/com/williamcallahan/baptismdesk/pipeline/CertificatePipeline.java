package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.config.AppProperties;
import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.service.CommandResult;
import com.williamcallahan.baptismdesk.service.ExternalCommandRunner;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a certificate and its PNG preview for one profile and stores both.
 *
 * <p>Generation is a fixed chain of named steps that stops at the first failure. Whatever
 * happens, the per-profile files in the work directory are deleted afterwards. All files carry
 * the profile id in their names, so jobs for different profiles share the directory safely; the
 * certificate queue keeps jobs for the same profile from overlapping. Each job renders from its
 * own copy of the cached template, so replacing the template never disturbs a running job.</p>
 */
public class CertificatePipeline {

    private static final Logger log = LoggerFactory.getLogger(CertificatePipeline.class);

    public static final String STEP_PREPARE_WORKSPACE = "prepare-workspace";
    public static final String STEP_FETCH_TEMPLATE = "fetch-template";
    public static final String STEP_FETCH_HEADSHOT = "fetch-headshot";
    public static final String STEP_RENDER_DOCUMENT = "render-document";
    public static final String STEP_CONVERT_PREVIEW = "convert-preview";
    public static final String STEP_UPLOAD_DOCUMENT = "upload-document";
    public static final String STEP_UPLOAD_PREVIEW = "upload-preview";

    static final String RENDER_SCRIPT = "render_certificate.py";
    static final String RENDER_SCRIPT_RESOURCE = "scripts/" + RENDER_SCRIPT;

    private final ObjectStorage storage;
    private final ExternalCommandRunner commandRunner;
    private final ScratchWorkspace workspace;
    private final AppProperties.Certificate settings;
    private final Clock clock;
    private final Path workDir;
    private final Object workDirLock = new Object();
    private final List<Step> steps = List.of(
            new Step(STEP_PREPARE_WORKSPACE, this::prepareWorkspace),
            new Step(STEP_FETCH_TEMPLATE, this::fetchTemplate),
            new Step(STEP_FETCH_HEADSHOT, this::fetchHeadshot),
            new Step(STEP_RENDER_DOCUMENT, this::renderDocument),
            new Step(STEP_CONVERT_PREVIEW, this::convertPreview),
            new Step(STEP_UPLOAD_DOCUMENT, this::uploadDocument),
            new Step(STEP_UPLOAD_PREVIEW, this::uploadPreview));

    public CertificatePipeline(ObjectStorage storage, ExternalCommandRunner commandRunner, ScratchWorkspace workspace,
            AppProperties.Certificate settings, Clock clock) {
        this.storage = storage;
        this.commandRunner = commandRunner;
        this.workspace = workspace;
        this.settings = settings;
        this.clock = clock;
        this.workDir = Paths.get(settings.getWorkDir());
    }

    /**
     * Runs every step for a profile.
     *
     * @param profile profile to render
     * @param layoutConfig layout overrides, may be empty
     * @return keys of the stored document and preview
     * @throws CertificateStepException naming the first step that failed
     */
    public CertificateResult generate(Profile profile, Map<String, String> layoutConfig) {
        Job job = new Job(profile, layoutConfig == null ? Map.of() : layoutConfig);
        try {
            for (Step step : steps) {
                runStep(step, job);
            }
            log.info("Generated certificate for {}", profile.id());
            return new CertificateResult(profile.id(), StorageKeys.certificate(profile.id()),
                    StorageKeys.certificatePreview(profile.id()));
        } finally {
            cleanup(profile.id());
        }
    }

    /**
     * Drops the locally cached template so the next job downloads the current one.
     */
    public void invalidateTemplateCache() {
        synchronized (workDirLock) {
            workspace.deleteQuietly(workDir.resolve(CertificateInstructions.templateFileName()));
        }
        log.info("Certificate template cache invalidated");
    }

    public Path getWorkDir() {
        return workDir;
    }

    private void runStep(Step step, Job job) {
        log.debug("Certificate {} step {}", job.profile.id(), step.name);
        try {
            step.action.run(job);
        } catch (CertificateStepException failure) {
            throw failure;
        } catch (Exception failure) {
            String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
            throw new CertificateStepException(step.name, step.name + " failed: " + message, failure);
        }
    }

    private void prepareWorkspace(Job job) throws IOException {
        synchronized (workDirLock) {
            workspace.ensureDirectory(workDir);
            workspace.copyResource(RENDER_SCRIPT_RESOURCE, workDir.resolve(RENDER_SCRIPT));
        }
    }

    private void fetchTemplate(Job job) throws IOException {
        Path jobCopy = workDir.resolve(CertificateInstructions.jobTemplateFileName(job.profile.id()));
        synchronized (workDirLock) {
            Path template = workDir.resolve(CertificateInstructions.templateFileName());
            if (!Files.exists(template)) {
                log.info("Downloading certificate template into {}", workDir);
                storage.download(StorageKeys.TEMPLATE, template);
            }
            Files.copy(template, jobCopy, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void fetchHeadshot(Job job) {
        String id = job.profile.id();
        storage.download(StorageKeys.headshot(id), workDir.resolve(CertificateInstructions.headshotFileName(id)));
    }

    private void renderDocument(Job job) throws IOException {
        String id = job.profile.id();
        Path input = workDir.resolve(CertificateInstructions.inputFileName(id));
        try {
            Files.writeString(input, CertificateInstructions.build(job.profile, job.layoutConfig, clock),
                    StandardCharsets.UTF_8);
            CommandResult result = commandRunner.run(
                    List.of(settings.getPythonCommand(), RENDER_SCRIPT, input.getFileName().toString()),
                    workDir, settings.getRenderTimeout());
            requireSuccess(STEP_RENDER_DOCUMENT, result);
        } finally {
            workspace.deleteQuietly(input);
        }
    }

    private void convertPreview(Job job) throws IOException {
        String id = job.profile.id();
        CommandResult result = commandRunner.run(
                List.of(settings.getSofficeCommand(), "--headless", "--convert-to", "png",
                        CertificateInstructions.outputFileName(id)),
                workDir, settings.getConvertTimeout());
        requireSuccess(STEP_CONVERT_PREVIEW, result);

        Path expected = workDir.resolve(CertificateInstructions.previewFileName(id));
        Path pageSuffixed = workDir.resolve("output_" + id + "_1.png");
        if (Files.exists(expected)) {
            return;
        }
        if (Files.exists(pageSuffixed)) {
            log.debug("Renaming {} to {}", pageSuffixed.getFileName(), expected.getFileName());
            workspace.moveIntoPlace(pageSuffixed, expected);
            return;
        }
        throw new CertificateStepException(STEP_CONVERT_PREVIEW,
                "Preview not found: expected " + expected.getFileName() + " or " + pageSuffixed.getFileName(),
                result.exitCode(), result.output());
    }

    private void uploadDocument(Job job) {
        String id = job.profile.id();
        storage.putFile(StorageKeys.certificate(id), workDir.resolve(CertificateInstructions.outputFileName(id)),
                StorageKeys.CONTENT_TYPE_PPTX);
    }

    private void uploadPreview(Job job) {
        String id = job.profile.id();
        storage.putFile(StorageKeys.certificatePreview(id), workDir.resolve(CertificateInstructions.previewFileName(id)),
                StorageKeys.CONTENT_TYPE_PNG);
    }

    private static void requireSuccess(String step, CommandResult result) {
        if (result.succeeded()) {
            return;
        }
        String reason = result.timedOut() ? "timed out" : "exited with code " + result.exitCode();
        throw new CertificateStepException(step, step + " " + reason + ": " + result.output().strip(),
                result.exitCode(), result.output());
    }

    private void cleanup(String profileId) {
        workspace.deleteQuietly(
                workDir.resolve(CertificateInstructions.jobTemplateFileName(profileId)),
                workDir.resolve(CertificateInstructions.headshotFileName(profileId)),
                workDir.resolve(CertificateInstructions.outputFileName(profileId)),
                workDir.resolve(CertificateInstructions.previewFileName(profileId)),
                workDir.resolve("output_" + profileId + "_1.png"),
                workDir.resolve(CertificateInstructions.inputFileName(profileId)));
    }

    @FunctionalInterface
    private interface StepAction {
        void run(Job job) throws Exception;
    }

    private static final class Step {
        private final String name;
        private final StepAction action;

        private Step(String name, StepAction action) {
            this.name = name;
            this.action = action;
        }
    }

    private static final class Job {
        private final Profile profile;
        private final Map<String, String> layoutConfig;

        private Job(Profile profile, Map<String, String> layoutConfig) {
            this.profile = profile;
            this.layoutConfig = layoutConfig;
        }
    }
}
