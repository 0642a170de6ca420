package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.config.AppProperties;
import com.williamcallahan.baptismdesk.service.CommandResult;
import com.williamcallahan.baptismdesk.service.ExternalCommandRunner;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges stored certificates into one presentation for printing.
 *
 * <p>Certificates that cannot be downloaded are skipped with a warning; the merge fails only when
 * none could be fetched or the merge process itself fails.</p>
 */
public class CertificateCombiner {

    private static final Logger log = LoggerFactory.getLogger(CertificateCombiner.class);

    static final String COMBINE_SCRIPT = "combine_certificates.py";
    static final String COMBINE_SCRIPT_RESOURCE = "scripts/" + COMBINE_SCRIPT;
    static final String OUTPUT_FILE = "combined.pptx";

    private final ObjectStorage storage;
    private final ExternalCommandRunner commandRunner;
    private final ScratchWorkspace workspace;
    private final AppProperties.Certificate settings;

    public CertificateCombiner(ObjectStorage storage, ExternalCommandRunner commandRunner, ScratchWorkspace workspace,
            AppProperties.Certificate settings) {
        this.storage = storage;
        this.commandRunner = commandRunner;
        this.workspace = workspace;
        this.settings = settings;
    }

    /**
     * Downloads the certificates of the given profiles and merges them in the given order.
     *
     * @param profileIds profiles whose certificates are merged
     * @return merged pptx bytes
     * @throws CertificateCombineException if nothing could be downloaded or the merge fails
     */
    public byte[] combine(List<String> profileIds) {
        Path tempDir = null;
        try {
            tempDir = workspace.createTempDirectory("combine-certificates-");
            List<String> inputs = downloadAll(profileIds, tempDir);
            if (inputs.isEmpty()) {
                throw new CertificateCombineException("No certificates could be downloaded");
            }

            workspace.copyResource(COMBINE_SCRIPT_RESOURCE, tempDir.resolve(COMBINE_SCRIPT));
            List<String> command = new ArrayList<>();
            command.add(settings.getPythonCommand());
            command.add(COMBINE_SCRIPT);
            command.add(OUTPUT_FILE);
            command.addAll(inputs);
            CommandResult result = commandRunner.run(command, tempDir, settings.getCombineTimeout());
            if (!result.succeeded()) {
                throw new CertificateCombineException("Failed to combine certificates (exit code "
                        + result.exitCode() + "): " + result.output().strip());
            }

            Path output = tempDir.resolve(OUTPUT_FILE);
            if (!Files.exists(output)) {
                throw new CertificateCombineException("Combine process produced no output");
            }
            byte[] combined = Files.readAllBytes(output);
            log.info("Combined {} of {} certificates ({} bytes)", inputs.size(), profileIds.size(), combined.length);
            return combined;
        } catch (IOException e) {
            throw new CertificateCombineException("Failed to combine certificates: " + e.getMessage(), e);
        } finally {
            workspace.deleteRecursively(tempDir);
        }
    }

    private List<String> downloadAll(List<String> profileIds, Path tempDir) {
        List<String> inputs = new ArrayList<>(profileIds.size());
        for (int index = 0; index < profileIds.size(); index++) {
            String profileId = profileIds.get(index);
            String fileName = "input_" + index + ".pptx";
            try {
                storage.download(StorageKeys.certificate(profileId), tempDir.resolve(fileName));
                inputs.add(fileName);
            } catch (ObjectStorageException e) {
                log.warn("Skipping certificate {}: {}", profileId, e.getMessage());
            }
        }
        return inputs;
    }
}
