package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a staged upload into a stored, content-addressed profile.
 *
 * <p>The staged file is deleted whatever happens. On failure the claimed id is released and any
 * raw image already stored is removed, so the same bytes can be uploaded again.</p>
 */
public class UploadPipeline {

    private static final Logger log = LoggerFactory.getLogger(UploadPipeline.class);

    private final ObjectStorage storage;
    private final ProfileIdGenerator idGenerator;
    private final ImageCompressor imageCompressor;
    private final ScratchWorkspace workspace;

    public UploadPipeline(ObjectStorage storage, ProfileIdGenerator idGenerator, ImageCompressor imageCompressor,
            ScratchWorkspace workspace) {
        this.storage = storage;
        this.idGenerator = idGenerator;
        this.imageCompressor = imageCompressor;
        this.workspace = workspace;
    }

    /**
     * Hashes, deduplicates and stores one upload.
     *
     * @param stagedFile local copy of the uploaded bytes, deleted before returning
     * @param reservations ids already in use; the new id is claimed here
     * @return new profile in status {@code uploaded}
     * @throws UploadPipelineException if any step fails
     */
    public Profile upload(Path stagedFile, IdReservations reservations) {
        String profileId = null;
        boolean rawStored = false;
        try {
            String candidate = idGenerator.candidateId(stagedFile);
            profileId = idGenerator.resolve(candidate, reservations::reserve);
            if (!profileId.equals(candidate)) {
                log.info("Upload collides with existing id {}, stored as {}", candidate, profileId);
            }

            storage.putFile(StorageKeys.rawImage(profileId), stagedFile, StorageKeys.CONTENT_TYPE_JPEG);
            rawStored = true;
            byte[] compressed = imageCompressor.compress(stagedFile);
            storage.put(StorageKeys.compressedImage(profileId), compressed, StorageKeys.CONTENT_TYPE_JPEG);

            log.info("Stored upload {} ({} byte derivative)", profileId, compressed.length);
            return Profile.uploaded(profileId);
        } catch (IOException | RuntimeException failure) {
            if (rawStored) {
                removeQuietly(StorageKeys.rawImage(profileId));
            }
            reservations.release(profileId);
            throw new UploadPipelineException(profileId, describe(failure), failure);
        } finally {
            workspace.deleteQuietly(stagedFile);
        }
    }

    private void removeQuietly(String key) {
        try {
            storage.delete(key);
        } catch (ObjectStorageException e) {
            log.warn("Failed to remove partial upload {}: {}", key, e.getMessage());
        }
    }

    private static String describe(Exception failure) {
        Throwable root = failure instanceof UncheckedIOException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        String message = root.getMessage();
        return message == null || message.isBlank() ? "Upload failed: " + root.getClass().getSimpleName()
                : "Upload failed: " + message;
    }
}
