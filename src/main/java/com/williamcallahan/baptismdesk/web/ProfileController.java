package com.williamcallahan.baptismdesk.web;

import com.williamcallahan.baptismdesk.config.AppProperties;
import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import com.williamcallahan.baptismdesk.pipeline.CertificateCombiner;
import com.williamcallahan.baptismdesk.queue.AdmissionRejectedException;
import com.williamcallahan.baptismdesk.queue.QueueStatus;
import com.williamcallahan.baptismdesk.storage.DownloadDisposition;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Profile intake, editing, batch pipeline triggers and downloads.
 *
 * <p>Every mutation goes through {@link ProfileManager}; this controller only waits for the
 * manager's answer and translates it to HTTP.</p>
 */
@RestController
@RequestMapping("/api/profiles")
public class ProfileController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ProfileController.class);

    private static final Set<String> EDITABLE_FIELDS = Set.of(
            Profile.FIELD_NAME_CN, Profile.FIELD_NAME_PINYIN, Profile.FIELD_BIRTHDAY, Profile.FIELD_BAPTISM_DATE);
    private static final String COMBINED_FILENAME = "certificates.pptx";

    private final ProfileManager profileManager;
    private final CertificateCombiner certificateCombiner;
    private final ObjectStorage storage;
    private final AppProperties appProperties;

    public ProfileController(ProfileManager profileManager, CertificateCombiner certificateCombiner,
                             ObjectStorage storage, AppProperties appProperties,
                             ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.profileManager = profileManager;
        this.certificateCombiner = certificateCombiner;
        this.storage = storage;
        this.appProperties = appProperties;
    }

    @GetMapping
    public List<Profile> listProfiles() {
        return await(profileManager.listProfiles());
    }

    @GetMapping("/{id}")
    public Profile getProfile(@PathVariable("id") String profileId) {
        return await(profileManager.getProfile(profileId));
    }

    /**
     * Queues one upload job per file. Files are staged before this returns, so the response only
     * confirms admission; results arrive on the event stream. If the queue fills partway through,
     * the 503 response says how many files were already queued.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse> uploadProfiles(@RequestParam("file") List<MultipartFile> files) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required");
        }
        for (MultipartFile file : files) {
            if (file.isEmpty()) {
                throw new IllegalArgumentException("Uploaded file " + file.getOriginalFilename() + " is empty");
            }
        }
        int queued = 0;
        for (MultipartFile file : files) {
            try (InputStream content = file.getInputStream()) {
                await(profileManager.createProfile(content));
                queued++;
            } catch (IOException e) {
                throw new IllegalArgumentException("Could not read uploaded file " + file.getOriginalFilename(), e);
            } catch (AdmissionRejectedException e) {
                if (queued == 0) {
                    throw e;
                }
                log.warn("Upload queue full after {} of {} file(s)", queued, files.size());
                return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE,
                        "Queued " + queued + " of " + files.size() + " upload(s); " + e.getMessage());
            }
        }
        log.info("Queued {} upload(s)", queued);
        return createAcceptedResponse("Queued " + queued + " upload(s)");
    }

    @PatchMapping("/{id}")
    public Profile updateProfile(@PathVariable("id") String profileId,
                                 @RequestBody Map<String, String> attributes) {
        Set<String> unknown = new TreeSet<>(attributes.keySet());
        unknown.removeAll(EDITABLE_FIELDS);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Fields are not editable: " + String.join(", ", unknown));
        }
        return await(profileManager.updateProfile(profileId, attributes));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> deleteProfile(@PathVariable("id") String profileId) {
        await(profileManager.deleteProfile(profileId));
        return createSuccessResponse("Deleted profile " + profileId);
    }

    @PostMapping("/extract")
    public ResponseEntity<ProfileBatchResponse> extractProfiles(@Valid @RequestBody(required = false) ProfileIdsRequest request) {
        List<String> queued = await(profileManager.extractProfiles(ProfileIdsRequest.idsOf(request)));
        return ResponseEntity.accepted().body(new ProfileBatchResponse(queued));
    }

    @PostMapping("/certificates")
    public ResponseEntity<ProfileBatchResponse> generateCertificates(@Valid @RequestBody ProfileIdsRequest request) {
        List<String> queued = await(profileManager.generateCertificates(requireIds(request)));
        return ResponseEntity.accepted().body(new ProfileBatchResponse(queued));
    }

    @PostMapping("/review")
    public ProfileBatchResponse markReviewed(@Valid @RequestBody ProfileIdsRequest request) {
        return new ProfileBatchResponse(await(profileManager.markReviewed(requireIds(request))));
    }

    @DeleteMapping("/review")
    public ProfileBatchResponse unmarkReviewed(@Valid @RequestBody ProfileIdsRequest request) {
        return new ProfileBatchResponse(await(profileManager.unmarkReviewed(requireIds(request))));
    }

    /**
     * Merges the certificates of the reviewed profiles among the requested ids into one deck.
     */
    @PostMapping("/certificates/combined")
    public ResponseEntity<byte[]> combineCertificates(@Valid @RequestBody(required = false) ProfileIdsRequest request) {
        List<String> reviewed = await(profileManager.reviewedProfileIds(ProfileIdsRequest.idsOf(request)));
        if (reviewed.isEmpty()) {
            throw new IllegalArgumentException("No reviewed profiles to combine");
        }
        byte[] combined = certificateCombiner.combine(reviewed);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(StorageKeys.CONTENT_TYPE_PPTX))
                .header(HttpHeaders.CONTENT_DISPOSITION, DownloadDisposition.attachment(COMBINED_FILENAME).headerValue())
                .body(combined);
    }

    @GetMapping("/queues")
    public List<QueueStatus> queueStatuses() {
        return profileManager.queueStatuses();
    }

    /**
     * Presigns read URLs for whatever artifacts the profile has so far.
     */
    @GetMapping("/{id}/links")
    public ProfileLinksResponse links(@PathVariable("id") String profileId) {
        Profile profile = await(profileManager.getProfile(profileId));
        Duration ttl = appProperties.getStorage().getPresignTtl();
        String downloadName = downloadName(profile);
        return new ProfileLinksResponse(
                profile.id(),
                presignIfPresent(StorageKeys.rawImage(profile.id()), ttl, null),
                presignIfPresent(StorageKeys.compressedImage(profile.id()), ttl, null),
                presignIfPresent(StorageKeys.headshot(profile.id()), ttl, null),
                presignIfPresent(StorageKeys.certificate(profile.id()), ttl,
                        DownloadDisposition.attachment(downloadName + ".pptx")),
                presignIfPresent(StorageKeys.certificatePreview(profile.id()), ttl,
                        DownloadDisposition.inline(downloadName + ".png")));
    }

    private String presignIfPresent(String key, Duration ttl, DownloadDisposition disposition) {
        if (!storage.exists(key)) {
            return null;
        }
        return storage.presignedGetUrl(key, ttl, disposition).toString();
    }

    private static List<String> requireIds(ProfileIdsRequest request) {
        List<String> ids = ProfileIdsRequest.idsOf(request);
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("ids must not be empty");
        }
        return ids;
    }

    private static String downloadName(Profile profile) {
        if (profile.namePinyin() != null && !profile.namePinyin().isBlank()) {
            return profile.namePinyin().trim();
        }
        return profile.id();
    }
}
