package com.williamcallahan.baptismdesk.web;

import com.williamcallahan.baptismdesk.config.AppProperties;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import com.williamcallahan.baptismdesk.storage.DownloadDisposition;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.IOException;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Operator settings: inference endpoint, certificate layout and the certificate template.
 */
@RestController
@RequestMapping("/api/settings")
public class SettingsController extends BaseController {

    private static final String TEMPLATE_SUFFIX = ".pptx";

    private final ProfileManager profileManager;
    private final ObjectStorage storage;
    private final AppProperties appProperties;

    public SettingsController(ProfileManager profileManager, ObjectStorage storage, AppProperties appProperties,
                              ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.profileManager = profileManager;
        this.storage = storage;
        this.appProperties = appProperties;
    }

    @GetMapping("/inference-url")
    public InferenceUrlResponse getInferenceUrl() {
        return new InferenceUrlResponse(await(profileManager.getInferenceUrl()));
    }

    @PutMapping("/inference-url")
    public InferenceUrlResponse setInferenceUrl(@RequestBody InferenceUrlRequest request) {
        String url = request.url();
        if (url != null && !url.isBlank() && !url.trim().matches("(?i)https?://\\S+")) {
            throw new IllegalArgumentException("Inference URL must be an http(s) URL");
        }
        return new InferenceUrlResponse(await(profileManager.setInferenceUrl(url)));
    }

    @GetMapping("/certificate-config")
    public Map<String, String> getCertificateConfig() {
        return await(profileManager.getCertificateConfig());
    }

    @PutMapping("/certificate-config")
    public Map<String, String> setCertificateConfig(@RequestBody Map<String, String> config) {
        config.forEach((field, spec) -> {
            if (spec != null && (spec.indexOf('\n') >= 0 || spec.indexOf('\r') >= 0)) {
                throw new IllegalArgumentException("Layout for " + field + " must be a single line");
            }
        });
        return await(profileManager.setCertificateConfig(config));
    }

    /**
     * Replaces the certificate template. Takes effect for the next certificate job.
     */
    @PostMapping(value = "/template", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse> uploadTemplate(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Template file is empty");
        }
        String filename = file.getOriginalFilename();
        if (filename != null && !filename.toLowerCase().endsWith(TEMPLATE_SUFFIX)) {
            throw new IllegalArgumentException("Template must be a .pptx file");
        }
        await(profileManager.replaceTemplate(file.getBytes()));
        return createSuccessResponse("Template uploaded");
    }

    @GetMapping("/template")
    public TemplateStatusResponse templateStatus() {
        if (!storage.exists(StorageKeys.TEMPLATE)) {
            return new TemplateStatusResponse(false, null);
        }
        String url = storage.presignedGetUrl(StorageKeys.TEMPLATE, appProperties.getStorage().getPresignTtl(),
                DownloadDisposition.attachment(StorageKeys.TEMPLATE)).toString();
        return new TemplateStatusResponse(true, url);
    }
}
