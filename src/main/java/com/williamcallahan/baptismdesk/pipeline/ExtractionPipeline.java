package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.domain.ExtractionFields;
import com.williamcallahan.baptismdesk.domain.PinyinNormalizer;
import com.williamcallahan.baptismdesk.domain.ProfileDates;
import com.williamcallahan.baptismdesk.service.InferenceClient;
import com.williamcallahan.baptismdesk.service.OcrResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads certificate fields for one profile from the inference service and normalizes them.
 *
 * <p>Pure with respect to profile state: the result is applied by the profile manager, and a
 * failure leaves the profile untouched so the extraction can simply be requested again.</p>
 */
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final InferenceClient inferenceClient;

    public ExtractionPipeline(InferenceClient inferenceClient) {
        this.inferenceClient = inferenceClient;
    }

    /**
     * @param profileId profile whose compressed image is read
     * @param inferenceUrl endpoint base URL
     * @return normalized fields
     * @throws com.williamcallahan.baptismdesk.service.InferenceServiceException on any inference failure
     */
    public ExtractionFields extract(String profileId, String inferenceUrl) {
        OcrResult raw = inferenceClient.extract(inferenceUrl, profileId);
        ExtractionFields fields = new ExtractionFields(
                raw.nameCn(),
                PinyinNormalizer.normalize(raw.namePinyin()),
                ProfileDates.parseOrNull(raw.birthday()),
                ProfileDates.parseOrNull(raw.baptismDate()));
        if (isPresent(raw.birthday()) && fields.birthday() == null) {
            log.warn("Discarding unparsable birthday '{}' for {}", raw.birthday(), profileId);
        }
        if (isPresent(raw.baptismDate()) && fields.baptismDate() == null) {
            log.warn("Discarding unparsable baptism date '{}' for {}", raw.baptismDate(), profileId);
        }
        return fields;
    }

    private static boolean isPresent(String text) {
        return text != null && !text.isBlank();
    }
}
