package com.williamcallahan.baptismdesk.domain;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * A person tracked through intake, extraction, certificate generation and review.
 *
 * <p>Profiles are immutable; every mutation produces a copy that the profile manager swaps into
 * its canonical collection.</p>
 *
 * @param id content-derived identifier, unique within the collection
 * @param nameCn name in Chinese script
 * @param namePinyin romanized name
 * @param birthday birthday
 * @param baptismDate baptism date
 * @param status current pipeline stage
 */
public record Profile(
        String id,
        String nameCn,
        String namePinyin,
        LocalDate birthday,
        LocalDate baptismDate,
        ProfileStatus status) {

    /** Editable field keys accepted by {@link #merge(Map)}. */
    public static final String FIELD_NAME_CN = "name_cn";
    public static final String FIELD_NAME_PINYIN = "name_pinyin";
    public static final String FIELD_BIRTHDAY = "birthday";
    public static final String FIELD_BAPTISM_DATE = "baptism_date";

    public Profile {
        Objects.requireNonNull(id, "Profile id is required");
        Objects.requireNonNull(status, "Profile status is required");
    }

    /**
     * Creates the record emitted by a successful upload.
     *
     * @param id resolved profile id
     * @return profile with status {@link ProfileStatus#UPLOADED} and no fields
     */
    public static Profile uploaded(String id) {
        return new Profile(id, null, null, null, null, ProfileStatus.UPLOADED);
    }

    public Profile withStatus(ProfileStatus newStatus) {
        return new Profile(id, nameCn, namePinyin, birthday, baptismDate, newStatus);
    }

    /**
     * Replaces every extracted field with the inference result, leaving status untouched.
     */
    public Profile withExtraction(ExtractionFields fields) {
        Objects.requireNonNull(fields, "fields");
        return new Profile(id, fields.nameCn(), fields.namePinyin(), fields.birthday(), fields.baptismDate(), status);
    }

    /**
     * Applies a manual edit. Only keys present in {@code attributes} change; unknown keys are
     * ignored and unparsable dates clear the field.
     *
     * @param attributes field key to new value
     * @return edited copy
     */
    public Profile merge(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return this;
        }
        String mergedNameCn = attributes.containsKey(FIELD_NAME_CN) ? attributes.get(FIELD_NAME_CN) : nameCn;
        String mergedPinyin =
                attributes.containsKey(FIELD_NAME_PINYIN) ? attributes.get(FIELD_NAME_PINYIN) : namePinyin;
        LocalDate mergedBirthday = attributes.containsKey(FIELD_BIRTHDAY)
                ? ProfileDates.parseOrNull(attributes.get(FIELD_BIRTHDAY))
                : birthday;
        LocalDate mergedBaptismDate = attributes.containsKey(FIELD_BAPTISM_DATE)
                ? ProfileDates.parseOrNull(attributes.get(FIELD_BAPTISM_DATE))
                : baptismDate;
        return new Profile(id, mergedNameCn, mergedPinyin, mergedBirthday, mergedBaptismDate, status);
    }
}
