package com.williamcallahan.baptismdesk.domain;

import java.time.LocalDate;

/**
 * Normalized fields read off an uploaded certificate image by the inference service.
 *
 * @param nameCn name in Chinese script
 * @param namePinyin romanized name, already passed through {@link PinyinNormalizer}
 * @param birthday parsed birthday or null
 * @param baptismDate parsed baptism date or null
 */
public record ExtractionFields(String nameCn, String namePinyin, LocalDate birthday, LocalDate baptismDate) {}
