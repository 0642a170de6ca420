package com.williamcallahan.baptismdesk.service;

/**
 * Raw text fields returned by the inference endpoint under {@code parse_ocr_result}. Values are
 * passed through as received; any may be null.
 */
public record OcrResult(String nameCn, String namePinyin, String birthday, String baptismDate) {}
