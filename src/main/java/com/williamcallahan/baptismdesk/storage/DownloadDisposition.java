package com.williamcallahan.baptismdesk.storage;

import java.util.Objects;

/**
 * Content-Disposition override baked into a presigned read URL.
 *
 * @param attachment true for {@code attachment}, false for {@code inline}
 * @param filename suggested download filename
 */
public record DownloadDisposition(boolean attachment, String filename) {

    public DownloadDisposition {
        Objects.requireNonNull(filename, "filename");
    }

    public static DownloadDisposition inline(String filename) {
        return new DownloadDisposition(false, filename);
    }

    public static DownloadDisposition attachment(String filename) {
        return new DownloadDisposition(true, filename);
    }

    /**
     * Renders the header value, escaping quotes in the filename.
     */
    public String headerValue() {
        String safeName = filename.replace("\"", "'");
        return (attachment ? "attachment" : "inline") + "; filename=\"" + safeName + "\"";
    }
}
