package com.williamcallahan.baptismdesk.domain;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes romanized names into the {@code "Family, Given"} form printed on certificates.
 *
 * <ul>
 *   <li>{@code "Sun JianFen"} becomes {@code "Sun, JianFen"}</li>
 *   <li>{@code "Sun Jian Fen"} becomes {@code "Sun, JianFen"} (given-name tokens are joined)</li>
 *   <li>{@code "Sun,JianFen"} and {@code "Sun,  JianFen"} become {@code "Sun, JianFen"}</li>
 * </ul>
 *
 * Re-normalizing an already normalized name returns it unchanged.
 */
public final class PinyinNormalizer {

    private static final Pattern COMMA_WITH_SPACING = Pattern.compile(",\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SEPARATOR = ", ";

    private PinyinNormalizer() {}

    public static String normalize(String romanizedName) {
        if (romanizedName == null) {
            return null;
        }
        String trimmed = romanizedName.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String commaNormalized = COMMA_WITH_SPACING.matcher(trimmed).replaceAll(SEPARATOR);
        if (commaNormalized.contains(",")) {
            return commaNormalized;
        }
        String[] tokens = WHITESPACE.split(commaNormalized);
        if (tokens.length < 2) {
            return commaNormalized;
        }
        String givenName = Arrays.stream(tokens, 1, tokens.length).collect(Collectors.joining());
        return tokens[0] + SEPARATOR + givenName;
    }
}
