package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.domain.ProfileDates;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the plain-text layout description consumed by the render script.
 *
 * <p>The first line names the template and output files. Every placed element follows as a pair
 * of lines: an {@code img} or {@code txt} directive carrying the value, then the layout spec for
 * that element. Text specs get {@code align=left} appended. Values and specs are flattened to a
 * single line each so they cannot break that pairing.</p>
 */
public final class CertificateInstructions {

    public static final String HEADSHOT = "headshot";
    public static final String NAME = "name";
    public static final String BIRTHDAY = "birthday";
    public static final String BAPTISM_DAY = "baptism_day";
    public static final String BAPTISM_MONTH = "baptism_month";
    public static final String BAPTISM_YEAR = "baptism_year";
    public static final String SIGN_DATE = "sign_date";
    /** ISO date printed as the sign-off date; today when absent or invalid. */
    public static final String SIGN_DATE_VALUE = "sign_date_value";

    private static final String SERIF = " font=\"Times New Roman\"";

    /** Built-in layout per field, used when the configuration has no override. */
    public static final Map<String, String> DEFAULT_LAYOUT;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(HEADSHOT, "left=5 top=1 w=3");
        defaults.put(NAME, "left=1 top=1 w=6 h=1.5 fontsz=18");
        defaults.put(BIRTHDAY, "left=1 top=2.5 w=6 h=1.5 fontsz=18" + SERIF);
        defaults.put(BAPTISM_DAY, "left=1 top=4 w=6 h=1.5 fontsz=18" + SERIF);
        defaults.put(BAPTISM_MONTH, "left=2 top=4 w=6 h=1.5 fontsz=18" + SERIF);
        defaults.put(BAPTISM_YEAR, "left=3 top=4 w=6 h=1.5 fontsz=18" + SERIF);
        defaults.put(SIGN_DATE, "left=1 top=5.5 w=6 h=1.5 fontsz=18" + SERIF);
        DEFAULT_LAYOUT = Collections.unmodifiableMap(defaults);
    }

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    private static final DateTimeFormatter FULL_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMMM", Locale.ENGLISH);
    private static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy", Locale.ENGLISH);

    private CertificateInstructions() {}

    /** Shared cached copy of the stored template. */
    public static String templateFileName() {
        return "template.pptx";
    }

    /** Per-job copy of the template that the render script opens. */
    public static String jobTemplateFileName(String profileId) {
        return "template_" + profileId + ".pptx";
    }

    public static String outputFileName(String profileId) {
        return "output_" + profileId + ".pptx";
    }

    public static String previewFileName(String profileId) {
        return "output_" + profileId + ".png";
    }

    public static String headshotFileName(String profileId) {
        return "headshot_" + profileId + ".jpg";
    }

    public static String inputFileName(String profileId) {
        return "input_" + profileId + ".txt";
    }

    /**
     * Renders the instruction file for a profile.
     *
     * @param profile profile whose fields are printed
     * @param config layout overrides keyed by field name, may be empty
     * @param clock source of today's date for the default sign date
     * @return instruction text, newline terminated
     */
    public static String build(Profile profile, Map<String, String> config, Clock clock) {
        Map<String, String> overrides = config == null ? Map.of() : config;
        String id = profile.id();
        LocalDate signDate = ProfileDates.parseOrNull(overrides.get(SIGN_DATE_VALUE));
        if (signDate == null) {
            signDate = LocalDate.now(clock);
        }

        StringBuilder out = new StringBuilder();
        out.append(jobTemplateFileName(id)).append(' ').append(outputFileName(id)).append('\n');
        out.append("img ").append(headshotFileName(id)).append('\n');
        out.append(singleLine(layout(overrides, HEADSHOT))).append('\n');
        appendText(out, displayName(profile), layout(overrides, NAME));
        appendText(out, format(profile.birthday(), FULL_DATE), layout(overrides, BIRTHDAY));
        appendText(out, format(profile.baptismDate(), DAY), layout(overrides, BAPTISM_DAY));
        appendText(out, format(profile.baptismDate(), MONTH), layout(overrides, BAPTISM_MONTH));
        appendText(out, format(profile.baptismDate(), YEAR), layout(overrides, BAPTISM_YEAR));
        appendText(out, format(signDate, FULL_DATE), layout(overrides, SIGN_DATE));
        return out.toString();
    }

    /**
     * Layout spec for a field: the override when non-blank, else the built-in default.
     */
    public static String layout(Map<String, String> config, String field) {
        String override = config.get(field);
        return override == null || override.isBlank() ? DEFAULT_LAYOUT.get(field) : override.trim();
    }

    private static void appendText(StringBuilder out, String text, String spec) {
        out.append("txt ").append(singleLine(text)).append('\n');
        out.append(singleLine(spec)).append(" align=left").append('\n');
    }

    static String singleLine(String value) {
        return LINE_BREAKS.matcher(value).replaceAll(" ");
    }

    private static String displayName(Profile profile) {
        String pinyin = profile.namePinyin() == null ? "" : profile.namePinyin();
        String nativeName = profile.nameCn() == null ? "" : profile.nameCn();
        return (pinyin + " " + nativeName).trim();
    }

    private static String format(LocalDate date, DateTimeFormatter formatter) {
        return date == null ? "" : formatter.format(date);
    }
}
