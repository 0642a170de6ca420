package com.williamcallahan.baptismdesk.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.domain.ProfileStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies the render instruction file: file names first, then one directive and layout line per
 * placed element.
 */
class CertificateInstructionsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-09T10:00:00Z"), ZoneOffset.UTC);

    private static final Profile PROFILE = new Profile("abcd1234", "孙建芬", "Sun, JianFen",
            LocalDate.of(1990, 1, 2), LocalDate.of(2024, 4, 7), ProfileStatus.EXTRACTED);

    @Test
    void build_writesEveryElementWithDefaultLayout() {
        List<String> lines = CertificateInstructions.build(PROFILE, Map.of(), CLOCK).lines().toList();

        assertEquals(15, lines.size());
        assertEquals("template_abcd1234.pptx output_abcd1234.pptx", lines.get(0));
        assertEquals("img headshot_abcd1234.jpg", lines.get(1));
        assertEquals("left=5 top=1 w=3", lines.get(2));
        assertEquals("txt Sun, JianFen 孙建芬", lines.get(3));
        assertEquals("left=1 top=1 w=6 h=1.5 fontsz=18 align=left", lines.get(4));
        assertEquals("txt January 02, 1990", lines.get(5));
        assertEquals("txt 07", lines.get(7));
        assertEquals("txt April", lines.get(9));
        assertEquals("txt 2024", lines.get(11));
        assertEquals("txt March 09, 2025", lines.get(13));
        assertEquals(CertificateInstructions.DEFAULT_LAYOUT.get(CertificateInstructions.SIGN_DATE) + " align=left",
                lines.get(14));
    }

    @Test
    void build_appliesOverridesAndFixedSignDate() {
        Map<String, String> config = Map.of(
                CertificateInstructions.NAME, "left=2 top=2 w=5 h=1 fontsz=20",
                CertificateInstructions.HEADSHOT, "  ",
                CertificateInstructions.SIGN_DATE_VALUE, "2024-12-25");

        List<String> lines = CertificateInstructions.build(PROFILE, config, CLOCK).lines().toList();

        assertEquals("left=5 top=1 w=3", lines.get(2));
        assertEquals("left=2 top=2 w=5 h=1 fontsz=20 align=left", lines.get(4));
        assertEquals("txt December 25, 2024", lines.get(13));
    }

    @Test
    void build_flattensLineBreaksInFieldValues() {
        Profile edited = new Profile("abcd1234", "孙建芬", "Sun\nimg /etc/hostname", LocalDate.of(1990, 1, 2),
                LocalDate.of(2024, 4, 7), ProfileStatus.EXTRACTED);

        List<String> lines = CertificateInstructions.build(edited, Map.of(), CLOCK).lines().toList();

        assertEquals(15, lines.size());
        assertEquals("txt Sun img /etc/hostname 孙建芬", lines.get(3));
        assertFalse(lines.contains("img /etc/hostname"));
    }

    @Test
    void build_flattensLineBreaksInLayoutOverrides() {
        Map<String, String> config = Map.of(
                CertificateInstructions.NAME, "left=1 top=1 w=6\r\nimg /etc/hostname\nleft=0 top=0 w=9",
                CertificateInstructions.HEADSHOT, "left=5 top=1\nw=3");

        List<String> lines = CertificateInstructions.build(PROFILE, config, CLOCK).lines().toList();

        assertEquals(15, lines.size());
        assertEquals("left=5 top=1 w=3", lines.get(2));
        assertEquals("left=1 top=1 w=6 img /etc/hostname left=0 top=0 w=9 align=left", lines.get(4));
        assertFalse(lines.contains("img /etc/hostname"));
    }

    @Test
    void build_leavesMissingFieldsBlank() {
        List<String> lines = CertificateInstructions.build(Profile.uploaded("ffff0000"), Map.of(), CLOCK)
                .lines().toList();

        assertEquals("txt ", lines.get(3));
        assertEquals("txt ", lines.get(5));
        assertEquals("txt ", lines.get(11));
    }
}
