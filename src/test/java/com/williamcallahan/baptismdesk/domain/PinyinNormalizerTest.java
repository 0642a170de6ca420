package com.williamcallahan.baptismdesk.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Verifies romanized names are rewritten into "Family, Given" form.
 */
class PinyinNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Sun JianFen|Sun, JianFen",
        "Sun Jian Fen|Sun, JianFen",
        "Sun,JianFen|Sun, JianFen",
        "'Sun,   JianFen'|Sun, JianFen",
        "'  Sun JianFen  '|Sun, JianFen",
        "Sun|Sun"
    })
    void normalize_rewritesToFamilyCommaGiven(String input, String expected) {
        assertEquals(expected, PinyinNormalizer.normalize(input));
    }

    @Test
    void normalize_isIdempotent() {
        String once = PinyinNormalizer.normalize("Li Xiao Ming");
        assertEquals("Li, XiaoMing", once);
        assertEquals(once, PinyinNormalizer.normalize(once));
    }

    @Test
    void normalize_passesThroughNullAndBlank() {
        assertNull(PinyinNormalizer.normalize(null));
        assertEquals("", PinyinNormalizer.normalize("   "));
    }
}
