package com.williamcallahan.baptismdesk.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies profile edits and the immutable collection operations built on them.
 */
class ProfileTest {

    private static final LocalDate BIRTHDAY = LocalDate.of(1990, 1, 2);
    private static final LocalDate BAPTISM = LocalDate.of(2024, 4, 7);

    private static Profile extracted(String id) {
        return new Profile(id, "孙建芬", "Sun, JianFen", BIRTHDAY, BAPTISM, ProfileStatus.EXTRACTED);
    }

    @Test
    void merge_changesOnlyProvidedFields() {
        Profile edited = extracted("abcd1234").merge(Map.of(Profile.FIELD_NAME_PINYIN, "Sun, Jian"));

        assertEquals("Sun, Jian", edited.namePinyin());
        assertEquals("孙建芬", edited.nameCn());
        assertEquals(BIRTHDAY, edited.birthday());
        assertEquals(ProfileStatus.EXTRACTED, edited.status());
    }

    @Test
    void merge_parsesDatesAndClearsUnparsableOnes() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(Profile.FIELD_BIRTHDAY, "1991-03-04");
        attributes.put(Profile.FIELD_BAPTISM_DATE, "not a date");

        Profile edited = extracted("abcd1234").merge(attributes);

        assertEquals(LocalDate.of(1991, 3, 4), edited.birthday());
        assertNull(edited.baptismDate());
    }

    @Test
    void merge_withNothingReturnsSameProfile() {
        Profile profile = extracted("abcd1234");
        assertSame(profile, profile.merge(Map.of()));
    }

    @Test
    void withExtraction_replacesFieldsButKeepsStatus() {
        Profile refreshed = Profile.uploaded("abcd1234")
                .withExtraction(new ExtractionFields("李", "Li, Ming", null, BAPTISM));

        assertEquals(ProfileStatus.UPLOADED, refreshed.status());
        assertEquals("Li, Ming", refreshed.namePinyin());
        assertNull(refreshed.birthday());
    }

    @Test
    void managerState_prependReplaceAndRemoveKeepOrder() {
        ManagerState state = ManagerState.empty()
                .prepend(Profile.uploaded("first"))
                .prepend(Profile.uploaded("second"));
        assertEquals(List.of("second", "first"), state.profiles().stream().map(Profile::id).toList());

        ManagerState replaced = state.replace("first", profile -> profile.withStatus(ProfileStatus.EXTRACTED));
        assertEquals(ProfileStatus.EXTRACTED, replaced.profiles().get(1).status());

        ManagerState removed = replaced.remove("second");
        assertEquals(List.of("first"), removed.profiles().stream().map(Profile::id).toList());
        assertEquals(2, state.profiles().size());
    }
}
