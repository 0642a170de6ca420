package com.williamcallahan.baptismdesk.manager;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.baptismdesk.domain.ManagerState;
import com.williamcallahan.baptismdesk.domain.Profile;
import com.williamcallahan.baptismdesk.domain.ProfileStatus;
import com.williamcallahan.baptismdesk.storage.InMemoryObjectStorage;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the snapshot wire format, background writes and recovery from missing or corrupt
 * snapshots.
 */
class SnapshotStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-09T10:15:30Z"), ZoneOffset.UTC);

    private static final ManagerState STATE = new ManagerState(
            List.of(
                    new Profile("abcd1234", "孙建芬", "Sun, JianFen", LocalDate.of(1990, 1, 2),
                            LocalDate.of(2024, 4, 7), ProfileStatus.REVIEWED),
                    Profile.uploaded("dup_1a2b_abcd1234")),
            "http://gpu-box:8000",
            Map.of("name", "left=2 top=1 w=6 h=1.5 fontsz=20"));

    private InMemoryObjectStorage storage;
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
        store = new SnapshotStore(storage, new ObjectMapper(), CLOCK);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void saveThenLoad_restoresEquivalentState() {
        store.save(STATE);
        assertTrue(store.flush(5, TimeUnit.SECONDS));

        assertEquals(STATE, store.load());
    }

    @Test
    void serialize_usesSnakeCaseIsoDatesAndLowercaseStatus() throws Exception {
        JsonNode json = new ObjectMapper().readTree(store.serialize(STATE));

        JsonNode first = json.get("profiles").get(0);
        assertEquals("孙建芬", first.get("name_cn").asText());
        assertEquals("Sun, JianFen", first.get("name_pinyin").asText());
        assertEquals("1990-01-02", first.get("birthday").asText());
        assertEquals("2024-04-07", first.get("baptism_date").asText());
        assertEquals("reviewed", first.get("status").asText());
        assertEquals("http://gpu-box:8000", json.get("inference_url").asText());
        assertTrue(json.get("certificate_config").has("name"));
    }

    @Test
    void load_toleratesUnknownFieldsAndMissingOptionalOnes() {
        String legacy = "{\"profiles\":[{\"id\":\"abcd1234\",\"status\":\"extracted\",\"name_cn\":\"李\","
                + "\"legacy_flag\":true}]}";
        storage.put(StorageKeys.MANAGER_STATE, legacy.getBytes(StandardCharsets.UTF_8), StorageKeys.CONTENT_TYPE_JSON);

        ManagerState loaded = store.load();

        assertEquals(1, loaded.profiles().size());
        assertEquals(ProfileStatus.EXTRACTED, loaded.profiles().get(0).status());
        assertEquals(null, loaded.inferenceUrl());
        assertTrue(loaded.certificateConfig().isEmpty());
    }

    @Test
    void load_missingSnapshotStartsEmpty() {
        assertEquals(ManagerState.empty(), store.load());
    }

    @Test
    void load_corruptSnapshotIsQuarantined() {
        byte[] garbage = "{not json".getBytes(StandardCharsets.UTF_8);
        storage.put(StorageKeys.MANAGER_STATE, garbage, StorageKeys.CONTENT_TYPE_JSON);

        ManagerState loaded = store.load();

        assertTrue(loaded.profiles().isEmpty());
        assertTrue(storage.exists("manager_state.corrupt.20250309_101530.json"), storage.keys().toString());
    }

    @Test
    void save_writesNewestSnapshotLast() {
        ManagerState older = ManagerState.empty().prepend(Profile.uploaded("older"));
        ManagerState newer = older.prepend(Profile.uploaded("newer"));

        store.save(older);
        store.save(newer);
        assertTrue(store.flush(5, TimeUnit.SECONDS));

        assertEquals(2, store.load().profiles().size());
    }
}
