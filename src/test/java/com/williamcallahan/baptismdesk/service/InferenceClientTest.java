package com.williamcallahan.baptismdesk.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

/**
 * Verifies the inference request shape and how each failure mode is classified.
 */
class InferenceClientTest {

    private static final String BASE_URL = "http://inference.test:8000";
    private static final String EXTRACT_URL = BASE_URL + "/extract";

    private MockRestServiceServer server;
    private InferenceClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new InferenceClient(restTemplate, new ObjectMapper());
    }

    @Test
    void extract_postsFilenameAndParsesResult() {
        server.expect(requestTo(EXTRACT_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"filename\":\"abcd1234.jpg\"}"))
                .andRespond(withSuccess("""
                        {"parse_ocr_result": {
                          "name_cn": "孙建芬",
                          "name_pinyin": "Sun JianFen",
                          "birthday": "1990-01-02",
                          "baptism_date": null
                        }}
                        """, MediaType.APPLICATION_JSON));

        OcrResult result = client.extract(BASE_URL + "/", "abcd1234");

        assertEquals("孙建芬", result.nameCn());
        assertEquals("Sun JianFen", result.namePinyin());
        assertEquals("1990-01-02", result.birthday());
        assertNull(result.baptismDate());
        server.verify();
    }

    @Test
    void extract_classifiesHttpErrorWithStatus() {
        server.expect(requestTo(EXTRACT_URL))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("model offline"));

        InferenceServiceException failure =
                assertThrows(InferenceServiceException.class, () -> client.extract(BASE_URL, "abcd1234"));

        assertEquals(InferenceServiceException.Kind.HTTP_STATUS, failure.getKind());
        assertEquals(502, failure.getStatusCode());
        assertTrue(failure.getMessage().contains("model offline"), failure.getMessage());
    }

    @Test
    void extract_classifiesNonOkSuccessStatus() {
        server.expect(requestTo(EXTRACT_URL))
                .andRespond(withStatus(HttpStatus.ACCEPTED).body("{}").contentType(MediaType.APPLICATION_JSON));

        InferenceServiceException failure =
                assertThrows(InferenceServiceException.class, () -> client.extract(BASE_URL, "abcd1234"));

        assertEquals(InferenceServiceException.Kind.HTTP_STATUS, failure.getKind());
        assertEquals(202, failure.getStatusCode());
    }

    @Test
    void extract_classifiesTransportFailure() {
        server.expect(requestTo(EXTRACT_URL))
                .andRespond(withException(new IOException("connection refused")));

        InferenceServiceException failure =
                assertThrows(InferenceServiceException.class, () -> client.extract(BASE_URL, "abcd1234"));

        assertEquals(InferenceServiceException.Kind.TRANSPORT, failure.getKind());
        assertEquals(-1, failure.getStatusCode());
    }

    @Test
    void extract_classifiesMalformedBodies() {
        server.expect(requestTo(EXTRACT_URL))
                .andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));
        InferenceServiceException invalidJson =
                assertThrows(InferenceServiceException.class, () -> client.extract(BASE_URL, "a"));
        assertEquals(InferenceServiceException.Kind.MALFORMED_RESPONSE, invalidJson.getKind());

        server.reset();
        server.expect(requestTo(EXTRACT_URL))
                .andRespond(withSuccess("{\"result\":{}}", MediaType.APPLICATION_JSON));
        InferenceServiceException missingField =
                assertThrows(InferenceServiceException.class, () -> client.extract(BASE_URL, "a"));
        assertEquals(InferenceServiceException.Kind.MALFORMED_RESPONSE, missingField.getKind());
    }
}
