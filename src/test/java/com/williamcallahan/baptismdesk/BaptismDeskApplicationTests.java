package com.williamcallahan.baptismdesk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import com.williamcallahan.baptismdesk.pipeline.UploadPipeline;
import com.williamcallahan.baptismdesk.service.InferenceClient;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.util.ReflectionTestUtils;

@SpringBootTest(properties = {
        "app.storage.type=memory",
        "app.inference.default-url=http://localhost:8000"
})
class BaptismDeskApplicationTests {

    @Autowired
    ProfileManager profileManager;

    @Autowired
    UploadPipeline uploadPipeline;

    @Autowired
    InferenceClient inferenceClient;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void contextLoads() throws Exception {
        assertTrue(profileManager.listProfiles().get(5, TimeUnit.SECONDS).isEmpty());
        assertEquals(3, profileManager.queueStatuses().size());
        assertTrue(AopUtils.isAopProxy(uploadPipeline));
    }

    @Test
    void inferenceClient_parsesWithApplicationObjectMapper() {
        assertSame(objectMapper, ReflectionTestUtils.getField(inferenceClient, "objectMapper"));
    }

}
