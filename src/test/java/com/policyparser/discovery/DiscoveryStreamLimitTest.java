package com.policyparser.discovery;

import com.policyparser.discovery.api.DiscoveryController;
import com.policyparser.discovery.api.GlobalExceptionHandler;
import com.policyparser.discovery.config.StreamProperties;
import com.policyparser.discovery.discovery.DiscoveryService;
import com.policyparser.discovery.validation.ContentValidator;
import com.policyparser.discovery.validation.DocumentClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class DiscoveryStreamLimitTest {
    private final CountDownLatch release = new CountDownLatch(1);
    private final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

    @AfterEach
    void stop() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    void saturatedStreamPoolTurnsRequestsAway() throws Exception {
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.initialize();

        DiscoveryService service = mock(DiscoveryService.class);
        when(service.discover(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            throw new IllegalStateException("session stopped");
        });
        var controller = new DiscoveryController(service, mock(ContentValidator.class), mock(DocumentClassifier.class),
                executor, new StreamProperties(1, 0, 5000));
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mockMvc.perform(get("/api/discovery/stream").param("domain", "acme.test"))
                .andExpect(request().asyncStarted());

        mockMvc.perform(get("/api/discovery/stream").param("domain", "other.test"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("busy"));
    }
}
