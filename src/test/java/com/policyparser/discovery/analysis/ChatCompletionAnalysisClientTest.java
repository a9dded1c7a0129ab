package com.policyparser.discovery.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyparser.discovery.config.AnalysisProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class ChatCompletionAnalysisClientTest {

    private static ChatCompletionAnalysisClient client(boolean enabled, String reply) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, "application/json")
                        .body(reply)
                        .build()))
                .build();
        var properties = new AnalysisProperties(enabled, "http://analysis.test/v1/chat/completions", "key", "gpt-4o-mini", 1000, 3000);
        return new ChatCompletionAnalysisClient(webClient, properties, new ObjectMapper());
    }

    @Test
    void readsVerdictFromFencedReply() {
        String reply = """
                {"choices":[{"message":{"content":"```json\\n{\\"isLegalDocument\\": true, \\"documentType\\": \\"privacy_policy\\", \\"confidence\\": 0.87, \\"reasoning\\": \\"lists data rights\\"}\\n```"}}]}
                """;

        var verdict = client(true, reply).analyze("We collect personal data.", 1000).orElseThrow();

        assertTrue(verdict.legalDocument());
        assertEquals("privacy_policy", verdict.documentType());
        assertEquals(0.87, verdict.confidence(), 1e-9);
        assertEquals("lists data rights", verdict.reasoning());
    }

    @Test
    void disabledServiceIsNeverCalled() {
        assertTrue(client(false, "{}").analyze("text", 1000).isEmpty());
    }

    @Test
    void unreadableReplyYieldsNoVerdict() {
        var c = client(true, "{\"choices\":[{\"message\":{\"content\":\"I cannot tell.\"}}]}");
        assertTrue(c.analyze("text", 1000).isEmpty());
        assertTrue(c.parseVerdict("{not json}").isEmpty());
        assertEquals(1.0, c.parseVerdict("{\"isLegalDocument\":true,\"confidence\":7}").orElseThrow().confidence());
    }
}
