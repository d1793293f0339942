package com.whereq.dispatch.controller;

import com.whereq.dispatch.dto.TriggerResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@TestPropertySource(properties = "dispatch.mode=memory")
class TriggerControllerTest {

    private static final String DOMAIN = "carol.example.com";

    @Autowired
    private WebTestClient webClient;

    private WebTestClient.ResponseSpec create(String body) {
        return webClient.post()
            .uri("/api/v1/jobs/{domain}/triggers", DOMAIN)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange();
    }

    private TriggerResponse createEvery(String interval) {
        return create("{\"type\":\"@every\",\"workerType\":\"log\",\"arguments\":\"" + interval + "\"}")
            .expectStatus().isCreated()
            .expectBody(TriggerResponse.class)
            .returnResult()
            .getResponseBody();
    }

    @Test
    void triggerLifecycle() {
        TriggerResponse created = createEvery("10h");

        assertThat(created.getTriggerId()).isNotBlank();
        assertThat(created.getDomain()).isEqualTo(DOMAIN);
        assertThat(created.getType()).isEqualTo("@every");

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.arguments").isEqualTo("10h");

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers", DOMAIN)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[?(@.triggerId == '" + created.getTriggerId() + "')]").exists();

        webClient.delete()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isNoContent();

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isNotFound();

        webClient.delete()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void invalidTriggersAreBadRequests() {
        create("{\"type\":\"@sometimes\",\"workerType\":\"log\",\"arguments\":\"1h\"}")
            .expectStatus().isBadRequest();
        create("{\"type\":\"@cron\",\"workerType\":\"log\",\"arguments\":\"every monday\"}")
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").exists();
        create("{\"type\":\"@every\",\"arguments\":\"1h\"}")
            .expectStatus().isBadRequest();
    }

    @Test
    void cronTriggerCanBeRescheduled() {
        TriggerResponse created = create("{\"type\":\"@cron\",\"workerType\":\"log\",\"arguments\":\"0 0 3 * * *\"}")
            .expectStatus().isCreated()
            .expectBody(TriggerResponse.class)
            .returnResult()
            .getResponseBody();

        webClient.patch()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, created.getTriggerId())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"arguments\":\"0 30 4 * * *\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.arguments").isEqualTo("0 30 4 * * *");

        TriggerResponse every = createEvery("10h");
        webClient.patch()
            .uri("/api/v1/jobs/{domain}/triggers/{id}", DOMAIN, every.getTriggerId())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"arguments\":\"0 30 4 * * *\"}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void stateOfATriggerWithoutJobs() {
        TriggerResponse created = createEvery("10h");

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers/{id}/state", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.triggerId").isEqualTo(created.getTriggerId())
            .jsonPath("$.status").isEqualTo("DONE");

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers/{id}/jobs?limit=500", DOMAIN, created.getTriggerId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$").isArray();

        webClient.get()
            .uri("/api/v1/jobs/{domain}/triggers/missing/state", DOMAIN)
            .exchange()
            .expectStatus().isNotFound();
    }
}
