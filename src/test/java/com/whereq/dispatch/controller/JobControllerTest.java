package com.whereq.dispatch.controller;

import com.whereq.dispatch.dto.JobResponse;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.support.Await;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@TestPropertySource(properties = "dispatch.mode=memory")
class JobControllerTest {

    private static final String DOMAIN = "alice.example.com";

    @Autowired
    private WebTestClient webClient;

    private JobResponse push(String workerType, String body) {
        return webClient.post()
            .uri("/api/v1/jobs/{domain}/queue/{workerType}", DOMAIN, workerType)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().exists("Location")
            .expectBody(JobResponse.class)
            .returnResult()
            .getResponseBody();
    }

    private JobResponse get(String domain, String jobId) {
        return webClient.get()
            .uri("/api/v1/jobs/{domain}/{jobId}", domain, jobId)
            .exchange()
            .expectBody(JobResponse.class)
            .returnResult()
            .getResponseBody();
    }

    @Test
    void pushedJobRunsToCompletion() {
        JobResponse pushed = push("log", "{\"message\":{\"hello\":\"world\"}}");

        assertThat(pushed.getJobId()).isNotBlank();
        assertThat(pushed.getDomain()).isEqualTo(DOMAIN);
        assertThat(pushed.isManual()).isTrue();
        assertThat(pushed.getState()).isEqualTo(JobState.QUEUED);
        Await.until(Duration.ofSeconds(5), () -> get(DOMAIN, pushed.getJobId()).getState() == JobState.DONE);
        assertThat(get(DOMAIN, pushed.getJobId()).getMessage().toJson()).isEqualTo("{\"hello\":\"world\"}");
    }

    @Test
    void jobWithoutBodyIsAccepted() {
        webClient.post()
            .uri("/api/v1/jobs/{domain}/queue/log", DOMAIN)
            .exchange()
            .expectStatus().isAccepted();
    }

    @Test
    void unknownWorkerTypeIsABadRequest() {
        webClient.post()
            .uri("/api/v1/jobs/{domain}/queue/thumbnail", DOMAIN)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").value(message -> assertThat((String) message).contains("thumbnail"));
    }

    @Test
    void jobOfAnotherDomainIsNotFound() {
        JobResponse pushed = push("log", "{}");

        webClient.get()
            .uri("/api/v1/jobs/{domain}/{jobId}", "bob.example.com", pushed.getJobId())
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void queueLengthOfAWorkerType() {
        webClient.get()
            .uri("/api/v1/jobs/queue/log")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.workerType").isEqualTo("log")
            .jsonPath("$.length").isNumber();

        webClient.get()
            .uri("/api/v1/jobs/queue/thumbnail")
            .exchange()
            .expectStatus().isNotFound();
    }
}
