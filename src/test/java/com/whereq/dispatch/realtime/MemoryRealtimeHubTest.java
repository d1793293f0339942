package com.whereq.dispatch.realtime;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class MemoryRealtimeHubTest {

    private final MemoryRealtimeHub hub = new MemoryRealtimeHub();

    private static RealtimeEvent event(String domain, String doctype, String id) {
        return RealtimeEvent.builder()
            .domain(domain)
            .verb(RealtimeEvent.CREATED)
            .doctype(doctype)
            .doc(Map.of("_id", id))
            .build();
    }

    @Test
    void subscribersOnlySeeTheirDomainAndDoctypes() {
        StepVerifier.create(hub.subscribe("alice.example.com", List.of("io.cozy.files")))
            .then(() -> {
                hub.publish(event("bob.example.com", "io.cozy.files", "b1"));
                hub.publish(event("alice.example.com", "io.cozy.contacts", "c1"));
                hub.publish(event("alice.example.com", "io.cozy.files", "f1"));
            })
            .assertNext(e -> assertThat(e.getDocId()).isEqualTo("f1"))
            .thenCancel()
            .verify(Duration.ofSeconds(2));
    }

    @Test
    void subscribeAllSeesEveryDomain() {
        StepVerifier.create(hub.subscribeAll())
            .then(() -> {
                hub.publish(event("bob.example.com", "io.cozy.files", "b1"));
                hub.publish(event("alice.example.com", "io.cozy.notes", "n1"));
            })
            .assertNext(e -> assertThat(e.getDomain()).isEqualTo("bob.example.com"))
            .assertNext(e -> assertThat(e.getDoctype()).isEqualTo("io.cozy.notes"))
            .thenCancel()
            .verify(Duration.ofSeconds(2));
    }

    @Test
    void publishingWithoutSubscribersIsDropped() {
        assertThatCode(() -> hub.publish(event("alice.example.com", "io.cozy.files", "f1")))
            .doesNotThrowAnyException();

        StepVerifier.create(hub.subscribeAll())
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(100))
            .thenCancel()
            .verify();
    }

    @Test
    void documentIdsComeFromTheIdField() {
        RealtimeEvent update = RealtimeEvent.builder()
            .verb(RealtimeEvent.UPDATED)
            .doc(Map.of("_id", "new"))
            .oldDoc(Map.of("_id", "old"))
            .build();

        assertThat(update.getDocId()).isEqualTo("new");
        assertThat(update.getOldDocId()).isEqualTo("old");
        assertThat(RealtimeEvent.builder().build().getDocId()).isNull();
    }
}
