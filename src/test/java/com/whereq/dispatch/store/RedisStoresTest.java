package com.whereq.dispatch.store;

import com.whereq.dispatch.exception.NotFoundException;
import com.whereq.dispatch.model.Job;
import com.whereq.dispatch.model.JobOptions;
import com.whereq.dispatch.model.JobState;
import com.whereq.dispatch.model.Message;
import com.whereq.dispatch.model.TriggerInfo;
import com.whereq.dispatch.model.TriggerType;
import com.whereq.dispatch.support.AbstractRedisTest;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RedisStoresTest extends AbstractRedisTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void jobRecordSurvivesTheRoundTrip() {
        RedisJobStore store = new RedisJobStore(redisTemplate, OBJECT_MAPPER);
        Job created = store.create(Job.builder()
            .domain("alice.example.com")
            .workerType("sendmail")
            .message(Message.fromJson("{\"to\":[\"bob@example.com\"]}"))
            .options(JobOptions.builder().maxExecCount(3).timeout(Duration.ofSeconds(20)).build())
            .state(JobState.QUEUED)
            .queuedAt(START)
            .build()).block(WAIT);

        Job read = store.get("alice.example.com", created.getId()).block(WAIT);

        assertThat(read).isEqualTo(created);
        assertThat(read.getOptions().getTimeout()).isEqualTo(Duration.ofSeconds(20));
        StepVerifier.create(store.get("bob.example.com", created.getId()))
            .expectError(NotFoundException.class)
            .verify(WAIT);
    }

    @Test
    void jobsOfATriggerComeNewestFirst() {
        RedisJobStore store = new RedisJobStore(redisTemplate, OBJECT_MAPPER);
        for (int i = 0; i < 5; i++) {
            store.create(Job.builder()
                .domain("alice.example.com")
                .workerType("log")
                .triggerId("t1")
                .state(JobState.DONE)
                .queuedAt(START.plusSeconds(i))
                .build()).block(WAIT);
        }

        assertThat(store.findByTrigger("alice.example.com", "t1", 3).collectList().block(WAIT))
            .extracting(Job::getQueuedAt)
            .containsExactly(START.plusSeconds(4), START.plusSeconds(3), START.plusSeconds(2));
    }

    @Test
    void triggersAreListedAcrossDomains() {
        RedisTriggerStore store = new RedisTriggerStore(redisTemplate, OBJECT_MAPPER);
        TriggerInfo alice = store.add(TriggerInfo.builder()
            .domain("alice.example.com").type(TriggerType.EVERY).workerType("log").arguments("1h").build()).block(WAIT);
        store.add(TriggerInfo.builder()
            .domain("bob.example.com").type(TriggerType.CRON).workerType("log").arguments("0 0 * * * *").build())
            .block(WAIT);

        assertThat(store.findAll().count().block(WAIT)).isEqualTo(2L);
        assertThat(store.getAll("alice.example.com").collectList().block(WAIT))
            .extracting(TriggerInfo::getId)
            .containsExactly(alice.getId());

        store.delete(alice).block(WAIT);
        StepVerifier.create(store.delete(alice))
            .expectError(NotFoundException.class)
            .verify(WAIT);
    }
}
