package com.company.errorbudget.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EvaluationTick")
class EvaluationTickTest {

    private final EvaluationTick tick = new EvaluationTick(1L, 7, Instant.parse("2024-03-01T12:00:00Z"));

    @Test
    @DisplayName("an abandoned tick can no longer commit")
    void abandonedCannotCommit() {
        assertThat(tick.abandon()).isTrue();

        assertThat(tick.beginCommit()).isFalse();
        assertThat(tick.isAbandoned()).isTrue();
    }

    @Test
    @DisplayName("a committing tick refuses to be abandoned")
    void committingCannotBeAbandoned() {
        assertThat(tick.beginCommit()).isTrue();

        assertThat(tick.abandon()).isFalse();
        assertThat(tick.isAbandoned()).isFalse();
    }

    @Test
    @DisplayName("can be abandoned again between commits")
    void abandonableAfterCommit() {
        tick.beginCommit();
        tick.endCommit();

        assertThat(tick.abandon()).isTrue();
        assertThat(tick.abandon()).isFalse();
    }
}
