package com.purchasingpower.proofengine.service.proof;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Analysis Budget Tests")
class AnalysisBudgetTest {

    @Test
    @DisplayName("Fork carries the remaining steps and is consumed independently")
    void forkCarriesRemainingSteps() {
        // Given
        AnalysisBudget budget = new AnalysisBudget(5, Duration.ofSeconds(5));
        for (int i = 0; i < 3; i++) {
            assertThat(budget.tryConsume("decomposition")).isTrue();
        }

        // When
        AnalysisBudget first = budget.fork();
        AnalysisBudget second = budget.fork();

        // Then
        assertThat(first.tryConsume("gap analysis")).isTrue();
        assertThat(first.tryConsume("gap analysis")).isTrue();
        assertThat(first.tryConsume("gap analysis")).isFalse();
        assertThat(first.getExhaustedIn()).isEqualTo("gap analysis");

        assertThat(second.isExhausted()).isFalse();
        assertThat(second.tryConsume("circular detection")).isTrue();
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.getStepsUsed()).isEqualTo(3);
    }

    @Test
    @DisplayName("Fork of an exhausted budget starts exhausted in the same stage")
    void forkOfExhaustedBudget() {
        // Given
        AnalysisBudget budget = new AnalysisBudget(1, Duration.ofSeconds(5));
        budget.tryConsume("decomposition");
        budget.tryConsume("decomposition");

        // When
        AnalysisBudget fork = budget.fork();

        // Then
        assertThat(fork.isExhausted()).isTrue();
        assertThat(fork.getExhaustedIn()).isEqualTo("decomposition");
        assertThat(fork.tryConsume("gap analysis")).isFalse();
        assertThat(fork.getExhaustedIn()).isEqualTo("decomposition");
    }
}
