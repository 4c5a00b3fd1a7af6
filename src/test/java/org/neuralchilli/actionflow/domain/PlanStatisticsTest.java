package org.neuralchilli.actionflow.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanStatisticsTest {

    @Test
    void shouldTellSequentialPlanFromFanOut() {
        PlanStatistics fanOut = new PlanStatistics(4, 1, 2, 3, 2, 0, 180);
        PlanStatistics chain = new PlanStatistics(3, 1, 1, 3, 1, 0, 180);

        assertThat(fanOut.isSequential()).isFalse();
        assertThat(chain.isSequential()).isTrue();
        assertThat(chain.criticalPath()).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void shouldDescribeShapeInToString() {
        String str = new PlanStatistics(4, 1, 2, 3, 2, 1, 95).toString();

        assertThat(str)
                .contains("steps=4")
                .contains("widest=2")
                .contains("blocked=1")
                .contains("critical_path=95s");
    }

    @Test
    void shouldRejectImpossibleCounts() {
        assertThatThrownBy(() -> new PlanStatistics(-1, 0, 0, 0, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be negative");

        // Given: more blocked steps than the plan holds
        assertThatThrownBy(() -> new PlanStatistics(2, 1, 1, 2, 1, 3, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Blocked steps must be between 0 and 2");
    }
}
