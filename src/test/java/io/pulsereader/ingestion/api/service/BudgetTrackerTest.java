package io.pulsereader.ingestion.api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetTrackerTest {

    @Test
    @DisplayName("Should allow reservations up to the ceiling")
    void shouldAllowReservationsUpToCeiling() {
        BudgetTracker budget = new BudgetTracker(3, 0);

        assertThat(budget.reserve(3)).isTrue();
        assertThat(budget.reserve(4)).isFalse();

        budget.consume(2);

        assertThat(budget.reserve(1)).isTrue();
        assertThat(budget.reserve(2)).isFalse();
        assertThat(budget.remaining()).isEqualTo(1);
        assertThat(budget.used()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep held units out of reach until released")
    void shouldKeepHeldUnitsUntilReleased() {
        BudgetTracker budget = new BudgetTracker(3, 1);
        budget.consume(2);

        assertThat(budget.reserve(1)).isFalse();
        assertThat(budget.remaining()).isZero();

        budget.releaseHeld();

        assertThat(budget.reserve(1)).isTrue();
        assertThat(budget.remaining()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record spend beyond the ceiling instead of failing")
    void shouldRecordOverrun() {
        BudgetTracker budget = new BudgetTracker(1, 0);

        budget.consume(2);

        assertThat(budget.used()).isEqualTo(2);
        assertThat(budget.remaining()).isZero();
        assertThat(budget.reserve(0)).isFalse();
    }

    @Test
    @DisplayName("Should reject invalid construction and negative amounts")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new BudgetTracker(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BudgetTracker(1, 2)).isInstanceOf(IllegalArgumentException.class);

        BudgetTracker budget = new BudgetTracker(5, 0);
        assertThatThrownBy(() -> budget.reserve(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> budget.consume(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
