package com.visaeligibility.service.check;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckStateTest {

    @ParameterizedTest
    @EnumSource(value = CheckState.class, names = {"ESCALATED", "DONE", "FAILED"})
    @DisplayName("terminal states have no successor")
    void terminal(CheckState state) {
        assertThat(state.isTerminal()).isTrue();
        assertThat(state.next()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = CheckState.class, names = {"ESCALATED", "DONE", "FAILED"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("every non-terminal state may fail")
    void canFail(CheckState state) {
        assertThat(state.canMoveTo(CheckState.FAILED)).isTrue();
    }

    @Test
    @DisplayName("persistence cannot be skipped")
    void noShortcut() {
        CheckRun run = new CheckRun("case-001", "uk-skilled-worker");
        run.moveTo(CheckState.RULE_EVALUATED);
        run.moveTo(CheckState.AI_SKIPPED);
        run.moveTo(CheckState.COMBINED);

        assertThatThrownBy(() -> run.moveTo(CheckState.DONE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMBINED -> DONE");
    }

    @Test
    @DisplayName("fail after a terminal state keeps the terminal state")
    void failAfterDone() {
        CheckRun run = new CheckRun("case-001", "uk-skilled-worker");
        run.moveTo(CheckState.RULE_EVALUATED);
        run.moveTo(CheckState.AI_EVALUATED);
        run.moveTo(CheckState.COMBINED);
        run.moveTo(CheckState.PERSISTED);
        run.moveTo(CheckState.DONE);

        run.fail();

        assertThat(run.getState()).isEqualTo(CheckState.DONE);
        assertThat(run.getTrail()).hasSize(6).doesNotContain(CheckState.FAILED);
    }
}
