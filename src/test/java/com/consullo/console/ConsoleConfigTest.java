package com.consullo.console;

import com.consullo.console.exec.ExecutionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConsoleConfig}.
 *
 * @since 1.0
 */
public class ConsoleConfigTest {

  @Test
  @DisplayName("Should provide threaded defaults with the standard prompts")
  void defaults_Values_MatchDocumentedDefaults() {
    final ConsoleConfig config = ConsoleConfig.defaults();

    assertThat(config.executionMode()).isEqualTo(ExecutionMode.THREADED);
    assertThat(config.tabWidth()).isEqualTo(4);
    assertThat(config.formatInputPrompt(3)).isEqualTo("IN [3]: ");
    assertThat(config.continuationPrompt()).isEqualTo("...: ");
    assertThat(config.formatOutputPrompt(3)).isEqualTo("OUT[3]: ");
    assertThat(config.instructionThreshold()).isEqualTo(10_000);
    assertThat(config.completionEnabled()).isTrue();
    assertThat(config.ctrlDExits()).isFalse();
  }

  @Test
  @DisplayName("Should copy with one value changed")
  void withHelpers_ChangeSingleValue() {
    final ConsoleConfig config = ConsoleConfig.defaults()
        .withExecutionMode(ExecutionMode.QUEUED)
        .withTabWidth(2)
        .withPrompts(">>> ", "... ", "")
        .withInstructionThreshold(50)
        .withCtrlDExits(true);

    assertThat(config.executionMode()).isEqualTo(ExecutionMode.QUEUED);
    assertThat(config.tabWidth()).isEqualTo(2);
    assertThat(config.formatInputPrompt(0)).isEqualTo(">>> ");
    assertThat(config.instructionThreshold()).isEqualTo(50);
    assertThat(config.completionEnabled()).isTrue();
    assertThat(config.ctrlDExits()).isTrue();
    assertThat(config.withTabWidth(8).ctrlDExits()).isTrue();
  }

  @Test
  @DisplayName("Should reject invalid values")
  void constructor_InvalidValues_Throw() {
    final ConsoleConfig defaults = ConsoleConfig.defaults();

    assertThatThrownBy(() -> defaults.withExecutionMode(ExecutionMode.EXECUTOR))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> defaults.withTabWidth(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> defaults.withInstructionThreshold(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> defaults.withExecutionMode(null)).isInstanceOf(NullPointerException.class);
  }
}
