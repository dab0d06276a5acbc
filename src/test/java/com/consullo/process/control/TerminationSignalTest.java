package com.consullo.process.control;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for classifying exits against the signal that caused them.
 *
 * @since 1.0
 */
@DisabledOnOs(OS.WINDOWS)
public class TerminationSignalTest {

  @Test
  @DisplayName("Should match exit codes 128 + signal number")
  void matches_SignalExitCodes_Matched() throws Exception {
    assertThat(TerminationSignal.INTERRUPT.matches(new ExitStatus(1, 143))).isTrue();
    assertThat(TerminationSignal.KILL.matches(new ExitStatus(1, 137))).isTrue();

    assertThat(TerminationSignal.INTERRUPT.matches(new ExitStatus(1, 137))).isFalse();
    assertThat(TerminationSignal.KILL.matches(new ExitStatus(1, 0))).isFalse();
    assertThat(TerminationSignal.KILL.matches(null)).isFalse();
  }

  @Test
  @DisplayName("Should describe plain and signal exits")
  void describe_KnownAndUnknownCodes() throws Exception {
    assertThat(new ExitStatus(1, 7).describe()).isEqualTo("exit status 7");
    assertThat(new ExitStatus(1, 137).describe()).isEqualTo("signal: killed");
    assertThat(new ExitStatus(1, 143).describe()).isEqualTo("signal: terminated");
    assertThat(new ExitStatus(1, 0).isSuccess()).isTrue();
  }

  @Test
  @DisplayName("Should describe codes above 128 without a known signal as plain exit statuses")
  void describe_UnknownHighCodes_PlainExitStatus() throws Exception {
    assertThat(new ExitStatus(1, 130).describe()).isEqualTo("exit status 130");
    assertThat(new ExitStatus(1, 200).describe()).isEqualTo("exit status 200");
    assertThat(new ExitStatus(1, 255).describe()).isEqualTo("exit status 255");
  }
}
