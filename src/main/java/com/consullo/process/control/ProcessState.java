package com.consullo.process.control;

/**
 * Lifecycle of one controller. Transitions only move forward.
 *
 * @since 1.0
 */
public enum ProcessState {
  /** Started; the reaper has not reported an exit yet. */
  LAUNCHED,
  /** Exit reported into the exit slot, nobody has consumed it. */
  EXITED,
  /** Some caller consumed the exit result. */
  DRAINED
}
