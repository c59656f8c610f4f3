package com.consullo.console.log;

/**
 * Tag carried by every transcript record.
 *
 * @since 1.0
 */
public enum Domain {
  /** Echoed or editable user input. */
  INPUT,
  /** Display form of an evaluation result. */
  OUTPUT,
  /** Text written by executed code to its stdout stream. */
  RAW_OUTPUT,
  /** Console-generated separators and markers. */
  CONTROL
}
