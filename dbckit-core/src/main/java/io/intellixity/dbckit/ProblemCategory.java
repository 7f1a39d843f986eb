package io.intellixity.dbckit;

public enum ProblemCategory {
  /** Text could not be split into statements; never recoverable. */
  LEX,
  /** A recognized statement does not match its grammar. */
  SYNTAX,
  /** Statements parse but contradict each other or reference missing entities. */
  SEMANTIC,
  /** Statement keyword not known to the parser; informational only. */
  UNRECOGNIZED
}
