package io.intellixity.dbckit.model;

import java.util.List;
import java.util.Objects;

/** Named set of signals of one message ({@code SIG_GROUP_}). */
public record SignalGroup(String name, int repetitions, List<String> signalNames) {
  public SignalGroup {
    Objects.requireNonNull(name, "name");
    signalNames = signalNames == null ? List.of() : List.copyOf(signalNames);
  }
}
