package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.model.Node;
import io.intellixity.dbckit.model.Signal;

import java.util.HashSet;
import java.util.Set;

/** Transmitters and receivers name nodes declared in {@code BU_}; {@code Vector__XXX} stands for none. */
public final class NodeReferenceRule implements ValidationRule {
  @Override
  public void validate(ValidationContext ctx) {
    Set<String> declared = new HashSet<>();
    for (Node n : ctx.model().nodes()) declared.add(n.name());

    for (Message m : ctx.model().messages()) {
      if (m.hasTransmitter()) check(ctx, declared, m.transmitter(), m, "transmitter of message '" + m.name() + "'");
      for (String t : m.additionalTransmitters()) {
        check(ctx, declared, t, m, "transmitter of message '" + m.name() + "'");
      }
      for (Signal s : m.signals()) {
        for (String r : s.receivers()) {
          check(ctx, declared, r, s, "receiver of signal '" + s.name() + "'");
        }
      }
    }
  }

  private static void check(ValidationContext ctx, Set<String> declared, String node, Object at, String role) {
    if (Message.NO_NODE.equals(node) || declared.contains(node)) return;
    ctx.report(ProblemCode.UNKNOWN_NODE, at, role + " '" + node + "' is not a declared node");
  }
}
