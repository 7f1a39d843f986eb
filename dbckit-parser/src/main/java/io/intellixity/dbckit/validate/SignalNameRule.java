package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.model.Signal;

import java.util.HashSet;
import java.util.Set;

/** Signal names are unique within their message. */
public final class SignalNameRule implements ValidationRule {
  @Override
  public void validate(ValidationContext ctx) {
    for (Message m : ctx.model().messages()) {
      Set<String> names = new HashSet<>();
      for (Signal s : m.signals()) {
        if (!names.add(s.name())) {
          ctx.report(ProblemCode.DUPLICATE_SIGNAL, s,
              "signal '" + s.name() + "' is declared more than once in message '" + m.name() + "'");
        }
      }
    }
  }
}
