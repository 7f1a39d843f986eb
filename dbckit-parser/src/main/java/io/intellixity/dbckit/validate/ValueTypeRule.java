package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.model.Signal;

/** IEEE float signals are 32 bits long and IEEE double signals 64. */
public final class ValueTypeRule implements ValidationRule {
  @Override
  public void validate(ValidationContext ctx) {
    for (Message m : ctx.model().messages()) {
      for (Signal s : m.signals()) {
        int required = s.valueType().requiredLength();
        if (required != 0 && s.length() != required) {
          ctx.report(ProblemCode.INVALID_VALUE_TYPE, s,
              "signal '" + s.name() + "' of message '" + m.name() + "' is " + s.valueType() + " but "
                  + s.length() + " bits long, expected " + required);
        }
      }
    }
  }
}
