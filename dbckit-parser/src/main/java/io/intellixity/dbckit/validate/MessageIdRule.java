package io.intellixity.dbckit.validate;

import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.model.MessageId;

import java.util.HashMap;
import java.util.Map;

/**
 * Message identifiers are unique per kind and fit their kind's width (11 or 29 bits). The
 * {@code VECTOR__INDEPENDENT_SIG_MSG} pseudo-message is exempt from the range check.
 */
public final class MessageIdRule implements ValidationRule {
  @Override
  public void validate(ValidationContext ctx) {
    Map<MessageId, Message> seen = new HashMap<>();
    for (Message m : ctx.model().messages()) {
      MessageId id = m.id();
      if (!id.inRange() && !m.isIndependentSignals()) {
        ctx.report(ProblemCode.INVALID_MESSAGE_ID, m,
            "message '" + m.name() + "' id " + id.raw() + " does not fit in " + id.kind().bits() + " bits");
      }
      Message first = seen.putIfAbsent(id, m);
      if (first != null) {
        ctx.report(ProblemCode.DUPLICATE_MESSAGE_ID, m,
            "message '" + m.name() + "' reuses id " + id + " of message '" + first.name()
                + "' (line " + ctx.lineOf(first) + ")");
      }
    }
  }
}
