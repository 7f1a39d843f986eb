package io.intellixity.dbckit.statement;

import io.intellixity.dbckit.model.AttributeTarget;
import io.intellixity.dbckit.model.MessageId;

import java.util.Objects;

/**
 * Target of a comment or attribute value.
 * <p>
 * {@code name} is the node or environment variable name, {@code messageId} the encoded message id for
 * message and signal targets, {@code signalName} the signal for signal targets.
 */
public record ObjectRef(AttributeTarget target, String name, long messageId, String signalName) {
  public static final ObjectRef NETWORK = new ObjectRef(AttributeTarget.NETWORK, null, -1, null);

  public ObjectRef {
    Objects.requireNonNull(target, "target");
  }

  public static ObjectRef node(String name) {
    return new ObjectRef(AttributeTarget.NODE, name, -1, null);
  }

  public static ObjectRef message(long messageId) {
    return new ObjectRef(AttributeTarget.MESSAGE, null, messageId, null);
  }

  public static ObjectRef signal(long messageId, String signalName) {
    return new ObjectRef(AttributeTarget.SIGNAL, null, messageId, signalName);
  }

  public static ObjectRef environmentVariable(String name) {
    return new ObjectRef(AttributeTarget.ENVIRONMENT_VARIABLE, name, -1, null);
  }

  public MessageId id() {
    return MessageId.of(messageId);
  }

  public String describe() {
    return switch (target) {
      case NETWORK -> "network";
      case NODE -> "node '" + name + "'";
      case MESSAGE -> "message " + id();
      case SIGNAL -> "signal '" + signalName + "' of message " + id();
      case ENVIRONMENT_VARIABLE -> "environment variable '" + name + "'";
    };
  }
}
