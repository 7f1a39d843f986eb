package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.lex.Token;
import io.intellixity.dbckit.lex.TokenType;
import io.intellixity.dbckit.model.AttributeDefinition;
import io.intellixity.dbckit.model.AttributeTarget;
import io.intellixity.dbckit.model.AttributeType;
import io.intellixity.dbckit.statement.*;

import java.util.ArrayList;
import java.util.List;

/** Comments and the attribute statements BA_DEF_, BA_DEF_DEF_ and BA_. */
final class AttributeGrammars {
  private AttributeGrammars() {}

  // CM_ SG_ 256 RPM "Engine speed"
  static DbcStatement comment(TokenCursor in) {
    ObjectRef target = at(in.peek()) == null ? ObjectRef.NETWORK : objectRef(in);
    String text = in.string("comment text");
    in.expectEnd();
    return new CommentStatement(in.line(), target, text);
  }

  // BA_DEF_ BO_ "GenMsgCycleTime" INT 0 65535
  static DbcStatement attributeDefinition(TokenCursor in) {
    AttributeTarget target = AttributeTarget.NETWORK;
    AttributeTarget named = at(in.peek());
    if (named != null) {
      in.next();
      target = named;
    }
    String name = in.string("attribute name");
    AttributeType type = attributeType(in);

    Number min = null;
    Number max = null;
    List<String> enumValues = new ArrayList<>();
    switch (type) {
      case INT, HEX -> {
        min = (long) in.number("minimum");
        max = (long) in.number("maximum");
      }
      case FLOAT -> {
        min = in.number("minimum");
        max = in.number("maximum");
      }
      case ENUM -> {
        while (!in.atEnd()) {
          enumValues.add(in.string("enumeration value"));
          in.accept(TokenType.COMMA);
        }
      }
      case STRING -> {
      }
    }
    in.expectEnd();
    return new AttributeDefinitionStatement(in.line(),
        new AttributeDefinition(name, target, type, min, max, enumValues, null));
  }

  // BA_DEF_DEF_ "GenMsgCycleTime" 100
  static DbcStatement attributeDefault(TokenCursor in) {
    String name = in.string("attribute name");
    Object value = in.value("default value");
    in.expectEnd();
    return new AttributeDefaultStatement(in.line(), name, value);
  }

  // BA_ "GenMsgCycleTime" BO_ 256 100
  static DbcStatement attributeValue(TokenCursor in) {
    String name = in.string("attribute name");
    ObjectRef target = at(in.peek()) == null ? ObjectRef.NETWORK : objectRef(in);
    Object value = in.value("attribute value");
    in.expectEnd();
    return new AttributeValueStatement(in.line(), name, target, value);
  }

  /** Object type keyword at {@code t}, or null when {@code t} does not name one. */
  private static AttributeTarget at(Token t) {
    if (t == null || !t.is(TokenType.IDENTIFIER)) return null;
    AttributeTarget target = AttributeTarget.fromKeyword(t.text());
    return target == AttributeTarget.NETWORK ? null : target;
  }

  private static ObjectRef objectRef(TokenCursor in) {
    AttributeTarget target = at(in.next());
    return switch (target) {
      case NODE -> ObjectRef.node(in.identifier("node name"));
      case MESSAGE -> ObjectRef.message(MessageGrammars.messageId(in));
      case SIGNAL -> {
        long id = MessageGrammars.messageId(in);
        yield ObjectRef.signal(id, in.identifier("signal name"));
      }
      case ENVIRONMENT_VARIABLE -> ObjectRef.environmentVariable(in.identifier("environment variable name"));
      case NETWORK -> ObjectRef.NETWORK;
    };
  }

  private static AttributeType attributeType(TokenCursor in) {
    Token t = in.peek();
    if (t != null && t.is(TokenType.IDENTIFIER)) {
      for (AttributeType type : AttributeType.values()) {
        if (type.name().equals(t.text())) {
          in.next();
          return type;
        }
      }
    }
    throw in.error("attribute type INT, HEX, FLOAT, STRING or ENUM");
  }
}
