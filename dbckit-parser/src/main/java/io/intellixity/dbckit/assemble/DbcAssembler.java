package io.intellixity.dbckit.assemble;

import io.intellixity.dbckit.Diagnostics;
import io.intellixity.dbckit.ProblemCode;
import io.intellixity.dbckit.layout.BitLayout;
import io.intellixity.dbckit.layout.BitLayoutException;
import io.intellixity.dbckit.layout.BitLayoutResolver;
import io.intellixity.dbckit.model.*;
import io.intellixity.dbckit.statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds typed statements, in file order, into one {@link DbcModel}.\n
 *
 * Phases:\n
 * - {@link #accept(DbcStatement)}: nodes, messages and their signals, value tables and attribute
 *   definitions are created as they arrive; every statement that points at other objects is buffered.\n
 * - {@link #finish()}: buffered statements are applied in file order, so forward references resolve.
 *   Then each message gets its bit layouts and multiplexing checks and is frozen.\n
 *
 * Problems go to the shared {@link Diagnostics}. An assembler is single use.\n
 */
public final class DbcAssembler {
  public static final String CYCLE_TIME_ATTRIBUTE = "GenMsgCycleTime";
  public static final String START_VALUE_ATTRIBUTE = "GenSigStartValue";

  private static final Logger log = LoggerFactory.getLogger(DbcAssembler.class);

  private final Diagnostics diagnostics;

  private String version;
  private List<String> newSymbols = List.of();
  private BitTiming bitTiming = BitTiming.UNSPECIFIED;
  private final Map<String, NodeBuilder> nodes = new LinkedHashMap<>();
  private final List<MessageBuilder> messages = new ArrayList<>();
  private final Map<MessageId, MessageBuilder> messagesById = new HashMap<>();
  private final Map<String, ValueTable> valueTables = new LinkedHashMap<>();
  private final Map<String, AttributeDefinition> definitions = new LinkedHashMap<>();
  private final Map<String, Object> networkAttributes = new LinkedHashMap<>();
  private String networkComment;
  private final List<DbcStatement> deferred = new ArrayList<>();

  private MessageBuilder current;
  private boolean droppingSignals;
  private boolean finished;

  public DbcAssembler(Diagnostics diagnostics) {
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  public void accept(DbcStatement statement) {
    Objects.requireNonNull(statement, "statement");
    if (finished) throw new IllegalStateException("assembler already finished");

    if (statement instanceof VersionStatement s) {
      version = s.version();
    } else if (statement instanceof NewSymbolsStatement s) {
      newSymbols = s.symbols();
    } else if (statement instanceof BitTimingStatement s) {
      bitTiming = s.timing();
    } else if (statement instanceof NodesStatement s) {
      addNodes(s);
    } else if (statement instanceof MessageStatement s) {
      addMessage(s);
    } else if (statement instanceof SignalStatement s) {
      addSignal(s);
    } else if (statement instanceof ValueTableStatement s) {
      addValueTable(s);
    } else if (statement instanceof AttributeDefinitionStatement s) {
      addDefinition(s);
    } else if (statement instanceof MalformedStatement s) {
      if (s.kind() == StatementKind.MESSAGE) {
        current = null;
        droppingSignals = true;
      }
    } else if (statement instanceof IgnoredStatement s) {
      if (log.isDebugEnabled()) log.debug("dbckit.ignore line={} kind={} reason={}", s.line(), s.kind(), s.reason());
    } else {
      deferred.add(statement);
    }
  }

  public Assembly finish() {
    if (finished) throw new IllegalStateException("assembler already finished");
    finished = true;

    for (DbcStatement s : deferred) resolve(s);

    SourceLines lines = new SourceLines();
    List<Node> builtNodes = new ArrayList<>(nodes.size());
    for (NodeBuilder nb : nodes.values()) {
      Node n = new Node(nb.name, nb.comment, nb.attributes);
      lines.put(n, nb.line);
      builtNodes.add(n);
    }

    List<Message> builtMessages = new ArrayList<>(messages.size());
    for (MessageBuilder mb : messages) {
      checkMultiplexing(mb);
      List<Signal> signals = new ArrayList<>(mb.signals.size());
      for (SignalBuilder sb : mb.signals) {
        Signal s = sb.build(layout(mb, sb), initialValue(sb));
        lines.put(s, sb.declared.line());
        signals.add(s);
      }
      Message m = mb.build(signals, cycleTime(mb));
      lines.put(m, mb.declared.line());
      builtMessages.add(m);
    }

    DbcModel model = new DbcModel(version, newSymbols, bitTiming, builtNodes, builtMessages, valueTables,
        new ArrayList<>(definitions.values()), networkAttributes, networkComment, List.of());
    return new Assembly(model, lines);
  }

  // ---- phase 1 ----

  private void addNodes(NodesStatement s) {
    for (String name : s.names()) {
      if (nodes.containsKey(name)) {
        diagnostics.report(ProblemCode.DUPLICATE_NODE, s.line(), "node '" + name + "' is declared more than once");
      } else {
        nodes.put(name, new NodeBuilder(name, s.line()));
      }
    }
  }

  private void addMessage(MessageStatement s) {
    MessageBuilder mb = new MessageBuilder(s);
    messages.add(mb);
    messagesById.putIfAbsent(mb.id, mb);
    current = mb;
    droppingSignals = false;
  }

  private void addSignal(SignalStatement s) {
    if (droppingSignals) {
      if (log.isDebugEnabled()) log.debug("dbckit.drop_signal line={} signal={} reason=malformed_message", s.line(), s.name());
      return;
    }
    if (current == null) {
      diagnostics.report(ProblemCode.ORPHAN_SIGNAL, s.line(), "signal '" + s.name() + "' is not preceded by a message");
      return;
    }
    current.signals.add(new SignalBuilder(s));
  }

  private void addValueTable(ValueTableStatement s) {
    if (valueTables.containsKey(s.name())) {
      diagnostics.report(ProblemCode.DUPLICATE_VALUE_TABLE, s.line(), "value table '" + s.name() + "' is declared more than once");
      return;
    }
    valueTables.put(s.name(), new ValueTable(s.name(), entries(s.entries(), s.line(), "value table '" + s.name() + "'")));
  }

  private void addDefinition(AttributeDefinitionStatement s) {
    AttributeDefinition def = s.definition();
    String key = definitionKey(def.target(), def.name());
    if (definitions.containsKey(key)) {
      diagnostics.report(ProblemCode.DUPLICATE_ATTRIBUTE_DEFINITION, s.line(),
          "attribute '" + def.name() + "' is defined more than once for " + targetLabel(def.target()));
      return;
    }
    definitions.put(key, def);
  }

  private Map<Long, String> entries(List<ValueEntry> entries, int line, String owner) {
    Map<Long, String> out = new LinkedHashMap<>();
    for (ValueEntry e : entries) {
      if (out.containsKey(e.value())) {
        diagnostics.report(ProblemCode.DUPLICATE_VALUE_ENTRY, line, owner + " describes value " + e.value() + " twice");
      } else {
        out.put(e.value(), e.label());
      }
    }
    return out;
  }

  // ---- phase 2 ----

  private void resolve(DbcStatement statement) {
    if (statement instanceof ValueDescriptionStatement s) {
      applyValueDescription(s);
    } else if (statement instanceof SignalValueTypeStatement s) {
      SignalBuilder sb = signal(s.line(), s.encodedId(), s.signalName());
      if (sb != null) sb.valueType = ValueType.fromExtendedCode(s.code(), sb.declared.valueType());
    } else if (statement instanceof MessageTransmittersStatement s) {
      MessageBuilder mb = message(s.line(), s.encodedId());
      if (mb != null) {
        for (String t : s.transmitters()) {
          if (!mb.additionalTransmitters.contains(t)) mb.additionalTransmitters.add(t);
        }
      }
    } else if (statement instanceof SignalGroupStatement s) {
      applySignalGroup(s);
    } else if (statement instanceof MultiplexRangeStatement s) {
      applyMultiplexRange(s);
    } else if (statement instanceof AttributeDefaultStatement s) {
      applyDefault(s);
    } else if (statement instanceof CommentStatement s) {
      applyComment(s);
    } else if (statement instanceof AttributeValueStatement s) {
      applyAttribute(s);
    } else {
      throw new IllegalStateException("No resolution step for " + statement.kind() + " at line " + statement.line());
    }
  }

  private void applyValueDescription(ValueDescriptionStatement s) {
    SignalBuilder sb = signal(s.line(), s.encodedId(), s.signalName());
    if (sb == null) return;
    if (s.referencesTable()) {
      ValueTable table = valueTables.get(s.tableName());
      if (table == null) {
        diagnostics.report(ProblemCode.DANGLING_REFERENCE, s.line(),
            "signal '" + s.signalName() + "' refers to unknown value table '" + s.tableName() + "'");
        return;
      }
      sb.valueTable = table.name();
      sb.valueDescriptions = new LinkedHashMap<>(table.entries());
    } else {
      sb.valueTable = null;
      sb.valueDescriptions = entries(s.entries(), s.line(), "signal '" + s.signalName() + "'");
    }
  }

  private void applySignalGroup(SignalGroupStatement s) {
    MessageBuilder mb = message(s.line(), s.encodedId());
    if (mb == null) return;
    List<String> members = new ArrayList<>();
    for (String name : s.signalNames()) {
      if (mb.signal(name) == null) {
        diagnostics.report(ProblemCode.DANGLING_REFERENCE, s.line(),
            "signal group '" + s.name() + "' names unknown signal '" + name + "' of message " + mb.id);
      } else {
        members.add(name);
      }
    }
    mb.signalGroups.add(new SignalGroup(s.name(), s.repetitions(), members));
  }

  private void applyMultiplexRange(MultiplexRangeStatement s) {
    SignalBuilder sb = signal(s.line(), s.encodedId(), s.signalName());
    if (sb == null) return;
    List<SwitchRange.Range> ranges = new ArrayList<>();
    if (sb.switchRange != null && sb.switchRange.switchName().equals(s.switchName())) {
      ranges.addAll(sb.switchRange.ranges());
    }
    ranges.addAll(s.ranges());
    sb.switchRange = new SwitchRange(s.switchName(), ranges);
  }

  private void applyDefault(AttributeDefaultStatement s) {
    boolean found = false;
    for (Map.Entry<String, AttributeDefinition> e : definitions.entrySet()) {
      AttributeDefinition def = e.getValue();
      if (def.name().equals(s.name())) {
        e.setValue(def.withDefaultValue(def.coerce(s.value())));
        found = true;
      }
    }
    if (!found) {
      diagnostics.report(ProblemCode.UNDEFINED_ATTRIBUTE, s.line(), "default given for undefined attribute '" + s.name() + "'");
    }
  }

  private void applyComment(CommentStatement s) {
    ObjectRef target = s.target();
    switch (target.target()) {
      case NETWORK -> networkComment = s.text();
      case NODE -> {
        NodeBuilder nb = node(s.line(), target);
        if (nb != null) nb.comment = s.text();
      }
      case MESSAGE -> {
        MessageBuilder mb = message(s.line(), target.messageId());
        if (mb != null) mb.comment = s.text();
      }
      case SIGNAL -> {
        SignalBuilder sb = signal(s.line(), target.messageId(), target.signalName());
        if (sb != null) sb.comment = s.text();
      }
      case ENVIRONMENT_VARIABLE -> {
        if (log.isDebugEnabled()) log.debug("dbckit.ignore line={} kind=COMMENT target={}", s.line(), target.describe());
      }
    }
  }

  private void applyAttribute(AttributeValueStatement s) {
    ObjectRef target = s.target();
    if (target.target() == AttributeTarget.ENVIRONMENT_VARIABLE) {
      if (log.isDebugEnabled()) log.debug("dbckit.ignore line={} kind=ATTRIBUTE_VALUE target={}", s.line(), target.describe());
      return;
    }
    AttributeDefinition def = definitions.get(definitionKey(target.target(), s.name()));
    if (def == null) {
      diagnostics.report(ProblemCode.UNDEFINED_ATTRIBUTE, s.line(),
          "attribute '" + s.name() + "' is not defined for " + targetLabel(target.target()));
      return;
    }
    Object value = def.coerce(s.value());
    switch (target.target()) {
      case NETWORK -> networkAttributes.put(s.name(), value);
      case NODE -> {
        NodeBuilder nb = node(s.line(), target);
        if (nb != null) nb.attributes.put(s.name(), value);
      }
      case MESSAGE -> {
        MessageBuilder mb = message(s.line(), target.messageId());
        if (mb != null) mb.attributes.put(s.name(), value);
      }
      case SIGNAL -> {
        SignalBuilder sb = signal(s.line(), target.messageId(), target.signalName());
        if (sb != null) sb.attributes.put(s.name(), value);
      }
      case ENVIRONMENT_VARIABLE -> throw new IllegalStateException("environment variable attributes are skipped above");
    }
  }

  private NodeBuilder node(int line, ObjectRef ref) {
    NodeBuilder nb = nodes.get(ref.name());
    if (nb == null) diagnostics.report(ProblemCode.DANGLING_REFERENCE, line, "unknown " + ref.describe());
    return nb;
  }

  private MessageBuilder message(int line, long encodedId) {
    MessageId id = MessageId.of(encodedId);
    MessageBuilder mb = messagesById.get(id);
    if (mb == null) diagnostics.report(ProblemCode.DANGLING_REFERENCE, line, "unknown message " + id);
    return mb;
  }

  private SignalBuilder signal(int line, long encodedId, String signalName) {
    MessageBuilder mb = message(line, encodedId);
    if (mb == null) return null;
    SignalBuilder sb = mb.signal(signalName);
    if (sb == null) {
      diagnostics.report(ProblemCode.DANGLING_REFERENCE, line, "unknown signal '" + signalName + "' of message " + mb.id);
    }
    return sb;
  }

  // ---- phase 3 ----

  private BitLayout layout(MessageBuilder mb, SignalBuilder sb) {
    SignalStatement s = sb.declared;
    try {
      if (mb.isIndependentSignals()) return BitLayoutResolver.resolve(s.startBit(), s.length(), s.byteOrder());
      return BitLayoutResolver.resolve(s.startBit(), s.length(), s.byteOrder(), mb.declared.size());
    } catch (BitLayoutException e) {
      diagnostics.report(ProblemCode.BIT_RANGE_OVERFLOW, s.line(),
          "signal '" + s.name() + "' of message '" + mb.declared.name() + "': " + e.getMessage());
      return null;
    }
  }

  private void checkMultiplexing(MessageBuilder mb) {
    int line = mb.declared.line();
    String name = mb.declared.name();

    List<SignalBuilder> multiplexors = new ArrayList<>();
    boolean anyMultiplexed = false;
    for (SignalBuilder sb : mb.signals) {
      MultiplexRole role = sb.declared.multiplex();
      if (role.kind() == MultiplexRole.Kind.MULTIPLEXOR) multiplexors.add(sb);
      if (role.isMultiplexed()) anyMultiplexed = true;
    }

    if (multiplexors.size() > 1) {
      List<String> names = new ArrayList<>();
      for (SignalBuilder sb : multiplexors) names.add(sb.name());
      diagnostics.report(ProblemCode.MULTIPLE_MULTIPLEXORS, line,
          "message '" + name + "' declares more than one multiplexor: " + String.join(", ", names));
    }
    if (anyMultiplexed && multiplexors.isEmpty()) {
      diagnostics.report(ProblemCode.MULTIPLEXOR_MISSING, line,
          "message '" + name + "' has multiplexed signals but no multiplexor signal");
      return;
    }

    for (SignalBuilder sb : mb.signals) {
      SwitchRange range = sb.switchRange;
      if (range == null) continue;
      int sigLine = sb.declared.line();
      SignalBuilder selector = mb.signal(range.switchName());
      if (selector == null || !selector.declared.multiplex().isMultiplexor()) {
        diagnostics.report(ProblemCode.MULTIPLEXOR_MISSING, sigLine,
            "signal '" + sb.name() + "' is switched by '" + range.switchName() + "', which is not a multiplexor of message '" + name + "'");
        continue;
      }
      long max = maxRaw(selector.declared.length());
      for (SwitchRange.Range r : range.ranges()) {
        if (r.to() > max) {
          diagnostics.report(ProblemCode.SWITCH_VALUE_OUT_OF_RANGE, sigLine,
              "switch range " + r.from() + "-" + r.to() + " of signal '" + sb.name() + "' exceeds the "
                  + selector.declared.length() + "-bit multiplexor '" + selector.name() + "'");
        }
      }
      MultiplexRole role = sb.declared.multiplex();
      if (role.isMultiplexed() && !range.contains(role.switchValue())) {
        diagnostics.report(ProblemCode.SWITCH_VALUE_OUT_OF_RANGE, sigLine,
            "switch value " + role.switchValue() + " of signal '" + sb.name() + "' is outside its declared ranges");
      }
    }
  }

  private static long maxRaw(int bits) {
    if (bits <= 0) return 0;
    return bits >= 63 ? Long.MAX_VALUE : (1L << bits) - 1;
  }

  private long cycleTime(MessageBuilder mb) {
    Object v = mb.attributes.get(CYCLE_TIME_ATTRIBUTE);
    if (v == null) v = defaultValue(AttributeTarget.MESSAGE, CYCLE_TIME_ATTRIBUTE);
    return v instanceof Number n ? n.longValue() : 0L;
  }

  private double initialValue(SignalBuilder sb) {
    Object v = sb.attributes.get(START_VALUE_ATTRIBUTE);
    if (v == null) v = defaultValue(AttributeTarget.SIGNAL, START_VALUE_ATTRIBUTE);
    return v instanceof Number n ? n.doubleValue() : 0.0;
  }

  private Object defaultValue(AttributeTarget target, String name) {
    AttributeDefinition def = definitions.get(definitionKey(target, name));
    return def == null ? null : def.defaultValue();
  }

  private static String definitionKey(AttributeTarget target, String name) {
    return target.name() + ':' + name;
  }

  private static String targetLabel(AttributeTarget target) {
    return target == AttributeTarget.NETWORK ? "the network" : target.keyword() + " objects";
  }

  private static final class NodeBuilder {
    final String name;
    final int line;
    String comment;
    final Map<String, Object> attributes = new LinkedHashMap<>();

    NodeBuilder(String name, int line) {
      this.name = name;
      this.line = line;
    }
  }
}
