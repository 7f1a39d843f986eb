package io.intellixity.dbckit;

import io.intellixity.dbckit.assemble.Assembly;
import io.intellixity.dbckit.assemble.DbcAssembler;
import io.intellixity.dbckit.grammar.StatementClassifier;
import io.intellixity.dbckit.lex.DbcLexer;
import io.intellixity.dbckit.lex.LexedStatement;
import io.intellixity.dbckit.model.DbcModel;
import io.intellixity.dbckit.model.Message;
import io.intellixity.dbckit.statement.DbcStatement;
import io.intellixity.dbckit.validate.DbcValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point: DBC bytes or text in, validated {@link DbcModel} out.\n
 *
 * Pipeline:\n
 * - decode (malformed bytes are replaced, never rejected)\n
 * - {@link DbcLexer} splits statements\n
 * - {@link StatementClassifier} applies the statement grammars\n
 * - {@link DbcAssembler} links everything into a model\n
 * - {@link DbcValidator} checks the finished model\n
 *
 * Errors are thrown as {@link DbcParseException}; warnings end up in {@link DbcModel#warnings()}.
 * Instances hold no per-parse state and may be shared between threads.\n
 */
public final class DbcParser {
  private static final Logger log = LoggerFactory.getLogger(DbcParser.class);

  private final ParseOptions options;
  private final DbcValidator validator;

  public DbcParser() {
    this(ParseOptions.defaults());
  }

  public DbcParser(ParseOptions options) {
    this(options, new DbcValidator());
  }

  public DbcParser(ParseOptions options, DbcValidator validator) {
    this.options = Objects.requireNonNull(options, "options");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public static DbcModel parse(byte[] bytes, ParseOptions options) {
    return new DbcParser(options).parse(bytes);
  }

  public static DbcModel parse(String text, ParseOptions options) {
    return new DbcParser(options).parse(text);
  }

  public ParseOptions options() {
    return options;
  }

  public DbcModel parse(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return parse(new String(bytes, options.charset()));
  }

  public DbcModel parse(String text) {
    Objects.requireNonNull(text, "text");
    long started = System.nanoTime();

    Diagnostics diagnostics = new Diagnostics(options);
    StatementClassifier classifier = new StatementClassifier(diagnostics);
    DbcAssembler assembler = new DbcAssembler(diagnostics);

    int statements = 0;
    try {
      try {
        for (LexedStatement lexed : new DbcLexer(text)) {
          statements++;
          DbcStatement statement = classifier.classify(lexed);
          if (statement != null) assembler.accept(statement);
        }
      } catch (DbcLexException e) {
        // rethrown together with whatever was collected so far
        diagnostics.report(e.first());
      }
      Assembly assembly = assembler.finish();
      validator.validate(assembly.model(), assembly.lines(), diagnostics);
      diagnostics.throwIfErrors();

      DbcModel model = assembly.model().withWarnings(diagnostics.warnings());
      logDone(model, statements, started);
      return model;
    } catch (DbcParseException e) {
      if (log.isDebugEnabled()) {
        log.debug("dbckit.parse_failed statements={} errors={} first={} durationMs={}",
            statements, e.problems().size(), e.first(), elapsedMs(started));
      }
      throw e;
    }
  }

  private static void logDone(DbcModel model, int statements, long started) {
    if (!log.isDebugEnabled()) return;
    int signals = 0;
    for (Message m : model.messages()) signals += m.signals().size();
    log.debug("dbckit.parse_done statements={} nodes={} messages={} signals={} warnings={} durationMs={}",
        statements, model.nodes().size(), model.messages().size(), signals, model.warnings().size(),
        elapsedMs(started));
  }

  private static long elapsedMs(long started) {
    return (System.nanoTime() - started) / 1_000_000L;
  }
}
