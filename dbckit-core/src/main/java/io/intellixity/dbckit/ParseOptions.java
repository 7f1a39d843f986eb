package io.intellixity.dbckit;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Properties;

/**
 * Parser behaviour switches.
 *
 * @param strictReferences   dangling node, value-table, comment and attribute references, and message ids
 *                           wider than their kind, fail the parse instead of becoming warnings
 * @param collectAllErrors   keep going after syntax and semantic errors and report all of them
 * @param reportUnrecognized add a warning for every statement with an unknown keyword
 * @param charset            decoding of the input bytes; malformed input is replaced, never rejected
 */
public record ParseOptions(boolean strictReferences,
                           boolean collectAllErrors,
                           boolean reportUnrecognized,
                           Charset charset) {
  public static final String PREFIX = "dbckit.parse.";
  public static final String STRICT_REFERENCES = PREFIX + "strict-references";
  public static final String COLLECT_ALL_ERRORS = PREFIX + "collect-all-errors";
  public static final String REPORT_UNRECOGNIZED = PREFIX + "report-unrecognized";
  public static final String CHARSET = PREFIX + "charset";

  public ParseOptions {
    charset = charset == null ? StandardCharsets.UTF_8 : charset;
  }

  public static ParseOptions defaults() {
    return new ParseOptions(false, false, false, StandardCharsets.UTF_8);
  }

  /** Strict references and full diagnostics; what linting tools usually want. */
  public static ParseOptions strict() {
    return new ParseOptions(true, true, true, StandardCharsets.UTF_8);
  }

  /**
   * Reads options from {@code dbckit.parse.*} keys; absent keys keep their default.
   * Unknown charset names fail with {@link IllegalArgumentException}.
   */
  public static ParseOptions fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    ParseOptions d = defaults();
    String cs = props.getProperty(CHARSET);
    return new ParseOptions(
        bool(props, STRICT_REFERENCES, d.strictReferences()),
        bool(props, COLLECT_ALL_ERRORS, d.collectAllErrors()),
        bool(props, REPORT_UNRECOGNIZED, d.reportUnrecognized()),
        (cs == null || cs.isBlank()) ? d.charset() : Charset.forName(cs.trim())
    );
  }

  public ParseOptions withStrictReferences(boolean v) {
    return new ParseOptions(v, collectAllErrors, reportUnrecognized, charset);
  }

  public ParseOptions withCollectAllErrors(boolean v) {
    return new ParseOptions(strictReferences, v, reportUnrecognized, charset);
  }

  public ParseOptions withReportUnrecognized(boolean v) {
    return new ParseOptions(strictReferences, collectAllErrors, v, charset);
  }

  public ParseOptions withCharset(Charset v) {
    return new ParseOptions(strictReferences, collectAllErrors, reportUnrecognized, v);
  }

  private static boolean bool(Properties props, String key, boolean dflt) {
    String v = props.getProperty(key);
    if (v == null || v.isBlank()) return dflt;
    return Boolean.parseBoolean(v.trim());
  }
}
