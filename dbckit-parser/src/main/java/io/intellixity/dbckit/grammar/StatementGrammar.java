package io.intellixity.dbckit.grammar;

import io.intellixity.dbckit.statement.DbcStatement;

/**
 * Grammar of one statement kind. Receives the tokens after the keyword and must consume all of them.
 * Implementations are stateless and know nothing about other statements.
 */
@FunctionalInterface
public interface StatementGrammar {
  DbcStatement parse(TokenCursor in);
}
