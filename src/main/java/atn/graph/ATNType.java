package atn.graph;

/**
 * Flavor of grammar an ATN was built from.
 *
 * Lexer ATNs populate the mode tables, the rule token types, and the lexer
 * actions. Parser ATNs leave those empty (except for rule token types when
 * rule bypass transitions were generated).
 */
public enum ATNType {
  LEXER,
  PARSER
}
