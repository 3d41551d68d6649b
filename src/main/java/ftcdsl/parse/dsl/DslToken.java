package ftcdsl.parse.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * For {@link DslTokenType#STRING} the lexeme is the decoded literal value, without quotes.
 */
public record DslToken(DslTokenType type, String lexeme, SourceSpan span) {

	String describe() {
		return switch (type) {
			case NEWLINE -> "end of line";
			case INDENT -> "indent";
			case DEDENT -> "dedent";
			case EOF -> "end of input";
			case STRING -> "string literal";
			default -> "'" + lexeme + "'";
		};
	}
}
