package ftcdsl.parse.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * The source cannot be lexed or parsed, or uses a construct outside the supported subset.
 */
public class DslSyntaxException extends RuntimeException {
	private final SourceSpan span;

	public DslSyntaxException(String message, SourceSpan span) {
		super(span.line() > 0 ? "line " + span.line() + ": " + message : message);
		this.span = span;
	}

	public SourceSpan span() {
		return span;
	}
}
