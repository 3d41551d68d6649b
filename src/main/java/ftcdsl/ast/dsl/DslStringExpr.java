package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * A string literal; {@code value} holds the decoded characters, without quotes.
 */
public record DslStringExpr(String value, SourceSpan span) implements DslExpr {
}
