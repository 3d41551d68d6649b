package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * Placeholder for an expression form the translator has no rule for (list and dict literals,
 * subscripts). {@code description} names the form for diagnostics.
 */
public record DslUnsupportedExpr(String description, SourceSpan span) implements DslExpr {
}
