package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * {@code op} is the source operator: {@code "-"} or {@code "not"}.
 */
public record DslUnaryExpr(String op, DslExpr operand, SourceSpan span) implements DslExpr {
}
