package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * {@code target = value}; the target is a {@link DslNameExpr} or a {@link DslAttributeExpr}.
 */
public record DslAssignStmt(DslExpr target, DslExpr value, SourceSpan span) implements DslStmt {
}
