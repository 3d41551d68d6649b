package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslAugAssignStmt(DslExpr target, String op, DslExpr value, SourceSpan span) implements DslStmt {
}
