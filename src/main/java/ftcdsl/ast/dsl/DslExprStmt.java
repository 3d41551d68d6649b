package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslExprStmt(DslExpr expr, SourceSpan span) implements DslStmt {
}
