package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslBinaryExpr(DslExpr left, String op, DslExpr right, SourceSpan span) implements DslExpr {
}
