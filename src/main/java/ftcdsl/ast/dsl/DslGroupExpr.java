package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslGroupExpr(DslExpr inner, SourceSpan span) implements DslExpr {
}
