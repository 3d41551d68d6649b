package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslNoneExpr(SourceSpan span) implements DslExpr {
}
