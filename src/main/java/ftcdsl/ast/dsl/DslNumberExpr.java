package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslNumberExpr(String text, SourceSpan span) implements DslExpr {
}
