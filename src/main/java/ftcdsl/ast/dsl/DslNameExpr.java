package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslNameExpr(String name, SourceSpan span) implements DslExpr {
}
