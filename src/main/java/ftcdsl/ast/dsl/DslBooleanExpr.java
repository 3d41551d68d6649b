package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslBooleanExpr(boolean value, SourceSpan span) implements DslExpr {
}
