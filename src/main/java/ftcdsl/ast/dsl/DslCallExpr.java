package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;

public record DslCallExpr(DslExpr callee, List<DslExpr> args, SourceSpan span) implements DslExpr {
}
