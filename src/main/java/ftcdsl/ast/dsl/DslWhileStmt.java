package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;

public record DslWhileStmt(DslExpr condition, List<DslStmt> body, SourceSpan span) implements DslStmt {
}
