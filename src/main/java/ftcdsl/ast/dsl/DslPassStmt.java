package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslPassStmt(SourceSpan span) implements DslStmt {
}
