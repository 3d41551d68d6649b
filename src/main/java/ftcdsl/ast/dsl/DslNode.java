package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public sealed interface DslNode permits DslModule, DslClassDecl, DslDecorator, DslFunctionDecl, DslStmt, DslExpr {
	SourceSpan span();
}
