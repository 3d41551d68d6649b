package ftcdsl.ast.dsl;

public sealed interface DslStmt extends DslNode
		permits DslAssignStmt, DslAugAssignStmt, DslExprStmt, DslIfStmt, DslWhileStmt, DslPassStmt {
}
