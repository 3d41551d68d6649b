package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;

/**
 * An {@code if} with its {@code elif} branches in order. {@code elseBody} is empty when there is no
 * {@code else}.
 */
public record DslIfStmt(List<Branch> branches, List<DslStmt> elseBody, SourceSpan span) implements DslStmt {

	public record Branch(DslExpr condition, List<DslStmt> body) {
	}
}
