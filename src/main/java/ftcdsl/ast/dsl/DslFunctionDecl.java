package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;

/**
 * A routine definition. The first declared parameter is the implicit receiver and is kept apart from
 * {@code params}; a routine without parameters has no receiver.
 */
public record DslFunctionDecl(String name, String receiver, List<String> params, List<DslStmt> body,
		SourceSpan span) implements DslNode {
}
