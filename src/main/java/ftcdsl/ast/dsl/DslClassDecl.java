package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;
import java.util.Optional;

public record DslClassDecl(String name, List<DslDecorator> decorators, List<DslFunctionDecl> functions,
		SourceSpan span) implements DslNode {

	public Optional<DslFunctionDecl> function(String functionName) {
		return functions.stream()
				.filter(f -> f.name().equals(functionName))
				.findFirst();
	}
}
