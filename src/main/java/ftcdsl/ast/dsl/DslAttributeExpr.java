package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

public record DslAttributeExpr(DslExpr target, String attribute, SourceSpan span) implements DslExpr {

	/**
	 * True for {@code name.attribute} where the root is the bare name {@code name}.
	 */
	public boolean isRootedAt(String name) {
		return name != null && target instanceof DslNameExpr root && root.name().equals(name);
	}
}
