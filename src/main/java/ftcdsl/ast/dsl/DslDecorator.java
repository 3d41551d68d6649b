package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.List;

/**
 * {@code @name} or {@code @name(args)}. {@code called} distinguishes {@code @x()} from {@code @x}.
 */
public record DslDecorator(String name, List<DslExpr> args, boolean called, SourceSpan span) implements DslNode {
}
