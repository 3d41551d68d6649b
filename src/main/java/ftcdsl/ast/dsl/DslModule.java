package ftcdsl.ast.dsl;

import ftcdsl.ast.SourceSpan;

/**
 * A parsed source file. The parser only accepts files holding exactly one unit.
 */
public record DslModule(DslClassDecl unit, SourceSpan span) implements DslNode {
}
