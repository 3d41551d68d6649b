package ftcdsl.ast.dsl;

public sealed interface DslExpr extends DslNode
		permits DslNumberExpr, DslStringExpr, DslBooleanExpr, DslNoneExpr, DslNameExpr, DslAttributeExpr,
		DslUnaryExpr, DslBinaryExpr, DslCallExpr, DslGroupExpr, DslUnsupportedExpr {
}
