package ftcdsl.transform;

/**
 * OpMode metadata of a unit. With kind {@link OpModeKind#NONE} no annotation is emitted.
 */
public record UnitMetadata(String displayName, String groupName, OpModeKind kind, boolean disabled) {
	public static final String DEFAULT_GROUP = "Linear Opmode";

	public boolean hasAnnotation() {
		return kind != OpModeKind.NONE;
	}

	public String annotationLine() {
		return "@" + kind.annotation()
				+ "(name=" + ExpressionTranslator.stringLiteral(displayName)
				+ ", group=" + ExpressionTranslator.stringLiteral(groupName) + ")";
	}
}
