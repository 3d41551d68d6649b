package ftcdsl.transform;

import ftcdsl.ast.dsl.DslAttributeExpr;
import ftcdsl.ast.dsl.DslBinaryExpr;
import ftcdsl.ast.dsl.DslBooleanExpr;
import ftcdsl.ast.dsl.DslCallExpr;
import ftcdsl.ast.dsl.DslExpr;
import ftcdsl.ast.dsl.DslGroupExpr;
import ftcdsl.ast.dsl.DslNameExpr;
import ftcdsl.ast.dsl.DslNoneExpr;
import ftcdsl.ast.dsl.DslNumberExpr;
import ftcdsl.ast.dsl.DslStringExpr;
import ftcdsl.ast.dsl.DslUnaryExpr;
import ftcdsl.transform.MappingTables.CallTemplate;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders surface expressions as Java expression text.
 *
 * Translation never fails: forms without a rule render as an inline marker comment so the rest of
 * the unit stays translatable. Instances hold only immutable context (the receiver name of the
 * enclosing routine and the routine names declared by the unit).
 */
public final class ExpressionTranslator {
	public static final String UNKNOWN_EXPRESSION = "/* UNKNOWN EXPRESSION */";
	public static final String UNKNOWN_CALL = "/* UNKNOWN CALL */";
	public static final String UNKNOWN_MODE = "/* UNKNOWN MODE */";

	private final String receiver;
	private final Set<String> routines;

	/**
	 * @param receiver the implicit receiver name, or null for a routine without one
	 * @param routines surface names of the routines callable on the receiver
	 */
	public ExpressionTranslator(String receiver, Set<String> routines) {
		this.receiver = receiver;
		this.routines = Set.copyOf(routines);
	}

	public static boolean isMarker(String text) {
		return text.startsWith("/*");
	}

	public String translate(DslExpr expr) {
		if (expr instanceof DslNumberExpr num) {
			return num.text();
		}
		if (expr instanceof DslStringExpr str) {
			return stringLiteral(str.value());
		}
		if (expr instanceof DslBooleanExpr bool) {
			return String.valueOf(bool.value());
		}
		if (expr instanceof DslNoneExpr) {
			return "null";
		}
		if (expr instanceof DslNameExpr name) {
			return name.name();
		}
		if (expr instanceof DslAttributeExpr attr) {
			return translateAttribute(attr);
		}
		if (expr instanceof DslUnaryExpr unary) {
			return translateUnary(unary);
		}
		if (expr instanceof DslBinaryExpr bin) {
			return translate(bin.left()) + " " + operator(bin.op()) + " " + translate(bin.right());
		}
		if (expr instanceof DslCallExpr call) {
			return translateCall(call);
		}
		if (expr instanceof DslGroupExpr group) {
			return "(" + translate(group.inner()) + ")";
		}
		return UNKNOWN_EXPRESSION;
	}

	public static String operator(String op) {
		return MappingTables.BINARY_OPERATORS.getOrDefault(op, MappingTables.UNMAPPED_OPERATOR);
	}

	/**
	 * Quotes {@code value} as a Java string literal.
	 */
	public static String stringLiteral(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\%03o", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}

	private String translateAttribute(DslAttributeExpr attr) {
		if (attr.isRootedAt(receiver)) {
			// fields are referenced unqualified
			return attr.attribute();
		}
		if (attr.target() instanceof DslNameExpr root && MappingTables.GAMEPADS.contains(root.name())) {
			return root.name() + "." + MappingTables.GAMEPAD_FIELDS.getOrDefault(attr.attribute(), attr.attribute());
		}

		String target = translate(attr.target());
		if (isMarker(target)) {
			return target;
		}
		return target + "." + attr.attribute();
	}

	private String translateUnary(DslUnaryExpr unary) {
		String operand = translate(unary.operand());
		if (unary.operand() instanceof DslBinaryExpr) {
			operand = "(" + operand + ")";
		}
		if (unary.op().equals("not")) {
			return "!" + operand;
		}
		// keep "- -x" from turning into a decrement
		return operand.startsWith("-") ? "- " + operand : "-" + operand;
	}

	private String translateCall(DslCallExpr call) {
		if (call.callee() instanceof DslAttributeExpr method) {
			return translateMethodCall(method, call.args());
		}
		if (call.callee() instanceof DslNameExpr function) {
			CallTemplate intrinsic = MappingTables.INTRINSICS.get(function.name());
			if (intrinsic == null || intrinsic.arity() != call.args().size()) {
				return UNKNOWN_CALL;
			}
			return render(intrinsic, call.args());
		}
		return UNKNOWN_CALL;
	}

	private String translateMethodCall(DslAttributeExpr method, List<DslExpr> args) {
		if (method.isRootedAt(receiver)) {
			if (!routines.contains(method.attribute())) {
				return UNKNOWN_CALL;
			}
			return MappingTables.routineName(method.attribute()) + "(" + arguments(args) + ")";
		}

		CallTemplate template = MappingTables.RECEIVER_METHODS.get(method.attribute());
		if (template == null || template.arity() != args.size()) {
			return UNKNOWN_CALL;
		}
		String target = translate(method.target());
		if (isMarker(target)) {
			return UNKNOWN_CALL;
		}
		return target + "." + render(template, args);
	}

	private String render(CallTemplate template, List<DslExpr> args) {
		switch (template.style()) {
			case DISTANCE_UNIT -> {
				return template.target() + "(" + MappingTables.DISTANCE_UNIT + ")";
			}
			case RUN_MODE -> {
				String mode = null;
				if (args.get(0) instanceof DslStringExpr literal) {
					mode = MappingTables.RUN_MODES.get(literal.value());
				}
				return template.target() + "(" + (mode == null ? UNKNOWN_MODE : mode) + ")";
			}
			default -> {
				return template.target() + "(" + arguments(args) + ")";
			}
		}
	}

	private String arguments(List<DslExpr> args) {
		return args.stream()
				.map(this::translate)
				.collect(Collectors.joining(", "));
	}
}
