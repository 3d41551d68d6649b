package ftcdsl.transform;

import ftcdsl.ast.SourceSpan;
import ftcdsl.ast.dsl.DslAssignStmt;
import ftcdsl.ast.dsl.DslAugAssignStmt;
import ftcdsl.ast.dsl.DslCallExpr;
import ftcdsl.ast.dsl.DslClassDecl;
import ftcdsl.ast.dsl.DslExpr;
import ftcdsl.ast.dsl.DslExprStmt;
import ftcdsl.ast.dsl.DslFunctionDecl;
import ftcdsl.ast.dsl.DslGroupExpr;
import ftcdsl.ast.dsl.DslIfStmt;
import ftcdsl.ast.dsl.DslNameExpr;
import ftcdsl.ast.dsl.DslPassStmt;
import ftcdsl.ast.dsl.DslStmt;
import ftcdsl.ast.dsl.DslStringExpr;
import ftcdsl.ast.dsl.DslWhileStmt;
import ftcdsl.print.EmissionBuffer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Emits the Java class for one unit.
 *
 * Lifecycle routines get structural treatment: the initializer receives the hardware lookups, the
 * entry routine becomes {@code runOpMode()} behind the standard init/telemetry/waitForStart
 * prelude, and {@code loop} is wrapped in an {@code opModeIsActive()} polling loop. Every other
 * routine becomes a private void method whose parameters are all {@code double}.
 *
 * Not reusable: create one emitter per unit.
 */
@Slf4j
public final class StatementEmitter {
	public static final String FRAMEWORK_BASE_CLASS = "LinearOpMode";
	public static final String UNKNOWN_STATEMENT = "/* UNKNOWN STATEMENT */";
	public static final String UNKNOWN_DIRECTION = "/* UNKNOWN DIRECTION */";

	private final UnitMetadata metadata;
	private final ComponentRegistry registry;
	private final EmissionBuffer out = new EmissionBuffer();
	private final Deque<Set<String>> scopes = new ArrayDeque<>();

	private Set<String> routines = Set.of();
	private ExpressionTranslator expressions;
	private String receiver;
	private boolean firstMember = true;

	public StatementEmitter(UnitMetadata metadata, ComponentRegistry registry) {
		this.metadata = metadata;
		this.registry = registry;
	}

	public String emit(DslClassDecl unit) {
		if (metadata.hasAnnotation()) {
			out.line(metadata.annotationLine());
		}
		if (metadata.disabled()) {
			out.line("@Disabled");
		}
		out.open("public class " + unit.name() + " extends " + FRAMEWORK_BASE_CLASS);

		if (!registry.isEmpty()) {
			out.line("// Hardware components");
			for (HardwareComponent component : registry.components()) {
				out.line("private " + component.targetType() + " " + component.declaredName() + " = null;");
			}
			out.blank();
		}

		Set<String> names = new LinkedHashSet<>();
		unit.functions().forEach(f -> names.add(f.name()));
		names.add(MappingTables.INITIALIZER_ROUTINE);
		names.add(MappingTables.ENTRY_ROUTINE);
		routines = Set.copyOf(names);

		for (DslFunctionDecl function : unit.functions()) {
			emitRoutine(function);
		}
		// LinearOpMode needs runOpMode(), and the prelude always calls initHardware()
		if (unit.function(MappingTables.INITIALIZER_ROUTINE).isEmpty()) {
			emitRoutine(synthesized(MappingTables.INITIALIZER_ROUTINE));
		}
		if (unit.function(MappingTables.ENTRY_ROUTINE).isEmpty()) {
			emitRoutine(synthesized(MappingTables.ENTRY_ROUTINE));
		}

		out.close();
		return out.finish();
	}

	private static DslFunctionDecl synthesized(String name) {
		return new DslFunctionDecl(name, null, List.of(), List.of(), SourceSpan.NONE);
	}

	private void emitRoutine(DslFunctionDecl function) {
		if (!firstMember) {
			out.blank();
		}
		firstMember = false;

		receiver = function.receiver();
		expressions = new ExpressionTranslator(receiver, routines);
		scopes.clear();
		scopes.push(new HashSet<>(function.params()));

		switch (function.name()) {
			case MappingTables.INITIALIZER_ROUTINE -> {
				warnIfParameters(function);
				out.open("private void " + MappingTables.routineName(function.name()) + "()");
				emitBody(function.body());
				out.close();
			}
			case MappingTables.ENTRY_ROUTINE -> {
				warnIfParameters(function);
				out.line("@Override");
				out.open("public void " + MappingTables.routineName(function.name()) + "()");
				emitEntryPrelude(emitsCode(function.body()));
				emitBody(function.body());
				out.close();
			}
			case MappingTables.LOOP_ROUTINE -> {
				warnIfParameters(function);
				out.open("private void " + MappingTables.routineName(function.name()) + "()");
				out.open("while (opModeIsActive())");
				emitBody(function.body());
				out.line("telemetry.update();");
				out.close();
				out.close();
			}
			default -> {
				String params = function.params().stream()
						.map(p -> "double " + p)
						.collect(Collectors.joining(", "));
				out.open("private void " + function.name() + "(" + params + ")");
				emitBody(function.body());
				out.close();
			}
		}
	}

	private static void warnIfParameters(DslFunctionDecl function) {
		if (!function.params().isEmpty()) {
			log.warn("parameters {} of '{}' are dropped, lifecycle routines take none", function.params(),
					function.name());
		}
	}

	private void emitEntryPrelude(boolean bodyFollows) {
		out.line(MappingTables.routineName(MappingTables.INITIALIZER_ROUTINE) + "();");
		out.blank();
		out.line("telemetry.addData(\"Status\", \"Initialized\");");
		out.line("telemetry.update();");
		out.blank();
		out.line("waitForStart();");
		if (bodyFollows) {
			out.blank();
		}
	}

	private static boolean emitsCode(List<DslStmt> body) {
		return body.stream().anyMatch(s -> !(s instanceof DslPassStmt)
				&& !(s instanceof DslExprStmt e && e.expr() instanceof DslStringExpr));
	}

	private void emitBody(List<DslStmt> body) {
		for (DslStmt stmt : body) {
			emitStatement(stmt);
		}
	}

	private void emitScoped(List<DslStmt> body) {
		scopes.push(new HashSet<>());
		emitBody(body);
		scopes.pop();
	}

	private void emitStatement(DslStmt stmt) {
		if (stmt instanceof DslAssignStmt assign) {
			emitAssign(assign);
		} else if (stmt instanceof DslAugAssignStmt aug) {
			out.line(expressions.translate(aug.target()) + " " + ExpressionTranslator.operator(aug.op()) + "= "
					+ expressions.translate(aug.value()) + ";");
		} else if (stmt instanceof DslExprStmt exprStmt) {
			emitExpressionStatement(exprStmt);
		} else if (stmt instanceof DslIfStmt ifStmt) {
			emitIf(ifStmt);
		} else if (stmt instanceof DslWhileStmt loop) {
			out.open("while (" + condition(loop.condition()) + ")");
			emitScoped(loop.body());
			out.close();
		}
		// pass emits nothing
	}

	private void emitAssign(DslAssignStmt assign) {
		Optional<HardwareComponent> hardware = registry.componentFor(assign)
				.or(() -> ComponentRegistry.describe(assign, receiver));
		if (hardware.isPresent()) {
			emitHardwareInit(hardware.get());
			return;
		}

		String value = expressions.translate(assign.value());
		if (assign.target() instanceof DslNameExpr local) {
			// locals are untyped in the source, declare them all as double
			String prefix = declare(local.name()) ? "double " : "";
			out.line(prefix + local.name() + " = " + value + ";");
			return;
		}
		out.line(expressions.translate(assign.target()) + " = " + value + ";");
	}

	/**
	 * Returns true when {@code name} is not yet visible in the current scope chain, registering it.
	 */
	private boolean declare(String name) {
		for (Set<String> scope : scopes) {
			if (scope.contains(name)) {
				return false;
			}
		}
		scopes.peek().add(name);
		return true;
	}

	private void emitHardwareInit(HardwareComponent component) {
		String name = component.declaredName();
		out.line(name + " = hardwareMap.get(" + component.targetType() + ".class, "
				+ ExpressionTranslator.stringLiteral(component.configName()) + ");");
		if (component.kind() == HardwareKind.MOTOR && component.hasDirection()) {
			out.line(name + ".setDirection(" + component.direction().orElse(UNKNOWN_DIRECTION) + ");");
		}
	}

	private void emitExpressionStatement(DslExprStmt stmt) {
		DslExpr expr = stmt.expr();
		if (expr instanceof DslStringExpr) {
			// docstring
			return;
		}
		if (!(expr instanceof DslCallExpr)) {
			out.line(UNKNOWN_STATEMENT);
			return;
		}
		String call = expressions.translate(expr);
		out.line(ExpressionTranslator.isMarker(call) ? call : call + ";");
	}

	private void emitIf(DslIfStmt ifStmt) {
		List<DslIfStmt.Branch> branches = ifStmt.branches();
		DslIfStmt.Branch first = branches.get(0);
		out.open("if (" + condition(first.condition()) + ")");
		emitScoped(first.body());

		for (DslIfStmt.Branch branch : branches.subList(1, branches.size())) {
			out.reopen("else if (" + condition(branch.condition()) + ")");
			emitScoped(branch.body());
		}
		if (!ifStmt.elseBody().isEmpty()) {
			out.reopen("else");
			emitScoped(ifStmt.elseBody());
		}
		out.close();
	}

	private String condition(DslExpr expr) {
		DslExpr unwrapped = expr;
		while (unwrapped instanceof DslGroupExpr group) {
			unwrapped = group.inner();
		}
		return expressions.translate(unwrapped);
	}
}
