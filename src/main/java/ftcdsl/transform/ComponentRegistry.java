package ftcdsl.transform;

import ftcdsl.ast.dsl.DslAssignStmt;
import ftcdsl.ast.dsl.DslAttributeExpr;
import ftcdsl.ast.dsl.DslCallExpr;
import ftcdsl.ast.dsl.DslExpr;
import ftcdsl.ast.dsl.DslFunctionDecl;
import ftcdsl.ast.dsl.DslNameExpr;
import ftcdsl.ast.dsl.DslStmt;
import ftcdsl.ast.dsl.DslStringExpr;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the hardware declared by a unit's initializer routine.
 *
 * Built once before emission and replayed twice: for the field declarations and for the
 * initialization statements that replace each scanned declaration.
 */
@Slf4j
public final class ComponentRegistry {
	public static final ComponentRegistry EMPTY = new ComponentRegistry(List.of(), Map.of());

	private final List<HardwareComponent> components;
	private final Map<DslAssignStmt, HardwareComponent> byStatement;

	private ComponentRegistry(List<HardwareComponent> components, Map<DslAssignStmt, HardwareComponent> byStatement) {
		this.components = components;
		this.byStatement = byStatement;
	}

	/**
	 * Scans the direct statements of {@code initializer}; nested blocks are not visited.
	 *
	 * A name declared twice keeps its first position and its last declaration.
	 */
	public static ComponentRegistry scan(DslFunctionDecl initializer) {
		Map<String, HardwareComponent> byName = new LinkedHashMap<>();
		Map<DslAssignStmt, HardwareComponent> byStatement = new IdentityHashMap<>();

		for (DslStmt stmt : initializer.body()) {
			if (!(stmt instanceof DslAssignStmt assign)) {
				continue;
			}
			Optional<HardwareComponent> found = describe(assign, initializer.receiver());
			if (found.isEmpty()) {
				continue;
			}

			HardwareComponent component = found.get();
			HardwareComponent previous = byName.put(component.declaredName(), component);
			if (previous != null) {
				log.warn("hardware '{}' declared again as {} (was {}), keeping the last declaration",
						component.declaredName(), component.kind(), previous.kind());
			} else {
				log.debug("found hardware '{}' of kind {} mapped to '{}'",
						component.declaredName(), component.kind(), component.configName());
			}
			byStatement.put(assign, component);
		}

		return new ComponentRegistry(List.copyOf(byName.values()), Collections.unmodifiableMap(byStatement));
	}

	/**
	 * Reads {@code receiver.name = kind("config", "direction")} as a hardware declaration.
	 */
	public static Optional<HardwareComponent> describe(DslAssignStmt assign, String receiver) {
		if (!(assign.target() instanceof DslAttributeExpr target) || !target.isRootedAt(receiver)) {
			return Optional.empty();
		}
		if (!(assign.value() instanceof DslCallExpr call) || !(call.callee() instanceof DslNameExpr callee)) {
			return Optional.empty();
		}

		String name = target.attribute();
		return HardwareKind.forConstructor(callee.name())
				.map(kind -> new HardwareComponent(
						name,
						kind,
						stringArgument(call.args(), 0).orElse(name),
						stringArgument(call.args(), 1).orElse(null)));
	}

	static Optional<String> stringArgument(List<DslExpr> args, int index) {
		if (args.size() > index && args.get(index) instanceof DslStringExpr literal) {
			return Optional.of(literal.value());
		}
		return Optional.empty();
	}

	public List<HardwareComponent> components() {
		return components;
	}

	public boolean isEmpty() {
		return components.isEmpty();
	}

	/**
	 * The record produced for {@code stmt} during the scan, if it was a scanned declaration.
	 */
	public Optional<HardwareComponent> componentFor(DslAssignStmt stmt) {
		return Optional.ofNullable(byStatement.get(stmt));
	}
}
