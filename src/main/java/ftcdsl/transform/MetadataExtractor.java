package ftcdsl.transform;

import ftcdsl.ast.dsl.DslClassDecl;
import ftcdsl.ast.dsl.DslDecorator;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Reads OpMode metadata from the class-level decorators of a unit.
 */
@Slf4j
public final class MetadataExtractor {
	static final String DISABLED_DECORATOR = "disabled";

	public UnitMetadata extract(DslClassDecl unit) {
		OpModeKind kind = OpModeKind.NONE;
		String displayName = unit.name();
		String groupName = UnitMetadata.DEFAULT_GROUP;
		boolean disabled = false;

		for (DslDecorator decorator : unit.decorators()) {
			if (decorator.name().equals(DISABLED_DECORATOR)) {
				disabled = true;
				continue;
			}

			Optional<OpModeKind> matched = OpModeKind.forDecorator(decorator.name());
			if (matched.isEmpty()) {
				log.debug("ignoring decorator @{} on {}", decorator.name(), unit.name());
				continue;
			}
			if (kind != OpModeKind.NONE) {
				log.warn("{} has more than one OpMode decorator, @{} replaces {}",
						unit.name(), decorator.name(), kind.annotation());
			}

			kind = matched.get();
			displayName = ComponentRegistry.stringArgument(decorator.args(), 0).orElse(unit.name());
			groupName = ComponentRegistry.stringArgument(decorator.args(), 1).orElse(UnitMetadata.DEFAULT_GROUP);
		}

		return new UnitMetadata(displayName, groupName, kind, disabled);
	}
}
