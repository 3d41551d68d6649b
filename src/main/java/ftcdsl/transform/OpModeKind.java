package ftcdsl.transform;

import java.util.Optional;

public enum OpModeKind {
	TELEOP("teleop", "TeleOp"),
	AUTONOMOUS("autonomous", "Autonomous"),
	NONE(null, null);

	private final String decoratorName;
	private final String annotation;

	OpModeKind(String decoratorName, String annotation) {
		this.decoratorName = decoratorName;
		this.annotation = annotation;
	}

	public String annotation() {
		return annotation;
	}

	public static Optional<OpModeKind> forDecorator(String name) {
		for (OpModeKind kind : values()) {
			if (kind.decoratorName != null && kind.decoratorName.equals(name)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
