package ftcdsl.transform;

import java.util.Optional;

/**
 * One hardware declaration discovered in the initializer routine.
 *
 * {@code directionToken} is the raw second constructor argument, or null when absent.
 */
public record HardwareComponent(String declaredName, HardwareKind kind, String configName, String directionToken) {

	public String targetType() {
		return kind.targetType();
	}

	/**
	 * The target direction constant, empty when no token was given or the token is not recognized.
	 */
	public Optional<String> direction() {
		return Optional.ofNullable(directionToken).map(MappingTables.MOTOR_DIRECTIONS::get);
	}

	public boolean hasDirection() {
		return directionToken != null;
	}
}
