package ftcdsl.transform;

import java.util.Map;
import java.util.Set;

/**
 * Constant lookup tables from surface-syntax tokens to FTC Java text.
 *
 * All maps are unmodifiable and safe to share between concurrent transpilations.
 */
public final class MappingTables {
	public static final String INITIALIZER_ROUTINE = "init_hardware";
	public static final String ENTRY_ROUTINE = "run";
	public static final String LOOP_ROUTINE = "loop";

	public static final Map<String, String> MOTOR_DIRECTIONS = Map.of(
			"forward", "DcMotor.Direction.FORWARD",
			"reverse", "DcMotor.Direction.REVERSE");

	public static final Map<String, String> RUN_MODES = Map.of(
			"run_using_encoder", "DcMotor.RunMode.RUN_USING_ENCODER",
			"run_without_encoder", "DcMotor.RunMode.RUN_WITHOUT_ENCODER",
			"run_to_position", "DcMotor.RunMode.RUN_TO_POSITION",
			"stop_and_reset_encoder", "DcMotor.RunMode.STOP_AND_RESET_ENCODER");

	public static final Map<String, String> GAMEPAD_FIELDS = Map.ofEntries(
			Map.entry("left_stick_x", "left_stick_x"),
			Map.entry("left_stick_y", "left_stick_y"),
			Map.entry("right_stick_x", "right_stick_x"),
			Map.entry("right_stick_y", "right_stick_y"),
			Map.entry("a_button", "a"),
			Map.entry("b_button", "b"),
			Map.entry("x_button", "x"),
			Map.entry("y_button", "y"),
			Map.entry("dpad_up", "dpad_up"),
			Map.entry("dpad_down", "dpad_down"),
			Map.entry("dpad_left", "dpad_left"),
			Map.entry("dpad_right", "dpad_right"),
			Map.entry("left_bumper", "left_bumper"),
			Map.entry("right_bumper", "right_bumper"),
			Map.entry("left_trigger", "left_trigger"),
			Map.entry("right_trigger", "right_trigger"));

	public static final Set<String> GAMEPADS = Set.of("gamepad1", "gamepad2");

	/**
	 * Surface operator to Java operator. Operators missing here render as {@code ?}.
	 */
	public static final Map<String, String> BINARY_OPERATORS = Map.ofEntries(
			Map.entry("+", "+"),
			Map.entry("-", "-"),
			Map.entry("*", "*"),
			Map.entry("/", "/"),
			Map.entry("%", "%"),
			Map.entry("<", "<"),
			Map.entry(">", ">"),
			Map.entry("<=", "<="),
			Map.entry(">=", ">="),
			Map.entry("==", "=="),
			Map.entry("!=", "!="),
			Map.entry("and", "&&"),
			Map.entry("or", "||"));

	public static final String UNMAPPED_OPERATOR = "?";

	/**
	 * Methods callable on any receiver expression, e.g. {@code self.arm.set_power(x)}.
	 */
	public static final Map<String, CallTemplate> RECEIVER_METHODS = Map.of(
			"set_power", new CallTemplate("setPower", ArgumentStyle.PASS_THROUGH, 1),
			"set_position", new CallTemplate("setPosition", ArgumentStyle.PASS_THROUGH, 1),
			"get_distance", new CallTemplate("getDistance", ArgumentStyle.DISTANCE_UNIT, 0),
			"is_pressed", new CallTemplate("isPressed", ArgumentStyle.PASS_THROUGH, 0),
			"get_current_position", new CallTemplate("getCurrentPosition", ArgumentStyle.PASS_THROUGH, 0),
			"set_target_position", new CallTemplate("setTargetPosition", ArgumentStyle.PASS_THROUGH, 1),
			"set_mode", new CallTemplate("setMode", ArgumentStyle.RUN_MODE, 1));

	/**
	 * Free functions of the surface syntax that map onto LinearOpMode members.
	 */
	public static final Map<String, CallTemplate> INTRINSICS = Map.of(
			"telemetry_add", new CallTemplate("telemetry.addData", ArgumentStyle.PASS_THROUGH, 2),
			"telemetry_update", new CallTemplate("telemetry.update", ArgumentStyle.PASS_THROUGH, 0),
			"sleep", new CallTemplate("sleep", ArgumentStyle.PASS_THROUGH, 1),
			"opmode_is_active", new CallTemplate("opModeIsActive", ArgumentStyle.PASS_THROUGH, 0));

	/**
	 * Routines whose Java name differs from the surface name.
	 *
	 * Notes:
	 * - {@code loop} cannot keep its name: {@code LinearOpMode.loop()} is {@code public final}.
	 */
	public static final Map<String, String> ROUTINE_NAMES = Map.of(
			INITIALIZER_ROUTINE, "initHardware",
			ENTRY_ROUTINE, "runOpMode",
			LOOP_ROUTINE, "loopBody");

	public static final String DISTANCE_UNIT = "DistanceUnit.CM";

	private MappingTables() {
		// constants only
	}

	public static String routineName(String surfaceName) {
		return ROUTINE_NAMES.getOrDefault(surfaceName, surfaceName);
	}

	public enum ArgumentStyle {
		/** Arguments are translated and passed unchanged. */
		PASS_THROUGH,
		/** No source arguments; the target call takes a fixed distance unit. */
		DISTANCE_UNIT,
		/** A single string argument remapped through {@link #RUN_MODES}. */
		RUN_MODE
	}

	public record CallTemplate(String target, ArgumentStyle style, int arity) {
	}
}
