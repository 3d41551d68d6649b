package ftcdsl;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExamplesTest {
	private static final Path EXAMPLES = Path.of("src", "test", "resources", "examples");

	@Test
	void basicTeleopTranspiles() throws Exception {
		String java = new Transpiler().transpile(Files.readString(EXAMPLES.resolve("basic_teleop.py")));

		assertContains(java, "@TeleOp(name=\"Basic Drive\", group=\"Linear OpMode\")");
		assertContains(java, "public class BasicDriveRobot extends LinearOpMode");

		assertContains(java, "private DcMotor left_drive = null;");
		assertContains(java, "private DcMotor right_drive = null;");
		assertContains(java, "private DcMotor arm_motor = null;");
		assertContains(java, "private Servo claw_servo = null;");
		assertContains(java, "private DistanceSensor distance_sensor = null;");
		assertContains(java, "private ColorSensor color_sensor = null;");

		assertContains(java, "left_drive = hardwareMap.get(DcMotor.class, \"left_drive\");");
		assertContains(java, "left_drive.setDirection(DcMotor.Direction.FORWARD);");
		assertContains(java, "right_drive.setDirection(DcMotor.Direction.REVERSE);");
		assertContains(java, "distance_sensor = hardwareMap.get(DistanceSensor.class, \"distance\");");
		assertContains(java, "left_drive.setMode(DcMotor.RunMode.RUN_USING_ENCODER);");

		assertContains(java, "double drive = -gamepad1.left_stick_y;");
		assertContains(java, "double turn = gamepad1.right_stick_x;");
		assertContains(java, "left_drive.setPower(left_power);");
		assertContains(java, "right_drive.setPower(right_power);");

		assertContains(java, "if (gamepad1.a) {");
		assertContains(java, "claw_servo.setPosition(0.0);");
		assertContains(java, "} else if (gamepad1.b) {");
		assertContains(java, "claw_servo.setPosition(1.0);");

		assertContains(java, "double distance = distance_sensor.getDistance(DistanceUnit.CM);");
		assertContains(java, "telemetry.addData(\"Drive Power\", drive);");
		assertContains(java, "telemetry.addData(\"Distance (cm)\", distance);");
		assertContains(java, "if (distance < 10) {");
		assertContains(java, "telemetry.addData(\"Status\", \"OBSTACLE DETECTED!\");");

		assertContains(java, "waitForStart();\n\n        loopBody();\n");
		assertContains(java, "            telemetry.update();\n        }\n    }\n");
		assertEquals(-1, java.indexOf("/* UNKNOWN"), java);
	}

	@Test
	void programOutsideTheSubsetFallsBackWithItsSource() throws Exception {
		String source = Files.readString(EXAMPLES.resolve("red_autonomous.py"));

		String java = new Transpiler().transpile(source);

		assertTrue(java.startsWith(Transpiler.ERROR_PREFIX), java);
		assertContains(java, "'for' statements are not supported");
		assertContains(java, source);
	}

	private static void assertContains(String haystack, String needle) {
		assertTrue(haystack.contains(needle), () -> "missing: " + needle + "\n" + haystack);
	}
}
