package ftcdsl.print;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The import lines heading every generated OpMode. The block is the same for every unit, whatever
 * hardware it uses.
 */
public final class ImportBlock {
	public static final List<String> IMPORTS = Stream.of(
			"com.qualcomm.robotcore.eventloop.opmode.Autonomous",
			"com.qualcomm.robotcore.eventloop.opmode.Disabled",
			"com.qualcomm.robotcore.eventloop.opmode.LinearOpMode",
			"com.qualcomm.robotcore.eventloop.opmode.TeleOp",
			"com.qualcomm.robotcore.hardware.ColorSensor",
			"com.qualcomm.robotcore.hardware.DcMotor",
			"com.qualcomm.robotcore.hardware.DistanceSensor",
			"com.qualcomm.robotcore.hardware.GyroSensor",
			"com.qualcomm.robotcore.hardware.IMU",
			"com.qualcomm.robotcore.hardware.LightSensor",
			"com.qualcomm.robotcore.hardware.Servo",
			"com.qualcomm.robotcore.hardware.TouchSensor",
			"org.firstinspires.ftc.robotcore.external.navigation.AngleUnit",
			"org.firstinspires.ftc.robotcore.external.navigation.DistanceUnit")
			.sorted()
			.collect(Collectors.toUnmodifiableList());

	private ImportBlock() {
	}

	public static String render() {
		return IMPORTS.stream()
				.map(name -> "import " + name + ";")
				.collect(Collectors.joining("\n")) + "\n";
	}
}
