package ftcdsl.transform;

import java.util.Arrays;
import java.util.Optional;

/**
 * Device categories recognized as hardware constructors in the initializer routine.
 */
public enum HardwareKind {
	MOTOR("motor", "DcMotor"),
	SERVO("servo", "Servo"),
	COLOR_SENSOR("color_sensor", "ColorSensor"),
	DISTANCE_SENSOR("distance_sensor", "DistanceSensor"),
	GYRO("gyro", "GyroSensor"),
	TOUCH_SENSOR("touch_sensor", "TouchSensor"),
	LIGHT_SENSOR("light_sensor", "LightSensor"),
	IMU("imu", "IMU");

	private final String constructorName;
	private final String targetType;

	HardwareKind(String constructorName, String targetType) {
		this.constructorName = constructorName;
		this.targetType = targetType;
	}

	public String constructorName() {
		return constructorName;
	}

	public String targetType() {
		return targetType;
	}

	public static Optional<HardwareKind> forConstructor(String name) {
		return Arrays.stream(values())
				.filter(k -> k.constructorName.equals(name))
				.findFirst();
	}
}
