package ftcdsl.transform;

import ftcdsl.ast.dsl.DslAssignStmt;
import ftcdsl.ast.dsl.DslFunctionDecl;
import ftcdsl.parse.dsl.DslParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ComponentRegistryTest {
	@Test
	void findsHardwareInLexicalOrder() {
		DslFunctionDecl init = initializer(
				"self.left = motor(\"left_drive\", \"forward\")",
				"self.claw = servo(\"claw_servo\")",
				"self.arm.set_mode(\"run_using_encoder\")",
				"self.eyes = distance_sensor(\"distance\")",
				"self.heading = imu(\"imu\")");

		ComponentRegistry registry = ComponentRegistry.scan(init);

		assertEquals(List.of("left", "claw", "eyes", "heading"), names(registry));
		HardwareComponent left = registry.components().get(0);
		assertEquals(HardwareKind.MOTOR, left.kind());
		assertEquals("DcMotor", left.targetType());
		assertEquals("left_drive", left.configName());
		assertEquals(Optional.of("DcMotor.Direction.FORWARD"), left.direction());
		assertFalse(registry.components().get(1).hasDirection());
		assertEquals("IMU", registry.components().get(3).targetType());
	}

	@Test
	void defaultsConfigNameToAttributeName() {
		ComponentRegistry registry = ComponentRegistry.scan(initializer(
				"self.arm = motor()",
				"self.lift = motor(config_name)"));

		assertEquals("arm", registry.components().get(0).configName());
		assertEquals("lift", registry.components().get(1).configName());
		assertNull(registry.components().get(0).directionToken());
	}

	@Test
	void keepsUnrecognizedDirectionTokenWithoutConstant() {
		HardwareComponent motor = ComponentRegistry.scan(initializer("self.m = motor('m', 'sideways')"))
				.components().get(0);

		assertTrue(motor.hasDirection());
		assertEquals(Optional.empty(), motor.direction());
	}

	@Test
	void ignoresEverythingButReceiverHardwareAssignments() {
		ComponentRegistry registry = ComponentRegistry.scan(initializer(
				"speed = motor('x')",
				"self.power = 0.5",
				"self.thing = webcam('Webcam 1')",
				"other.m = motor('m')",
				"if True:\n            self.hidden = servo('hidden')"));

		assertTrue(registry.isEmpty());
	}

	@Test
	void redeclarationKeepsFirstPositionAndLastKind() {
		DslFunctionDecl init = initializer(
				"self.x = motor(\"first\")",
				"self.y = servo(\"y\")",
				"self.x = servo(\"second\")");

		ComponentRegistry registry = ComponentRegistry.scan(init);

		assertEquals(List.of("x", "y"), names(registry));
		HardwareComponent x = registry.components().get(0);
		assertEquals(HardwareKind.SERVO, x.kind());
		assertEquals("second", x.configName());

		// each declaring statement still maps to the record it produced
		HardwareComponent fromFirst = registry.componentFor((DslAssignStmt) init.body().get(0)).orElseThrow();
		assertEquals(HardwareKind.MOTOR, fromFirst.kind());
		HardwareComponent fromLast = registry.componentFor((DslAssignStmt) init.body().get(2)).orElseThrow();
		assertEquals(HardwareKind.SERVO, fromLast.kind());
	}

	@Test
	void describesAssignmentsOutsideTheInitializer() {
		DslAssignStmt assign = (DslAssignStmt) initializer("bot.sensor = touch_sensor('touch')").body().get(0);

		assertEquals(Optional.empty(), ComponentRegistry.describe(assign, "self"));
		HardwareComponent sensor = ComponentRegistry.describe(assign, "bot").orElseThrow();
		assertEquals(HardwareKind.TOUCH_SENSOR, sensor.kind());
		assertEquals("touch", sensor.configName());
		assertEquals(Optional.empty(), ComponentRegistry.EMPTY.componentFor(assign));
	}

	@Test
	void knowsEveryHardwareConstructor() {
		for (HardwareKind kind : HardwareKind.values()) {
			assertEquals(Optional.of(kind), HardwareKind.forConstructor(kind.constructorName()));
		}
		assertEquals(Optional.empty(), HardwareKind.forConstructor("webcam"));
	}

	private static DslFunctionDecl initializer(String... statements) {
		String body = "        " + String.join("\n        ", statements);
		String input = "class A:\n    def init_hardware(self):\n" + body + "\n";
		return new DslParser().parse(input).unit().functions().get(0);
	}

	private static List<String> names(ComponentRegistry registry) {
		return registry.components().stream()
				.map(HardwareComponent::declaredName)
				.collect(Collectors.toList());
	}
}
