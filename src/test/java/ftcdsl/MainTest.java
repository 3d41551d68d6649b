package ftcdsl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	@Test
	void transpilesSingleFile(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("Bot.py");
		Files.writeString(input, "class Bot:\n    def run(self):\n        sleep(5)\n");
		Path output = dir.resolve("Bot.java");

		int exit = Main.run(new String[] {input.toString(), output.toString()});

		assertEquals(Main.EXIT_OK, exit);
		assertTrue(Files.readString(output).contains("        sleep(5);\n"));
	}

	@Test
	void transpilesDirectory(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("src");
		Files.createDirectories(input);
		Files.writeString(input.resolve("Bot.py"), "class Bot:\n    pass\n");
		Path output = dir.resolve("out");

		int exit = Main.run(new String[] {input.toString(), output.toString()});

		assertEquals(Main.EXIT_OK, exit);
		assertTrue(Files.exists(output.resolve("Bot.java")));
	}

	@Test
	void syntaxErrorsAreNotExitFailures(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("Bad.py");
		Files.writeString(input, "class Bad(\n");
		Path output = dir.resolve("Bad.java");

		assertEquals(Main.EXIT_OK, Main.run(new String[] {input.toString(), output.toString()}));
		assertTrue(Files.readString(output).startsWith(Transpiler.ERROR_PREFIX));
	}

	@Test
	void rejectsBadUsage(@TempDir Path dir) {
		assertEquals(Main.EXIT_USAGE, Main.run(new String[] {}));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"only-one"}));
		assertEquals(Main.EXIT_USAGE,
				Main.run(new String[] {dir.resolve("nope.py").toString(), dir.resolve("out.java").toString()}));
	}

	@Test
	void reportsUnwritableOutput(@TempDir Path dir) throws Exception {
		Path input = dir.resolve("Bot.py");
		Files.writeString(input, "class Bot:\n    pass\n");
		// a regular file where the output directory should be
		Path blocker = dir.resolve("blocker");
		Files.writeString(blocker, "");

		int exit = Main.run(new String[] {input.toString(), blocker.resolve("Bot.java").toString()});

		assertEquals(Main.EXIT_IO_FAILURE, exit);
	}
}
