package ftcdsl;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: {@code Main <input> <output>}.
 *
 * A file input is transpiled to the output file. A directory input is transpiled file by file into
 * the output directory.
 */
@Slf4j
public final class Main {
	static final int EXIT_OK = 0;
	static final int EXIT_IO_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		System.exit(run(args));
	}

	static int run(String[] args) {
		if (args.length != 2) {
			System.err.println("usage: ftcdsl.Main <input.py|input-dir> <output.java|output-dir>");
			return EXIT_USAGE;
		}
		Path input = Path.of(args[0]);
		Path output = Path.of(args[1]);
		if (!Files.exists(input)) {
			log.error("input does not exist: {}", input);
			return EXIT_USAGE;
		}

		ProjectTranspiler transpiler = new ProjectTranspiler();
		try {
			if (Files.isDirectory(input)) {
				List<Path> written = transpiler.transpileTree(input, output);
				log.info("transpiled {} file(s) from {} into {}", written.size(), input, output);
			} else {
				transpiler.transpileFile(input, output);
				log.info("transpiled {} to {}", input, output);
			}
			return EXIT_OK;
		} catch (IOException e) {
			log.error("failed to transpile {}", input, e);
			return EXIT_IO_FAILURE;
		}
	}
}
