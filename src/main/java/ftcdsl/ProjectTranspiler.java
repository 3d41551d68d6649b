package ftcdsl;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transpiles a tree of robot scripts to a parallel tree of .java files.
 *
 * Important: this does NOT merge units; each input file produces one output file.
 */
@Slf4j
public final class ProjectTranspiler {
	public static final String SOURCE_EXTENSION = ".py";
	public static final String TARGET_EXTENSION = ".java";

	private final Transpiler transpiler = new Transpiler();

	/**
	 * @return the files written, in walk order
	 */
	public List<Path> transpileTree(Path sourceRoot, Path outRoot) throws IOException {
		try (Stream<Path> paths = Files.walk(sourceRoot)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
					.sorted()
					.map(p -> {
						try {
							return transpileOne(sourceRoot, outRoot, p);
						} catch (IOException e) {
							throw new UncheckedIOException(e);
						}
					})
					.collect(Collectors.toList());
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}
	}

	/**
	 * Transpiles a single file to {@code outFile}, creating parent directories as needed.
	 */
	public void transpileFile(Path sourceFile, Path outFile) throws IOException {
		Path parent = outFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		String source = Files.readString(sourceFile);
		Files.writeString(outFile, transpiler.transpile(source));
		log.debug("wrote {} from {}", outFile, sourceFile);
	}

	private Path transpileOne(Path sourceRoot, Path outRoot, Path sourceFile) throws IOException {
		Path rel = sourceRoot.relativize(sourceFile);
		String fileName = rel.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length());
		Path outRel = rel.getParent() == null
				? Path.of(base + TARGET_EXTENSION)
				: rel.getParent().resolve(base + TARGET_EXTENSION);
		Path outFile = outRoot.resolve(outRel);

		transpileFile(sourceFile, outFile);
		return outFile;
	}
}
