package ftcdsl;

import ftcdsl.ast.dsl.DslClassDecl;
import ftcdsl.parse.dsl.DslParser;
import ftcdsl.print.ImportBlock;
import ftcdsl.transform.ComponentRegistry;
import ftcdsl.transform.MappingTables;
import ftcdsl.transform.MetadataExtractor;
import ftcdsl.transform.StatementEmitter;
import ftcdsl.transform.UnitMetadata;
import lombok.extern.slf4j.Slf4j;

/**
 * Public entrypoint for robot script -> FTC Java transpilation.
 *
 * Never throws. Input the front end rejects, or anything that breaks during emission, yields a
 * comment block carrying the error message and the original source so nothing is silently lost.
 */
@Slf4j
public final class Transpiler {
	public static final String ERROR_PREFIX = "// Transpilation error: ";

	public String transpile(String source) {
		if (source == null) {
			return fallback("no source text given", "");
		}
		try {
			DslClassDecl unit = new DslParser().parse(source).unit();
			UnitMetadata metadata = new MetadataExtractor().extract(unit);
			ComponentRegistry registry = unit.function(MappingTables.INITIALIZER_ROUTINE)
					.map(ComponentRegistry::scan)
					.orElse(ComponentRegistry.EMPTY);
			String body = new StatementEmitter(metadata, registry).emit(unit);
			return ImportBlock.render() + "\n" + body;
		} catch (RuntimeException ex) {
			log.warn("falling back to commented source: {}", ex.getMessage());
			log.debug("transpilation failure", ex);
			return fallback(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), source);
		}
	}

	private static String fallback(String message, String source) {
		return ERROR_PREFIX + message + "\n"
				+ "// Original source:\n"
				+ "/*\n"
				+ source.replace("*/", "*\\/") + "\n"
				+ "*/\n";
	}
}
