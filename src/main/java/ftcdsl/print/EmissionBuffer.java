package ftcdsl.print;

import java.util.ArrayList;
import java.util.List;

/**
 * Output lines plus the current indentation depth. Blocks opened with {@link #open} must be closed
 * before {@link #finish}.
 */
public final class EmissionBuffer {
	private static final String INDENT = "    ";

	private final List<String> lines = new ArrayList<>();
	private int depth;

	public void line(String text) {
		lines.add(INDENT.repeat(depth) + text);
	}

	public void blank() {
		lines.add("");
	}

	/**
	 * Writes the header with an opening brace and indents what follows.
	 */
	public void open(String header) {
		line(header + " {");
		depth++;
	}

	/**
	 * Closes the current block and opens a continuation on the same line, as in "} else {".
	 */
	public void reopen(String header) {
		requireOpenBlock();
		depth--;
		line("} " + header + " {");
		depth++;
	}

	public void close() {
		requireOpenBlock();
		depth--;
		line("}");
	}

	public int depth() {
		return depth;
	}

	public String finish() {
		if (depth != 0) {
			throw new IllegalStateException("unbalanced output: " + depth + " block(s) still open");
		}
		return String.join("\n", lines) + "\n";
	}

	private void requireOpenBlock() {
		if (depth == 0) {
			throw new IllegalStateException("no open block to close");
		}
	}
}
