package ftcdsl.parse.dsl;

import ftcdsl.ast.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the indentation-based robot script syntax.
 *
 * Notes:
 * - Emits NEWLINE at the end of every logical line and INDENT/DEDENT when the
 * leading whitespace of a line changes. Tabs advance to the next multiple of 8.
 * - Blank and comment-only lines produce no tokens.
 * - Newlines inside (), [] and {} are ignored, as is a backslash-newline pair.
 * - Does NOT support string prefixes (f"", r"", b"").
 */
public final class DslLexer {
	private static final Set<String> THREE_CHAR_SYMBOLS = Set.of("**=", "//=");
	private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
			"**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "->");
	private static final String SINGLE_CHAR_SYMBOLS = "+-*/%<>=()[]{},:.@;~&|^!";

	private String input;
	private List<DslToken> tokens;
	private Deque<Integer> indents;
	private int pos;
	private int line;
	private int bracketDepth;

	public List<DslToken> lex(String source) {
		input = source;
		tokens = new ArrayList<>();
		indents = new ArrayDeque<>();
		indents.push(0);
		pos = 0;
		line = 1;
		bracketDepth = 0;

		boolean atLineStart = true;
		while (pos < input.length()) {
			if (atLineStart && bracketDepth == 0) {
				atLineStart = !readIndentation();
				continue;
			}

			char c = input.charAt(pos);

			if (c == ' ' || c == '\t' || c == '\f') {
				pos++;
				continue;
			}

			if (c == '#') {
				skipComment();
				continue;
			}

			if (c == '\\' && isNewlineAt(pos + 1)) {
				pos++;
				consumeNewline();
				continue;
			}

			if (isNewlineAt(pos)) {
				int start = pos;
				consumeNewline();
				if (bracketDepth == 0) {
					tokens.add(new DslToken(DslTokenType.NEWLINE, "", new SourceSpan(line - 1, start, pos)));
					atLineStart = true;
				}
				continue;
			}

			if (c == '"' || c == '\'') {
				readString(c);
				continue;
			}

			if (Character.isLetter(c) || c == '_') {
				readName();
				continue;
			}

			if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
				readNumber();
				continue;
			}

			readSymbol(c);
		}

		if (bracketDepth > 0) {
			throw new DslSyntaxException("unexpected end of input inside brackets", here(pos));
		}
		if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != DslTokenType.NEWLINE) {
			tokens.add(new DslToken(DslTokenType.NEWLINE, "", here(pos)));
		}
		while (indents.peek() > 0) {
			indents.pop();
			tokens.add(new DslToken(DslTokenType.DEDENT, "", here(pos)));
		}
		tokens.add(new DslToken(DslTokenType.EOF, "", here(pos)));
		return tokens;
	}

	/**
	 * Measures the indentation of the line starting at {@code pos}. Returns false when the line is
	 * blank or holds only a comment, in which case the whole line has been consumed.
	 */
	private boolean readIndentation() {
		int width = 0;
		int i = pos;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == ' ' || c == '\f') {
				width++;
			} else if (c == '\t') {
				width += 8 - (width % 8);
			} else {
				break;
			}
			i++;
		}
		pos = i;

		if (pos >= input.length()) {
			return false;
		}
		if (input.charAt(pos) == '#') {
			skipComment();
		}
		if (pos >= input.length()) {
			return false;
		}
		if (isNewlineAt(pos)) {
			consumeNewline();
			return false;
		}

		if (width > indents.peek()) {
			indents.push(width);
			tokens.add(new DslToken(DslTokenType.INDENT, "", here(pos)));
			return true;
		}
		while (width < indents.peek()) {
			indents.pop();
			tokens.add(new DslToken(DslTokenType.DEDENT, "", here(pos)));
		}
		if (width != indents.peek()) {
			throw new DslSyntaxException("unindent does not match any outer indentation level", here(pos));
		}
		return true;
	}

	private void skipComment() {
		while (pos < input.length() && !isNewlineAt(pos)) {
			pos++;
		}
	}

	private boolean isNewlineAt(int i) {
		return i < input.length() && (input.charAt(i) == '\n' || input.charAt(i) == '\r');
	}

	private void consumeNewline() {
		if (input.charAt(pos) == '\r' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
			pos++;
		}
		pos++;
		line++;
	}

	private void readString(char quote) {
		int start = pos;
		int startLine = line;
		boolean triple = input.startsWith(String.valueOf(quote).repeat(3), pos);
		pos += triple ? 3 : 1;

		StringBuilder value = new StringBuilder();
		while (true) {
			if (pos >= input.length()) {
				throw new DslSyntaxException("unterminated string literal", new SourceSpan(startLine, start, pos));
			}
			char c = input.charAt(pos);
			if (c == quote && (!triple || input.startsWith(String.valueOf(quote).repeat(3), pos))) {
				pos += triple ? 3 : 1;
				break;
			}
			if (c == '\\' && pos + 1 < input.length()) {
				pos = readEscape(value);
				continue;
			}
			if (isNewlineAt(pos)) {
				if (!triple) {
					throw new DslSyntaxException("unterminated string literal", new SourceSpan(startLine, start, pos));
				}
				value.append('\n');
				consumeNewline();
				continue;
			}
			value.append(c);
			pos++;
		}

		tokens.add(new DslToken(DslTokenType.STRING, value.toString(), new SourceSpan(startLine, start, pos)));
	}

	private int readEscape(StringBuilder value) {
		char n = input.charAt(pos + 1);
		switch (n) {
			case 'n' -> value.append('\n');
			case 't' -> value.append('\t');
			case 'r' -> value.append('\r');
			case '0' -> value.append('\0');
			case '\\', '\'', '"' -> value.append(n);
			case '\n', '\r' -> {
				// escaped newline continues the literal
				pos++;
				consumeNewline();
				return pos;
			}
			default -> value.append('\\').append(n);
		}
		return pos + 2;
	}

	private void readName() {
		int start = pos;
		pos++;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isLetterOrDigit(c) || c == '_') {
				pos++;
			} else {
				break;
			}
		}
		tokens.add(new DslToken(DslTokenType.NAME, input.substring(start, pos), here(start)));
	}

	private void readNumber() {
		int start = pos;
		consumeDigits();
		if (pos < input.length() && input.charAt(pos) == '.') {
			pos++;
			consumeDigits();
		}
		if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
			int mark = pos;
			pos++;
			if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
				pos++;
			}
			if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
				consumeDigits();
			} else {
				pos = mark;
			}
		}
		if (pos < input.length() && (Character.isLetter(input.charAt(pos)) || input.charAt(pos) == '_')) {
			throw new DslSyntaxException("invalid numeric literal", here(start));
		}
		String text = input.substring(start, pos).replace("_", "");
		tokens.add(new DslToken(DslTokenType.NUMBER, text, new SourceSpan(line, start, pos)));
	}

	private void consumeDigits() {
		while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
			pos++;
		}
	}

	private void readSymbol(char c) {
		int start = pos;
		String three = input.length() >= pos + 3 ? input.substring(pos, pos + 3) : "";
		String two = input.length() >= pos + 2 ? input.substring(pos, pos + 2) : "";
		String symbol;
		if (THREE_CHAR_SYMBOLS.contains(three)) {
			symbol = three;
		} else if (TWO_CHAR_SYMBOLS.contains(two)) {
			symbol = two;
		} else if (SINGLE_CHAR_SYMBOLS.indexOf(c) >= 0) {
			symbol = String.valueOf(c);
		} else {
			throw new DslSyntaxException("unexpected character '" + c + "'", here(start));
		}
		pos += symbol.length();

		if (symbol.equals("(") || symbol.equals("[") || symbol.equals("{")) {
			bracketDepth++;
		} else if (symbol.equals(")") || symbol.equals("]") || symbol.equals("}")) {
			if (bracketDepth == 0) {
				throw new DslSyntaxException("unmatched '" + symbol + "'", here(start));
			}
			bracketDepth--;
		}
		tokens.add(new DslToken(DslTokenType.SYMBOL, symbol, new SourceSpan(line, start, pos)));
	}

	private SourceSpan here(int start) {
		return new SourceSpan(line, start, pos);
	}
}
