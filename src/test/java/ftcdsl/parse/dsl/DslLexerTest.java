package ftcdsl.parse.dsl;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DslLexerTest {
	@Test
	void emitsIndentAndDedentAroundBlocks() {
		var tokens = new DslLexer().lex("class A:\n    pass\n");

		assertEquals(
				"NAME NAME SYMBOL NEWLINE INDENT NAME NEWLINE DEDENT EOF",
				types(tokens));
	}

	@Test
	void closesOpenBlocksAtEndOfInputWithoutTrailingNewline() {
		var tokens = new DslLexer().lex("class A:\n    def run(self):\n        pass");

		List<DslTokenType> tail = tokens.subList(tokens.size() - 4, tokens.size()).stream()
				.map(DslToken::type)
				.collect(Collectors.toList());
		assertEquals(List.of(DslTokenType.NEWLINE, DslTokenType.DEDENT, DslTokenType.DEDENT, DslTokenType.EOF), tail);
	}

	@Test
	void ignoresCommentsAndBlankLines() {
		var tokens = new DslLexer().lex("# heading\n\n   \nx = 1  # trailing\n");

		assertEquals("x|=|1", lexemes(tokens));
		assertEquals("NAME SYMBOL NUMBER NEWLINE EOF", types(tokens));
	}

	@Test
	void joinsLinesInsideBracketsAndAfterBackslash() {
		var tokens = new DslLexer().lex("f(1,\n      2)\ny = 1 + \\\n    2\n");

		assertEquals("f|(|1|,|2|)|y|=|1|+|2", lexemes(tokens));
		assertEquals(2, tokens.stream().filter(t -> t.type() == DslTokenType.NEWLINE).count());
	}

	@Test
	void decodesKnownEscapesAndKeepsOthers() {
		var tokens = new DslLexer().lex("x = 'it\\'s\\n' + \"\\d\"\n");

		List<String> strings = tokens.stream()
				.filter(t -> t.type() == DslTokenType.STRING)
				.map(DslToken::lexeme)
				.collect(Collectors.toList());
		assertEquals(List.of("it's\n", "\\d"), strings);
	}

	@Test
	void readsTripleQuotedStringsAcrossLines() {
		var tokens = new DslLexer().lex("\"\"\"first\nsecond \"quoted\" end\"\"\"\n");

		assertEquals(DslTokenType.STRING, tokens.get(0).type());
		assertEquals("first\nsecond \"quoted\" end", tokens.get(0).lexeme());
		assertEquals(DslTokenType.NEWLINE, tokens.get(1).type());
	}

	@Test
	void stripsUnderscoresFromNumbers() {
		var tokens = new DslLexer().lex("x = 1_000.5 + 2e-3\n");

		assertEquals("x|=|1000.5|+|2e-3", lexemes(tokens));
	}

	@Test
	void prefersLongestOperator() {
		var tokens = new DslLexer().lex("a <= b ** 2 // 3 != c\nd //= 2\n");

		assertEquals("a|<=|b|**|2|//|3|!=|c|d|//=|2", lexemes(tokens));
	}

	@Test
	void rejectsInconsistentDedent() {
		var ex = assertThrows(DslSyntaxException.class,
				() -> new DslLexer().lex("if x:\n    a = 1\n  b = 2\n"));

		assertEquals("line 3: unindent does not match any outer indentation level", ex.getMessage());
		assertEquals(3, ex.span().line());
	}

	@Test
	void rejectsUnterminatedString() {
		var ex = assertThrows(DslSyntaxException.class, () -> new DslLexer().lex("x = 'abc\n"));

		assertTrue(ex.getMessage().contains("unterminated string literal"), ex.getMessage());
	}

	@Test
	void rejectsUnbalancedBrackets() {
		assertThrows(DslSyntaxException.class, () -> new DslLexer().lex("x = (1 + 2\n"));
		assertThrows(DslSyntaxException.class, () -> new DslLexer().lex("x = 1)\n"));
	}

	@Test
	void rejectsUnknownCharacters() {
		var ex = assertThrows(DslSyntaxException.class, () -> new DslLexer().lex("x = $\n"));

		assertEquals("line 1: unexpected character '$'", ex.getMessage());
	}

	private static String lexemes(List<DslToken> tokens) {
		return tokens.stream()
				.filter(t -> t.type() == DslTokenType.NAME || t.type() == DslTokenType.NUMBER
						|| t.type() == DslTokenType.SYMBOL || t.type() == DslTokenType.STRING)
				.map(DslToken::lexeme)
				.collect(Collectors.joining("|"));
	}

	private static String types(List<DslToken> tokens) {
		return tokens.stream()
				.map(t -> t.type().name())
				.collect(Collectors.joining(" "));
	}
}
