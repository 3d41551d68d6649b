package ftcdsl.parse.dsl;

import ftcdsl.ast.SourceSpan;
import ftcdsl.ast.dsl.DslAssignStmt;
import ftcdsl.ast.dsl.DslAttributeExpr;
import ftcdsl.ast.dsl.DslAugAssignStmt;
import ftcdsl.ast.dsl.DslBinaryExpr;
import ftcdsl.ast.dsl.DslBooleanExpr;
import ftcdsl.ast.dsl.DslCallExpr;
import ftcdsl.ast.dsl.DslClassDecl;
import ftcdsl.ast.dsl.DslDecorator;
import ftcdsl.ast.dsl.DslExpr;
import ftcdsl.ast.dsl.DslExprStmt;
import ftcdsl.ast.dsl.DslFunctionDecl;
import ftcdsl.ast.dsl.DslGroupExpr;
import ftcdsl.ast.dsl.DslIfStmt;
import ftcdsl.ast.dsl.DslModule;
import ftcdsl.ast.dsl.DslNameExpr;
import ftcdsl.ast.dsl.DslNoneExpr;
import ftcdsl.ast.dsl.DslNumberExpr;
import ftcdsl.ast.dsl.DslPassStmt;
import ftcdsl.ast.dsl.DslStmt;
import ftcdsl.ast.dsl.DslStringExpr;
import ftcdsl.ast.dsl.DslUnaryExpr;
import ftcdsl.ast.dsl.DslUnsupportedExpr;
import ftcdsl.ast.dsl.DslWhileStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported subset of the robot script syntax.
 *
 * Anything outside the subset raises {@link DslSyntaxException}. The exceptions are list and dict
 * literals and subscripts, which parse into {@link DslUnsupportedExpr} so the rest of the unit can
 * still be translated.
 */
public final class DslParser {
	/**
	 * Deepest combined nesting of blocks and sub-expressions accepted before the parse is abandoned.
	 */
	static final int MAX_NESTING = 200;

	private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "<=", ">=", "==", "!=");
	private static final Set<String> AUGMENTED_OPS = Set.of("+=", "-=", "*=", "/=", "%=", "//=", "**=");
	private static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

	public DslModule parse(String source) {
		Cursor c = new Cursor(new DslLexer().lex(source));

		DslClassDecl unit = null;
		skipNewlines(c);
		while (!c.isAtEnd()) {
			DslClassDecl clazz = parseClass(c);
			if (unit != null) {
				throw new DslSyntaxException("only one class per source is supported, found '" + clazz.name()
						+ "' after '" + unit.name() + "'", clazz.span());
			}
			unit = clazz;
			skipNewlines(c);
		}

		if (unit == null) {
			throw new DslSyntaxException("no class definition found", c.peek().span());
		}
		return new DslModule(unit, new SourceSpan(1, 0, source.length()));
	}

	private void skipNewlines(Cursor c) {
		while (c.peek().type() == DslTokenType.NEWLINE) {
			c.next();
		}
	}

	private List<DslDecorator> parseDecorators(Cursor c) {
		List<DslDecorator> decorators = new ArrayList<>();
		while (c.peekIsSymbol("@")) {
			DslToken at = c.next();
			DslToken name = c.expect(DslTokenType.NAME, "decorator name");
			List<DslExpr> args = List.of();
			boolean called = false;
			if (c.peekIsSymbol("(")) {
				c.next();
				args = parseArguments(c);
				called = true;
			}
			decorators.add(new DslDecorator(name.lexeme(), args, called, at.span().to(c.previous().span())));
			c.expectNewline();
		}
		return decorators;
	}

	private DslClassDecl parseClass(Cursor c) {
		List<DslDecorator> decorators = parseDecorators(c);
		DslToken start = c.peek();
		if (!c.peekIsName("class")) {
			throw unexpected(start, "a class definition");
		}
		c.next();
		DslToken name = c.expect(DslTokenType.NAME, "class name");

		if (c.acceptSymbol("(")) {
			while (!c.peekIsSymbol(")")) {
				c.expect(DslTokenType.NAME, "base class name");
				if (!c.acceptSymbol(",")) {
					break;
				}
			}
			c.expectSymbol(")");
		}
		c.expectSymbol(":");

		List<DslFunctionDecl> functions = new ArrayList<>();
		parseSuite(c, () -> parseClassMember(c, functions));

		SourceSpan span = (decorators.isEmpty() ? start.span() : decorators.get(0).span()).to(c.previous().span());
		return new DslClassDecl(name.lexeme(), decorators, functions, span);
	}

	private void parseClassMember(Cursor c, List<DslFunctionDecl> functions) {
		if (c.peekIsName("pass")) {
			c.next();
			c.expectNewline();
			return;
		}
		if (c.peek().type() == DslTokenType.STRING) {
			// docstring
			parseExpr(c);
			c.expectNewline();
			return;
		}

		// routine decorators carry no meaning for the target and are dropped
		parseDecorators(c);
		if (c.peekIsName("def")) {
			functions.add(parseFunction(c));
			return;
		}
		throw unexpected(c.peek(), "a routine definition");
	}

	private DslFunctionDecl parseFunction(Cursor c) {
		DslToken start = c.expectName("def");
		DslToken name = c.expect(DslTokenType.NAME, "routine name");
		c.expectSymbol("(");

		List<String> names = new ArrayList<>();
		while (!c.peekIsSymbol(")")) {
			DslToken param = c.expect(DslTokenType.NAME, "parameter name");
			if (c.peekIsSymbol("=")) {
				throw new DslSyntaxException("default parameter values are not supported", param.span());
			}
			names.add(param.lexeme());
			if (!c.acceptSymbol(",")) {
				break;
			}
		}
		c.expectSymbol(")");
		c.expectSymbol(":");

		List<DslStmt> body = parseStatementSuite(c);
		String receiver = names.isEmpty() ? null : names.get(0);
		List<String> params = names.isEmpty() ? List.of() : List.copyOf(names.subList(1, names.size()));
		return new DslFunctionDecl(name.lexeme(), receiver, params, body, start.span().to(c.previous().span()));
	}

	/**
	 * Parses either an inline suite ({@code if x: pass}) or an indented block, calling {@code item}
	 * once per member.
	 */
	private void parseSuite(Cursor c, Runnable item) {
		if (c.peek().type() != DslTokenType.NEWLINE) {
			item.run();
			return;
		}
		c.next();
		c.expect(DslTokenType.INDENT, "an indented block");
		while (c.peek().type() != DslTokenType.DEDENT && !c.isAtEnd()) {
			item.run();
		}
		c.expect(DslTokenType.DEDENT, "end of block");
	}

	private List<DslStmt> parseStatementSuite(Cursor c) {
		c.descend("blocks");
		List<DslStmt> stmts = new ArrayList<>();
		parseSuite(c, () -> stmts.add(parseStatement(c)));
		c.ascend();
		return stmts;
	}

	private DslStmt parseStatement(Cursor c) {
		DslToken t = c.peek();
		if (t.type() == DslTokenType.INDENT) {
			throw new DslSyntaxException("unexpected indent", t.span());
		}
		if (t.type() == DslTokenType.NAME) {
			switch (t.lexeme()) {
				case "if" -> {
					return parseIf(c);
				}
				case "while" -> {
					return parseWhile(c);
				}
				case "pass" -> {
					c.next();
					c.expectNewline();
					return new DslPassStmt(t.span());
				}
				case "elif", "else" ->
						throw new DslSyntaxException("'" + t.lexeme() + "' without a matching 'if'", t.span());
				case "def", "class" ->
						throw new DslSyntaxException("nested routine and class definitions are not supported", t.span());
				default -> {
					if (KEYWORDS.contains(t.lexeme()) && !isExpressionKeyword(t.lexeme())) {
						throw new DslSyntaxException("'" + t.lexeme() + "' statements are not supported", t.span());
					}
				}
			}
		}
		return parseSimpleStatement(c);
	}

	private static boolean isExpressionKeyword(String word) {
		return word.equals("True") || word.equals("False") || word.equals("None") || word.equals("not");
	}

	private DslStmt parseSimpleStatement(Cursor c) {
		DslExpr first = parseExpr(c);

		if (c.peekIsSymbol("=")) {
			c.next();
			requireAssignable(first);
			DslExpr value = parseExpr(c);
			if (c.peekIsSymbol("=")) {
				throw new DslSyntaxException("chained assignment is not supported", c.peek().span());
			}
			c.expectNewline();
			return new DslAssignStmt(first, value, first.span().to(value.span()));
		}

		if (c.peek().type() == DslTokenType.SYMBOL && AUGMENTED_OPS.contains(c.peek().lexeme())) {
			String op = c.next().lexeme();
			requireAssignable(first);
			DslExpr value = parseExpr(c);
			c.expectNewline();
			return new DslAugAssignStmt(first, op.substring(0, op.length() - 1), value, first.span().to(value.span()));
		}

		if (c.peekIsSymbol(",")) {
			throw new DslSyntaxException("tuples are not supported", c.peek().span());
		}
		c.expectNewline();
		return new DslExprStmt(first, first.span());
	}

	private void requireAssignable(DslExpr target) {
		if (!(target instanceof DslNameExpr) && !(target instanceof DslAttributeExpr)) {
			throw new DslSyntaxException("cannot assign to this expression; only names and attributes are assignable",
					target.span());
		}
	}

	private DslIfStmt parseIf(Cursor c) {
		DslToken start = c.expectName("if");
		List<DslIfStmt.Branch> branches = new ArrayList<>();
		branches.add(parseBranch(c));

		while (c.peekIsName("elif")) {
			c.next();
			branches.add(parseBranch(c));
		}

		List<DslStmt> elseBody = List.of();
		if (c.peekIsName("else")) {
			c.next();
			c.expectSymbol(":");
			elseBody = parseStatementSuite(c);
		}
		return new DslIfStmt(branches, elseBody, start.span().to(c.previous().span()));
	}

	private DslIfStmt.Branch parseBranch(Cursor c) {
		DslExpr condition = parseExpr(c);
		c.expectSymbol(":");
		return new DslIfStmt.Branch(condition, parseStatementSuite(c));
	}

	private DslWhileStmt parseWhile(Cursor c) {
		DslToken start = c.expectName("while");
		DslExpr condition = parseExpr(c);
		c.expectSymbol(":");
		List<DslStmt> body = parseStatementSuite(c);
		if (c.peekIsName("else")) {
			throw new DslSyntaxException("'while' with 'else' is not supported", c.peek().span());
		}
		return new DslWhileStmt(condition, body, start.span().to(c.previous().span()));
	}

	private DslExpr parseExpr(Cursor c) {
		c.descend("expression");
		DslExpr expr = parseOr(c);
		c.ascend();
		return expr;
	}

	private DslExpr parseOr(Cursor c) {
		DslExpr left = parseAnd(c);
		while (c.peekIsName("or")) {
			c.next();
			DslExpr right = parseAnd(c);
			left = new DslBinaryExpr(left, "or", right, left.span().to(right.span()));
		}
		return left;
	}

	private DslExpr parseAnd(Cursor c) {
		DslExpr left = parseNot(c);
		while (c.peekIsName("and")) {
			c.next();
			DslExpr right = parseNot(c);
			left = new DslBinaryExpr(left, "and", right, left.span().to(right.span()));
		}
		return left;
	}

	private DslExpr parseNot(Cursor c) {
		if (c.peekIsName("not")) {
			DslToken op = c.next();
			c.descend("expression");
			DslExpr operand = parseNot(c);
			c.ascend();
			return new DslUnaryExpr("not", operand, op.span().to(operand.span()));
		}
		return parseComparison(c);
	}

	private DslExpr parseComparison(Cursor c) {
		DslExpr left = parseArith(c);
		if (isComparison(c.peek())) {
			String op = c.next().lexeme();
			DslExpr right = parseArith(c);
			left = new DslBinaryExpr(left, op, right, left.span().to(right.span()));
			if (isComparison(c.peek())) {
				throw new DslSyntaxException("chained comparisons are not supported", c.peek().span());
			}
		}
		if (c.peekIsName("is") || c.peekIsName("in") || (c.peekIsName("not") && c.peekAhead(1).lexeme().equals("in"))) {
			throw new DslSyntaxException("'" + c.peek().lexeme() + "' comparisons are not supported", c.peek().span());
		}
		return left;
	}

	private static boolean isComparison(DslToken t) {
		return t.type() == DslTokenType.SYMBOL && COMPARISON_OPS.contains(t.lexeme());
	}

	private DslExpr parseArith(Cursor c) {
		DslExpr left = parseTerm(c);
		while (c.peekIsSymbol("+") || c.peekIsSymbol("-")) {
			String op = c.next().lexeme();
			DslExpr right = parseTerm(c);
			left = new DslBinaryExpr(left, op, right, left.span().to(right.span()));
		}
		return left;
	}

	private DslExpr parseTerm(Cursor c) {
		DslExpr left = parseUnary(c);
		while (c.peekIsSymbol("*") || c.peekIsSymbol("/") || c.peekIsSymbol("//") || c.peekIsSymbol("%")) {
			String op = c.next().lexeme();
			DslExpr right = parseUnary(c);
			left = new DslBinaryExpr(left, op, right, left.span().to(right.span()));
		}
		return left;
	}

	private DslExpr parseUnary(Cursor c) {
		if (c.peekIsSymbol("-")) {
			DslToken op = c.next();
			c.descend("expression");
			DslExpr operand = parseUnary(c);
			c.ascend();
			return new DslUnaryExpr("-", operand, op.span().to(operand.span()));
		}
		if (c.peekIsSymbol("+") || c.peekIsSymbol("~")) {
			throw new DslSyntaxException("unary '" + c.peek().lexeme() + "' is not supported", c.peek().span());
		}
		return parsePower(c);
	}

	private DslExpr parsePower(Cursor c) {
		DslExpr base = parsePostfix(c);
		if (c.peekIsSymbol("**")) {
			c.next();
			c.descend("expression");
			DslExpr exponent = parseUnary(c);
			c.ascend();
			return new DslBinaryExpr(base, "**", exponent, base.span().to(exponent.span()));
		}
		return base;
	}

	private DslExpr parsePostfix(Cursor c) {
		DslExpr expr = parsePrimary(c);
		while (true) {
			if (c.acceptSymbol(".")) {
				DslToken name = c.expect(DslTokenType.NAME, "attribute name");
				expr = new DslAttributeExpr(expr, name.lexeme(), expr.span().to(name.span()));
				continue;
			}
			if (c.acceptSymbol("(")) {
				List<DslExpr> args = parseArguments(c);
				expr = new DslCallExpr(expr, args, expr.span().to(c.previous().span()));
				continue;
			}
			if (c.peekIsSymbol("[")) {
				SourceSpan span = skipBalanced(c);
				expr = new DslUnsupportedExpr("subscript", expr.span().to(span));
				continue;
			}
			return expr;
		}
	}

	/**
	 * Parses call arguments after the opening parenthesis, consuming the closing one.
	 */
	private List<DslExpr> parseArguments(Cursor c) {
		List<DslExpr> args = new ArrayList<>();
		while (!c.peekIsSymbol(")")) {
			DslToken t = c.peek();
			if (t.type() == DslTokenType.NAME && c.peekAhead(1).type() == DslTokenType.SYMBOL
					&& c.peekAhead(1).lexeme().equals("=")) {
				throw new DslSyntaxException("keyword arguments are not supported", t.span());
			}
			if (c.peekIsSymbol("*") || c.peekIsSymbol("**")) {
				throw new DslSyntaxException("star arguments are not supported", t.span());
			}
			args.add(parseExpr(c));
			if (!c.acceptSymbol(",")) {
				break;
			}
		}
		c.expectSymbol(")");
		return args;
	}

	private DslExpr parsePrimary(Cursor c) {
		DslToken t = c.peek();
		switch (t.type()) {
			case NUMBER -> {
				c.next();
				return new DslNumberExpr(t.lexeme(), t.span());
			}
			case STRING -> {
				c.next();
				StringBuilder value = new StringBuilder(t.lexeme());
				SourceSpan span = t.span();
				while (c.peek().type() == DslTokenType.STRING) {
					DslToken next = c.next();
					value.append(next.lexeme());
					span = span.to(next.span());
				}
				return new DslStringExpr(value.toString(), span);
			}
			case NAME -> {
				return parseNamePrimary(c);
			}
			case SYMBOL -> {
				if (t.lexeme().equals("(")) {
					c.next();
					if (c.peekIsSymbol(")")) {
						throw new DslSyntaxException("tuples are not supported", t.span());
					}
					DslExpr inner = parseExpr(c);
					if (c.peekIsSymbol(",")) {
						throw new DslSyntaxException("tuples are not supported", c.peek().span());
					}
					DslToken end = c.expectSymbol(")");
					return new DslGroupExpr(inner, t.span().to(end.span()));
				}
				if (t.lexeme().equals("[")) {
					return new DslUnsupportedExpr("list literal", skipBalanced(c));
				}
				if (t.lexeme().equals("{")) {
					return new DslUnsupportedExpr("dict literal", skipBalanced(c));
				}
				throw unexpected(t, "an expression");
			}
			default -> throw unexpected(t, "an expression");
		}
	}

	private DslExpr parseNamePrimary(Cursor c) {
		DslToken t = c.next();
		switch (t.lexeme()) {
			case "True" -> {
				return new DslBooleanExpr(true, t.span());
			}
			case "False" -> {
				return new DslBooleanExpr(false, t.span());
			}
			case "None" -> {
				return new DslNoneExpr(t.span());
			}
			default -> {
				if (KEYWORDS.contains(t.lexeme())) {
					throw unexpected(t, "an expression");
				}
				return new DslNameExpr(t.lexeme(), t.span());
			}
		}
	}

	/**
	 * Consumes a bracketed token run starting at the current opening bracket, returning its span.
	 */
	private SourceSpan skipBalanced(Cursor c) {
		DslToken open = c.next();
		int depth = 1;
		DslToken t = open;
		while (depth > 0) {
			t = c.next();
			if (t.type() == DslTokenType.EOF) {
				throw new DslSyntaxException("unexpected end of input inside brackets", open.span());
			}
			if (t.type() != DslTokenType.SYMBOL) {
				continue;
			}
			switch (t.lexeme()) {
				case "(", "[", "{" -> depth++;
				case ")", "]", "}" -> depth--;
				default -> {
				}
			}
		}
		return open.span().to(t.span());
	}

	private static DslSyntaxException unexpected(DslToken t, String what) {
		return new DslSyntaxException("expected " + what + " but got " + t.describe(), t.span());
	}

	private static final class Cursor {
		private final List<DslToken> tokens;
		private int pos;
		private int depth;

		Cursor(List<DslToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
			this.depth = 0;
		}

		void descend(String what) {
			if (++depth > MAX_NESTING) {
				throw new DslSyntaxException(what + " nested too deeply", peek().span());
			}
		}

		void ascend() {
			depth--;
		}

		boolean isAtEnd() {
			return peek().type() == DslTokenType.EOF;
		}

		DslToken peek() {
			return tokens.get(pos);
		}

		DslToken peekAhead(int offset) {
			return tokens.get(Math.min(pos + offset, tokens.size() - 1));
		}

		DslToken next() {
			DslToken t = tokens.get(pos);
			if (t.type() != DslTokenType.EOF) {
				pos++;
			}
			return t;
		}

		DslToken previous() {
			return tokens.get(Math.max(0, pos - 1));
		}

		boolean peekIsName(String lexeme) {
			DslToken t = peek();
			return t.type() == DslTokenType.NAME && t.lexeme().equals(lexeme);
		}

		boolean peekIsSymbol(String lexeme) {
			DslToken t = peek();
			return t.type() == DslTokenType.SYMBOL && t.lexeme().equals(lexeme);
		}

		boolean acceptSymbol(String lexeme) {
			if (peekIsSymbol(lexeme)) {
				next();
				return true;
			}
			return false;
		}

		DslToken expectName(String lexeme) {
			if (!peekIsName(lexeme)) {
				throw unexpected(peek(), "'" + lexeme + "'");
			}
			return next();
		}

		DslToken expectSymbol(String lexeme) {
			if (!peekIsSymbol(lexeme)) {
				throw unexpected(peek(), "'" + lexeme + "'");
			}
			return next();
		}

		void expectNewline() {
			if (peekIsSymbol(";")) {
				throw new DslSyntaxException("multiple statements on one line are not supported", peek().span());
			}
			expect(DslTokenType.NEWLINE, "end of line");
		}

		DslToken expect(DslTokenType type, String what) {
			if (peek().type() != type) {
				throw unexpected(peek(), what);
			}
			return next();
		}
	}
}
