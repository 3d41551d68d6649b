package ftcdsl.parse.dsl;

public enum DslTokenType {
	NAME,
	NUMBER,
	STRING,
	SYMBOL,
	NEWLINE,
	INDENT,
	DEDENT,
	EOF
}
