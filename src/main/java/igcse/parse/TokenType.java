package igcse.parse;

public enum TokenType {
	IDENT,
	NUMBER,
	STRING,
	CHAR,
	OPERATOR,
	PUNCTUATION,
	EOF
}
