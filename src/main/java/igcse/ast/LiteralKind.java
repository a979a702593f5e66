package igcse.ast;

public enum LiteralKind {
	INTEGER,
	REAL,
	STRING,
	CHAR,
	BOOLEAN,
	NULL
}
