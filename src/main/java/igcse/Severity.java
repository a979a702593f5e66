package igcse;

public enum Severity {
	INFO,
	WARNING,
	ERROR
}
