package igcse.parse;

import igcse.LexicalException;
import igcse.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer shared by the Java and TypeScript front ends.
 *
 * Notes:
 * - Skips whitespace, // line comments and /* block comments *\/.
 * - Keywords are returned as IDENT tokens; the parser decides what they mean.
 * - Operators are matched longest first, so {@code ==} never lexes as two {@code =}.
 * - Template literals (backticks) are not supported and raise a LexicalException.
 */
public final class Lexer {
	private static final List<String> THREE_CHAR_OPERATORS = List.of("===", "!==");

	private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
			"==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=");

	private static final String SINGLE_CHAR_OPERATORS = "+-*/%=<>!&|^~?:";

	private static final String PUNCTUATION = ";,(){}[].@";

	public List<Token> tokenize(String input) {
		LineMap lines = new LineMap(input);
		List<Token> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			// whitespace
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					i = consumeLineComment(input, i);
					continue;
				}
				if (n == '*') {
					i = consumeBlockComment(input, i, lines);
					continue;
				}
			}

			// string literal
			if (c == '"') {
				int start = i;
				i = consumeQuoted(input, i, '"', lines);
				tokens.add(new Token(TokenType.STRING, input.substring(start, i), lines.span(start, i)));
				continue;
			}

			// char literal (or a single-quoted TypeScript string)
			if (c == '\'') {
				int start = i;
				i = consumeQuoted(input, i, '\'', lines);
				tokens.add(new Token(TokenType.CHAR, input.substring(start, i), lines.span(start, i)));
				continue;
			}

			if (isIdentifierStart(c)) {
				int start = i;
				i++;
				while (i < input.length() && isIdentifierPart(input.charAt(i))) {
					i++;
				}
				tokens.add(new Token(TokenType.IDENT, input.substring(start, i), lines.span(start, i)));
				continue;
			}

			if (Character.isDigit(c)) {
				int start = i;
				i = consumeDigits(input, i);
				// a '.' is a decimal point only with a digit on both sides
				if (i + 1 < input.length() && input.charAt(i) == '.' && Character.isDigit(input.charAt(i + 1))) {
					i = consumeDigits(input, i + 1);
				}
				String text = input.substring(start, i);
				if (i < input.length() && "lLfFdD".indexOf(input.charAt(i)) >= 0) {
					i++;
				}
				tokens.add(new Token(TokenType.NUMBER, text, lines.span(start, i)));
				continue;
			}

			// operators, longest match first
			String three = (i + 2 < input.length()) ? input.substring(i, i + 3) : "";
			if (THREE_CHAR_OPERATORS.contains(three)) {
				tokens.add(new Token(TokenType.OPERATOR, three, lines.span(i, i + 3)));
				i += 3;
				continue;
			}
			String two = (i + 1 < input.length()) ? input.substring(i, i + 2) : "";
			if (TWO_CHAR_OPERATORS.contains(two)) {
				tokens.add(new Token(TokenType.OPERATOR, two, lines.span(i, i + 2)));
				i += 2;
				continue;
			}
			if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
				tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), lines.span(i, i + 1)));
				i++;
				continue;
			}

			if (PUNCTUATION.indexOf(c) >= 0) {
				tokens.add(new Token(TokenType.PUNCTUATION, String.valueOf(c), lines.span(i, i + 1)));
				i++;
				continue;
			}

			SourceSpan at = lines.span(i, i + 1);
			throw new LexicalException("Unexpected character '" + c + "'", at);
		}

		tokens.add(new Token(TokenType.EOF, "", lines.span(input.length(), input.length())));
		return tokens;
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_' || c == '$';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static int consumeDigits(String input, int start) {
		int i = start;
		while (i < input.length() && Character.isDigit(input.charAt(i))) {
			i++;
		}
		return i;
	}

	private static int consumeLineComment(String input, int start) {
		int i = start + 2;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
			i++;
		}
		return i;
	}

	private static int consumeBlockComment(String input, int start, LineMap lines) {
		int i = start + 2;
		while (i + 1 < input.length()) {
			if (input.charAt(i) == '*' && input.charAt(i + 1) == '/') {
				return i + 2;
			}
			i++;
		}
		throw new LexicalException("Unterminated block comment", lines.span(start, start + 2));
	}

	private static int consumeQuoted(String input, int start, char quote, LineMap lines) {
		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				// skip escaped character if present
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			if (c == '\n') {
				break;
			}
			i++;
		}
		throw new LexicalException("Unterminated literal", lines.span(start, start + 1));
	}

	/**
	 * Maps offsets to 1-based line/column pairs.
	 */
	private static final class LineMap {
		private final List<Integer> lineStarts = new ArrayList<>();

		LineMap(String input) {
			lineStarts.add(0);
			for (int i = 0; i < input.length(); i++) {
				if (input.charAt(i) == '\n') {
					lineStarts.add(i + 1);
				}
			}
		}

		SourceSpan span(int start, int end) {
			int low = 0;
			int high = lineStarts.size() - 1;
			while (low < high) {
				int mid = (low + high + 1) >>> 1;
				if (lineStarts.get(mid) <= start) {
					low = mid;
				} else {
					high = mid - 1;
				}
			}
			return new SourceSpan(start, end, low + 1, start - lineStarts.get(low) + 1);
		}
	}
}
