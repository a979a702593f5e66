package igcse.parse;

import igcse.LexicalException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LexerTest {
	@Test
	void skipsLineAndBlockCommentsButNotInsideStrings() {
		String input = "int x = 1; // line\n" +
				"/* block */ int y=2;\n" +
				"String s = \"/* not a comment */\"; // trailing\n";

		assertEquals(
				"int|x|=|1|;|int|y|=|2|;|String|s|=|\"/* not a comment */\"|;",
				lexemes(input));
	}

	@Test
	void matchesLongestOperatorFirst() {
		assertEquals("a|===|b|&&|c|!==|d|<=|e|++", lexemes("a === b && c !== d <= e++"));
		assertEquals("x|+=|1|;|y|--|;", lexemes("x += 1; y--;"));
	}

	@Test
	void decimalPointNeedsDigitsOnBothSides() {
		List<Token> tokens = new Lexer().tokenize("3.14 + a.length + 2L");
		assertEquals(TokenType.NUMBER, tokens.get(0).type());
		assertEquals("3.14", tokens.get(0).text());
		assertEquals("a|.|length", tokens.subList(2, 5).stream().map(Token::text).collect(Collectors.joining("|")));
		// the long suffix is dropped from the text
		assertEquals("2", tokens.get(6).text());
	}

	@Test
	void singleQuotesLexAsCharTokens() {
		List<Token> tokens = new Lexer().tokenize("'a' 'hello'");
		assertEquals(TokenType.CHAR, tokens.get(0).type());
		assertEquals("'hello'", tokens.get(1).text());
	}

	@Test
	void tracksLineAndColumn() {
		List<Token> tokens = new Lexer().tokenize("int x;\n  y = 2;");
		Token y = tokens.get(3);
		assertEquals("y", y.text());
		assertEquals(2, y.span().line());
		assertEquals(3, y.span().column());
	}

	@Test
	void endsWithEofToken() {
		List<Token> tokens = new Lexer().tokenize("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).type());
	}

	@Test
	void rejectsTemplateLiterals() {
		LexicalException e = assertThrows(LexicalException.class, () -> new Lexer().tokenize("let s = `x`;"));
		assertEquals(1, e.line());
		assertEquals(9, e.column());
	}

	@Test
	void rejectsUnterminatedString() {
		LexicalException e = assertThrows(LexicalException.class, () -> new Lexer().tokenize("x = 1;\ns = \"abc\n"));
		assertEquals("Unterminated literal", e.getMessage());
		assertEquals(2, e.line());
	}

	@Test
	void rejectsUnterminatedBlockComment() {
		assertThrows(LexicalException.class, () -> new Lexer().tokenize("int x; /* open"));
	}

	private static String lexemes(String input) {
		return new Lexer().tokenize(input).stream()
				.filter(t -> t.type() != TokenType.EOF)
				.map(Token::text)
				.collect(Collectors.joining("|"));
	}
}
