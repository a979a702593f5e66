package igcse.parse;

import igcse.RecursionLimitExceededException;
import igcse.SourceLanguage;
import igcse.SyntaxException;
import igcse.ast.ArrayAccess;
import igcse.ast.ArrayLiteral;
import igcse.ast.Assignment;
import igcse.ast.BinaryExpression;
import igcse.ast.Block;
import igcse.ast.BreakStatement;
import igcse.ast.Cast;
import igcse.ast.ClassDeclaration;
import igcse.ast.ContinueStatement;
import igcse.ast.DoWhileStatement;
import igcse.ast.EnhancedForStatement;
import igcse.ast.Expression;
import igcse.ast.ExpressionStatement;
import igcse.ast.ForStatement;
import igcse.ast.Identifier;
import igcse.ast.IfStatement;
import igcse.ast.Literal;
import igcse.ast.LiteralKind;
import igcse.ast.MemberAccess;
import igcse.ast.MethodCall;
import igcse.ast.MethodDeclaration;
import igcse.ast.NewArray;
import igcse.ast.NewObject;
import igcse.ast.Parameter;
import igcse.ast.Program;
import igcse.ast.ReturnStatement;
import igcse.ast.SourceSpan;
import igcse.ast.Statement;
import igcse.ast.SwitchCase;
import igcse.ast.SwitchStatement;
import igcse.ast.TypeRef;
import igcse.ast.UnaryExpression;
import igcse.ast.UpdateExpression;
import igcse.ast.VariableDeclaration;
import igcse.ast.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the Java and TypeScript subsets the converter supports.
 *
 * Expressions use precedence climbing over {@link #BINARY_LEVELS}. Any malformed
 * construct raises a {@link SyntaxException}; a partial tree is never returned.
 * Input nested deeper than {@link #MAX_NESTING} statements, expressions or types
 * raises a {@link RecursionLimitExceededException} instead of exhausting the stack.
 */
public final class Parser {
	/**
	 * Binary operator levels, lowest binding first. Assignment sits below, unary above.
	 */
	private static final List<Set<String>> BINARY_LEVELS = List.of(
			Set.of("||"),
			Set.of("&&"),
			Set.of("==", "!=", "===", "!=="),
			Set.of("<", ">", "<=", ">="),
			Set.of("+", "-", "&"),
			Set.of("*", "/", "%"));

	static final int MAX_NESTING = 200;

	private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=");

	private static final Set<String> MODIFIERS = Set.of(
			"public", "private", "protected", "static", "final", "abstract", "synchronized", "native",
			"transient", "volatile", "readonly", "export", "declare");

	private static final Set<String> RESERVED = Set.of(
			"return", "if", "else", "for", "while", "do", "switch", "case", "default", "break", "continue",
			"class", "new", "this", "throw", "true", "false", "null");

	private static final Set<String> CAST_TYPES = Set.of(
			"int", "long", "short", "byte", "double", "float", "char", "boolean", "String");

	private final SourceLanguage language;

	public Parser(SourceLanguage language) {
		this.language = language;
	}

	public Program parse(String source) {
		Cursor c = new Cursor(new Lexer().tokenize(source));

		skipImports(c);

		List<Statement> body = new ArrayList<>();
		while (!c.isAtEnd()) {
			parseTopLevelInto(c, body);
		}
		return new Program(List.copyOf(body), new SourceSpan(0, source.length(), 1, 1));
	}

	// ---------------------------------------------------------------- declarations

	private void skipImports(Cursor c) {
		while (c.peekIsIdent("package") || c.peekIsIdent("import")) {
			while (!c.peekIsPunct(";")) {
				if (c.isAtEnd()) {
					throw c.error("';'");
				}
				c.next();
			}
			c.next();
		}
	}

	private void parseTopLevelInto(Cursor c, List<Statement> out) {
		int mark = c.mark();
		skipAnnotations(c);
		List<String> modifiers = parseModifiers(c);
		if (c.peekIsIdent("class")) {
			out.add(parseClass(c, modifiers, c.peek()));
			return;
		}
		if (c.peekIsIdent("interface") || c.peekIsIdent("enum")) {
			throw new SyntaxException("'" + c.peek().text() + "' declarations are not supported", c.peek().span());
		}
		if (language == SourceLanguage.TYPESCRIPT) {
			// export/declare carry no meaning in pseudocode
			if (c.peekIsIdent("function")) {
				out.add(parseFunction(c));
			} else {
				parseStatementInto(c, out);
			}
			return;
		}
		if (looksLikeJavaMethod(c)) {
			Token start = c.peek();
			TypeRef returnType = parseJavaType(c);
			Token name = c.expect(TokenType.IDENT, "method name");
			out.add(parseMethodRest(c, name.text(), modifiers, returnType, start));
			return;
		}
		c.reset(mark);
		parseStatementInto(c, out);
	}

	private ClassDeclaration parseClass(Cursor c, List<String> modifiers, Token start) {
		c.expectIdent("class");
		Token name = c.expect(TokenType.IDENT, "class name");
		skipTypeParameters(c);

		String superclass = null;
		List<String> interfaces = new ArrayList<>();
		if (c.peekIsIdent("extends")) {
			c.next();
			superclass = parseTypeName(c).name();
		}
		if (c.peekIsIdent("implements")) {
			c.next();
			interfaces.add(parseTypeName(c).name());
			while (c.peekIsPunct(",")) {
				c.next();
				interfaces.add(parseTypeName(c).name());
			}
		}

		c.expectPunct("{");
		List<Statement> members = new ArrayList<>();
		while (!c.peekIsPunct("}")) {
			if (c.isAtEnd()) {
				throw c.error("'}'");
			}
			parseMemberInto(c, name.text(), members);
		}
		Token end = c.expectPunct("}");
		return new ClassDeclaration(name.text(), List.copyOf(modifiers), superclass, List.copyOf(interfaces),
				List.copyOf(members), start.span().to(end.span()));
	}

	private void parseMemberInto(Cursor c, String className, List<Statement> out) {
		if (c.peekIsPunct(";")) {
			c.next();
			return;
		}
		Token start = c.peek();
		skipAnnotations(c);
		List<String> modifiers = parseModifiers(c);

		if (c.peekIsIdent("class")) {
			out.add(nested(c, () -> parseClass(c, modifiers, start)));
			return;
		}
		if (c.peekIsPunct("{")) {
			// static or instance initializer block
			out.add(parseBlock(c));
			return;
		}

		if (language == SourceLanguage.TYPESCRIPT) {
			Token name = c.expect(TokenType.IDENT, "member name");
			if (c.peekIsPunct("(")) {
				out.add(parseMethodRest(c, name.text(), modifiers, null, start));
				return;
			}
			out.add(parseTypeScriptField(c, name, modifiers, start));
			return;
		}

		skipTypeParameters(c);
		// constructor: ClassName(
		if (c.peek().is(TokenType.IDENT, className) && c.peekAt(1).is(TokenType.PUNCTUATION, "(")) {
			Token name = c.next();
			out.add(parseMethodRest(c, name.text(), modifiers, null, start));
			return;
		}
		TypeRef type = parseJavaType(c);
		Token name = c.expect(TokenType.IDENT, "member name");
		if (c.peekIsPunct("(")) {
			out.add(parseMethodRest(c, name.text(), modifiers, type, start));
			return;
		}
		parseDeclaratorsRest(c, type, modifiers, name, start, out);
		c.expectPunct(";");
	}

	private VariableDeclaration parseTypeScriptField(Cursor c, Token name, List<String> modifiers, Token start) {
		if (c.peekIsOperator("?")) {
			c.next();
		}
		TypeRef type = null;
		if (c.peekIsOperator(":")) {
			c.next();
			type = parseTypeScriptType(c);
		}
		Expression init = null;
		if (c.peekIsOperator("=")) {
			c.next();
			init = parseExpression(c);
		}
		Token end = c.expectPunct(";");
		return new VariableDeclaration(name.text(), type, List.copyOf(modifiers), init, start.span().to(end.span()));
	}

	private MethodDeclaration parseMethodRest(Cursor c, String name, List<String> modifiers, TypeRef returnType,
			Token start) {
		c.expectPunct("(");
		List<Parameter> params = new ArrayList<>();
		if (!c.peekIsPunct(")")) {
			while (true) {
				params.add(parseParameter(c));
				if (c.peekIsPunct(",")) {
					c.next();
					continue;
				}
				break;
			}
		}
		c.expectPunct(")");

		if (language == SourceLanguage.TYPESCRIPT && c.peekIsOperator(":")) {
			c.next();
			returnType = parseTypeScriptType(c);
		}
		if (c.peekIsIdent("throws")) {
			c.next();
			parseTypeName(c);
			while (c.peekIsPunct(",")) {
				c.next();
				parseTypeName(c);
			}
		}
		if (c.peekIsPunct(";")) {
			throw new SyntaxException("Method '" + name + "' has no body", c.peek().span());
		}
		Block body = parseBlock(c);
		return new MethodDeclaration(name, List.copyOf(modifiers), returnType, List.copyOf(params), body,
				start.span().to(body.span()));
	}

	private Parameter parseParameter(Cursor c) {
		skipAnnotations(c);
		parseModifiers(c);
		if (language == SourceLanguage.TYPESCRIPT) {
			Token name = c.expect(TokenType.IDENT, "parameter name");
			if (c.peekIsOperator("?")) {
				c.next();
			}
			TypeRef type = null;
			if (c.peekIsOperator(":")) {
				c.next();
				type = parseTypeScriptType(c);
			}
			if (c.peekIsOperator("=")) {
				c.next();
				parseExpression(c);
			}
			return new Parameter(name.text(), type, name.span());
		}

		TypeRef type = parseJavaType(c);
		if (c.peekIsPunct(".") && c.peekAt(1).is(TokenType.PUNCTUATION, ".")
				&& c.peekAt(2).is(TokenType.PUNCTUATION, ".")) {
			c.next();
			c.next();
			c.next();
			type = new TypeRef(type.name(), type.dimensions() + 1, type.span());
		}
		Token name = c.expect(TokenType.IDENT, "parameter name");
		type = parseTrailingDimensions(c, type);
		return new Parameter(name.text(), type, type.span().to(name.span()));
	}

	private List<String> parseModifiers(Cursor c) {
		List<String> modifiers = new ArrayList<>();
		while (c.peek().type() == TokenType.IDENT && MODIFIERS.contains(c.peek().text())) {
			// a TypeScript member may itself be named like a modifier
			if (language == SourceLanguage.TYPESCRIPT && isMemberNameFollower(c.peekAt(1))) {
				break;
			}
			modifiers.add(c.next().text());
		}
		return modifiers;
	}

	private static boolean isMemberNameFollower(Token t) {
		return t.is(TokenType.PUNCTUATION, "(") || t.is(TokenType.OPERATOR, ":") || t.is(TokenType.OPERATOR, "=")
				|| t.is(TokenType.PUNCTUATION, ";");
	}

	private void skipAnnotations(Cursor c) {
		while (c.peekIsPunct("@")) {
			c.next();
			parseTypeName(c);
			if (c.peekIsPunct("(")) {
				skipBalanced(c, "(", ")");
			}
		}
	}

	private void skipTypeParameters(Cursor c) {
		if (c.peekIsOperator("<")) {
			skipBalanced(c, "<", ">");
		}
	}

	private void skipBalanced(Cursor c, String open, String close) {
		int depth = 0;
		do {
			if (c.isAtEnd()) {
				throw c.error("'" + close + "'");
			}
			Token t = c.next();
			if (t.text().equals(open)) {
				depth++;
			} else if (t.text().equals(close)) {
				depth--;
			}
		} while (depth > 0);
	}

	// ---------------------------------------------------------------- types

	private TypeRef parseTypeName(Cursor c) {
		Token first = c.expect(TokenType.IDENT, "type");
		StringBuilder name = new StringBuilder(first.text());
		while (c.peekIsPunct(".") && c.peekAt(1).type() == TokenType.IDENT) {
			c.next();
			name.append('.').append(c.next().text());
		}
		return new TypeRef(name.toString(), 0, first.span());
	}

	private TypeRef parseJavaType(Cursor c) {
		TypeRef type = parseTypeName(c);
		skipTypeParameters(c);
		return parseTrailingDimensions(c, type);
	}

	private TypeRef parseTrailingDimensions(Cursor c, TypeRef type) {
		int dimensions = type.dimensions();
		while (c.peekIsPunct("[") && c.peekAt(1).is(TokenType.PUNCTUATION, "]")) {
			c.next();
			c.next();
			dimensions++;
		}
		return dimensions == type.dimensions() ? type : new TypeRef(type.name(), dimensions, type.span());
	}

	/**
	 * TypeScript annotation. {@code Array<T>} becomes {@code T[]}; for a union the first
	 * member that is not null or undefined wins.
	 */
	private TypeRef parseTypeScriptType(Cursor c) {
		TypeRef type = parseTypeScriptTypeMember(c);
		while (c.peekIsOperator("|")) {
			c.next();
			TypeRef alternative = parseTypeScriptTypeMember(c);
			if (type.name().equals("null") || type.name().equals("undefined")) {
				type = alternative;
			}
		}
		return type;
	}

	private TypeRef parseTypeScriptTypeMember(Cursor c) {
		TypeRef type = parseTypeName(c);
		if (c.peekIsOperator("<")) {
			if (type.name().equals("Array")) {
				c.next();
				TypeRef element = nested(c, () -> parseTypeScriptType(c));
				c.expectOperator(">");
				type = new TypeRef(element.name(), element.dimensions() + 1, type.span());
			} else {
				skipBalanced(c, "<", ">");
			}
		}
		return parseTrailingDimensions(c, type);
	}

	// ---------------------------------------------------------------- statements

	/**
	 * Parses one statement; a declaration with several declarators contributes several.
	 */
	private void parseStatementInto(Cursor c, List<Statement> out) {
		if (startsDeclaration(c)) {
			parseLocalDeclarationsInto(c, out);
			c.expectPunct(";");
			return;
		}
		out.add(parseStatement(c));
	}

	private Statement parseStatement(Cursor c) {
		return nested(c, () -> statement(c));
	}

	private Statement statement(Cursor c) {
		if (startsDeclaration(c)) {
			Token start = c.peek();
			List<Statement> declarations = new ArrayList<>();
			parseLocalDeclarationsInto(c, declarations);
			Token end = c.expectPunct(";");
			if (declarations.size() == 1) {
				return declarations.get(0);
			}
			return new Block(List.copyOf(declarations), start.span().to(end.span()));
		}

		Token t = c.peek();
		if (t.is(TokenType.PUNCTUATION, "{")) {
			return parseBlock(c);
		}
		if (t.is(TokenType.PUNCTUATION, ";")) {
			c.next();
			return new Block(List.of(), t.span());
		}
		if (t.type() == TokenType.IDENT) {
			switch (t.text()) {
				case "if":
					return parseIf(c);
				case "for":
					return parseFor(c);
				case "while":
					return parseWhile(c);
				case "do":
					return parseDoWhile(c);
				case "switch":
					return parseSwitch(c);
				case "break": {
					c.next();
					Token end = c.expectPunct(";");
					return new BreakStatement(t.span().to(end.span()));
				}
				case "continue": {
					c.next();
					Token end = c.expectPunct(";");
					return new ContinueStatement(t.span().to(end.span()));
				}
				case "return": {
					c.next();
					Expression value = c.peekIsPunct(";") ? null : parseExpression(c);
					Token end = c.expectPunct(";");
					return new ReturnStatement(value, t.span().to(end.span()));
				}
				case "class":
					return parseClass(c, List.of(), t);
				case "function":
					if (language == SourceLanguage.TYPESCRIPT) {
						return parseFunction(c);
					}
					break;
				case "else":
				case "case":
				case "default":
					throw new SyntaxException("Unexpected '" + t.text() + "'", t.span());
				default:
					break;
			}
		}

		Expression expr = parseExpression(c);
		Token end = c.expectPunct(";");
		return new ExpressionStatement(expr, expr.span().to(end.span()));
	}

	private MethodDeclaration parseFunction(Cursor c) {
		Token start = c.expectIdent("function");
		Token name = c.expect(TokenType.IDENT, "function name");
		skipTypeParameters(c);
		return parseMethodRest(c, name.text(), List.of(), null, start);
	}

	private Block parseBlock(Cursor c) {
		Token start = c.expectPunct("{");
		List<Statement> statements = new ArrayList<>();
		while (!c.peekIsPunct("}")) {
			if (c.isAtEnd()) {
				throw c.error("'}'");
			}
			parseStatementInto(c, statements);
		}
		Token end = c.expectPunct("}");
		return new Block(List.copyOf(statements), start.span().to(end.span()));
	}

	private IfStatement parseIf(Cursor c) {
		Token start = c.expectIdent("if");
		c.expectPunct("(");
		Expression condition = parseExpression(c);
		c.expectPunct(")");
		Statement thenBranch = parseStatement(c);
		Statement elseBranch = null;
		if (c.peekIsIdent("else")) {
			c.next();
			// else if: the else branch is itself an IfStatement
			elseBranch = parseStatement(c);
		}
		SourceSpan end = elseBranch != null ? elseBranch.span() : thenBranch.span();
		return new IfStatement(condition, thenBranch, elseBranch, start.span().to(end));
	}

	private Statement parseFor(Cursor c) {
		Token start = c.expectIdent("for");
		c.expectPunct("(");
		if (isForEachHeader(c)) {
			return parseForEachRest(c, start);
		}

		List<Statement> init = new ArrayList<>();
		if (!c.peekIsPunct(";")) {
			if (startsDeclaration(c)) {
				parseLocalDeclarationsInto(c, init);
			} else {
				for (Expression e : parseExpressionList(c)) {
					init.add(new ExpressionStatement(e, e.span()));
				}
			}
		}
		c.expectPunct(";");

		Expression condition = c.peekIsPunct(";") ? null : parseExpression(c);
		c.expectPunct(";");

		List<Expression> updates = c.peekIsPunct(")") ? List.of() : parseExpressionList(c);
		c.expectPunct(")");

		Statement body = parseStatement(c);
		return new ForStatement(List.copyOf(init), condition, List.copyOf(updates), body,
				start.span().to(body.span()));
	}

	/**
	 * Looks from just after {@code for (} to the matching {@code )} for a top-level
	 * {@code :} (Java) or {@code of}/{@code in} (TypeScript). Nested brackets are
	 * skipped and the scan stops at the first top-level {@code ;}.
	 */
	private boolean isForEachHeader(Cursor c) {
		int depth = 0;
		for (int offset = 0;; offset++) {
			Token t = c.peekAt(offset);
			if (t.type() == TokenType.EOF) {
				return false;
			}
			if (t.type() == TokenType.PUNCTUATION) {
				switch (t.text()) {
					case "(", "[", "{" -> depth++;
					case ")", "]", "}" -> {
						if (depth == 0) {
							return false;
						}
						depth--;
					}
					case ";" -> {
						if (depth == 0) {
							return false;
						}
					}
					default -> {
					}
				}
				continue;
			}
			if (depth != 0) {
				continue;
			}
			if (language == SourceLanguage.JAVA && t.is(TokenType.OPERATOR, ":")) {
				return true;
			}
			if (language == SourceLanguage.TYPESCRIPT && offset > 0
					&& (t.is(TokenType.IDENT, "of") || t.is(TokenType.IDENT, "in"))) {
				return true;
			}
		}
	}

	private EnhancedForStatement parseForEachRest(Cursor c, Token start) {
		TypeRef type;
		Token name;
		if (language == SourceLanguage.TYPESCRIPT) {
			if (c.peekIsIdent("let") || c.peekIsIdent("const") || c.peekIsIdent("var")) {
				c.next();
			}
			name = c.expect(TokenType.IDENT, "loop variable");
			type = null;
			if (c.peekIsOperator(":")) {
				c.next();
				type = parseTypeScriptType(c);
			}
			if (!c.peekIsIdent("of") && !c.peekIsIdent("in")) {
				throw c.error("'of'");
			}
			c.next();
		} else {
			parseModifiers(c);
			type = parseJavaType(c);
			name = c.expect(TokenType.IDENT, "loop variable");
			c.expectOperator(":");
		}
		Expression iterable = parseExpression(c);
		c.expectPunct(")");
		Statement body = parseStatement(c);
		return new EnhancedForStatement(name.text(), type, iterable, body, start.span().to(body.span()));
	}

	private WhileStatement parseWhile(Cursor c) {
		Token start = c.expectIdent("while");
		c.expectPunct("(");
		Expression condition = parseExpression(c);
		c.expectPunct(")");
		Statement body = parseStatement(c);
		return new WhileStatement(condition, body, start.span().to(body.span()));
	}

	private DoWhileStatement parseDoWhile(Cursor c) {
		Token start = c.expectIdent("do");
		Statement body = parseStatement(c);
		c.expectIdent("while");
		c.expectPunct("(");
		Expression condition = parseExpression(c);
		c.expectPunct(")");
		Token end = c.expectPunct(";");
		return new DoWhileStatement(body, condition, start.span().to(end.span()));
	}

	private SwitchStatement parseSwitch(Cursor c) {
		Token start = c.expectIdent("switch");
		c.expectPunct("(");
		Expression discriminant = parseExpression(c);
		c.expectPunct(")");
		c.expectPunct("{");

		List<SwitchCase> cases = new ArrayList<>();
		while (!c.peekIsPunct("}")) {
			Token labelTok = c.peek();
			Expression label;
			if (c.peekIsIdent("case")) {
				c.next();
				label = parseExpression(c);
			} else if (c.peekIsIdent("default")) {
				c.next();
				label = null;
			} else {
				throw c.error("'case', 'default' or '}'");
			}
			Token colon = c.expectOperator(":");

			List<Statement> body = new ArrayList<>();
			while (!c.peekIsIdent("case") && !c.peekIsIdent("default") && !c.peekIsPunct("}")) {
				if (c.isAtEnd()) {
					throw c.error("'}'");
				}
				parseStatementInto(c, body);
			}
			SourceSpan end = body.isEmpty() ? colon.span() : body.get(body.size() - 1).span();
			cases.add(new SwitchCase(label, List.copyOf(body), labelTok.span().to(end)));
		}
		Token end = c.expectPunct("}");
		return new SwitchStatement(discriminant, List.copyOf(cases), start.span().to(end.span()));
	}

	// ---------------------------------------------------------------- variable declarations

	private boolean startsDeclaration(Cursor c) {
		Token t = c.peek();
		if (language == SourceLanguage.JAVA && t.is(TokenType.PUNCTUATION, "@")) {
			return true;
		}
		if (t.type() != TokenType.IDENT) {
			return false;
		}
		if (language == SourceLanguage.TYPESCRIPT) {
			return t.text().equals("let") || t.text().equals("const") || t.text().equals("var");
		}
		if (MODIFIERS.contains(t.text())) {
			return true;
		}
		return looksLikeJavaDeclaration(c);
	}

	/**
	 * {@code Type name} followed by one of {@code = ; , :}. Restores the cursor.
	 */
	private boolean looksLikeJavaDeclaration(Cursor c) {
		if (RESERVED.contains(c.peek().text())) {
			return false;
		}
		int mark = c.mark();
		try {
			if (!skipJavaTypeIfPresent(c)) {
				return false;
			}
			if (c.peek().type() != TokenType.IDENT) {
				return false;
			}
			c.next();
			while (c.peekIsPunct("[") && c.peekAt(1).is(TokenType.PUNCTUATION, "]")) {
				c.next();
				c.next();
			}
			Token follower = c.peek();
			return follower.is(TokenType.OPERATOR, "=") || follower.is(TokenType.PUNCTUATION, ";")
					|| follower.is(TokenType.PUNCTUATION, ",") || follower.is(TokenType.OPERATOR, ":");
		} finally {
			c.reset(mark);
		}
	}

	/**
	 * {@code Type name (} with the cursor sitting on the type. Restores the cursor.
	 */
	private boolean looksLikeJavaMethod(Cursor c) {
		int mark = c.mark();
		try {
			skipTypeParameters(c);
			return skipJavaTypeIfPresent(c) && c.peek().type() == TokenType.IDENT
					&& c.peekAt(1).is(TokenType.PUNCTUATION, "(");
		} finally {
			c.reset(mark);
		}
	}

	private boolean skipJavaTypeIfPresent(Cursor c) {
		if (c.peek().type() != TokenType.IDENT) {
			return false;
		}
		c.next();
		while (c.peekIsPunct(".") && c.peekAt(1).type() == TokenType.IDENT) {
			c.next();
			c.next();
		}
		if (c.peekIsOperator("<")) {
			int depth = 0;
			do {
				Token t = c.next();
				if (t.is(TokenType.OPERATOR, "<")) {
					depth++;
				} else if (t.is(TokenType.OPERATOR, ">")) {
					depth--;
				} else if (t.type() != TokenType.IDENT && !t.is(TokenType.PUNCTUATION, ",")
						&& !t.is(TokenType.PUNCTUATION, ".") && !t.is(TokenType.OPERATOR, "?")
						&& !t.is(TokenType.PUNCTUATION, "[") && !t.is(TokenType.PUNCTUATION, "]")) {
					return false;
				}
			} while (depth > 0);
		}
		while (c.peekIsPunct("[") && c.peekAt(1).is(TokenType.PUNCTUATION, "]")) {
			c.next();
			c.next();
		}
		return true;
	}

	private void parseLocalDeclarationsInto(Cursor c, List<Statement> out) {
		Token start = c.peek();
		if (language == SourceLanguage.TYPESCRIPT) {
			String keyword = c.next().text();
			List<String> modifiers = keyword.equals("const") ? List.of("const") : List.of();
			while (true) {
				Token name = c.expect(TokenType.IDENT, "variable name");
				TypeRef type = null;
				if (c.peekIsOperator(":")) {
					c.next();
					type = parseTypeScriptType(c);
				}
				Expression init = null;
				if (c.peekIsOperator("=")) {
					c.next();
					init = parseExpression(c);
				}
				SourceSpan end = init != null ? init.span() : name.span();
				out.add(new VariableDeclaration(name.text(), type, modifiers, init, start.span().to(end)));
				if (!c.peekIsPunct(",")) {
					return;
				}
				c.next();
			}
		}

		List<String> modifiers = new ArrayList<>();
		skipAnnotations(c);
		modifiers.addAll(parseModifiers(c));
		TypeRef type = parseJavaType(c);
		Token name = c.expect(TokenType.IDENT, "variable name");
		parseDeclaratorsRest(c, type, modifiers, name, start, out);
	}

	/**
	 * Everything after the first declarator's name, up to but excluding the terminating {@code ;}.
	 */
	private void parseDeclaratorsRest(Cursor c, TypeRef type, List<String> modifiers, Token firstName, Token start,
			List<Statement> out) {
		Token name = firstName;
		while (true) {
			TypeRef declared = parseTrailingDimensions(c, type);
			Expression init = null;
			if (c.peekIsOperator("=")) {
				c.next();
				init = c.peekIsPunct("{") ? parseArrayInitializer(c) : parseExpression(c);
			}
			SourceSpan end = init != null ? init.span() : name.span();
			out.add(new VariableDeclaration(name.text(), declared, List.copyOf(modifiers), init,
					start.span().to(end)));
			if (!c.peekIsPunct(",")) {
				return;
			}
			c.next();
			name = c.expect(TokenType.IDENT, "variable name");
		}
	}

	private ArrayLiteral parseArrayInitializer(Cursor c) {
		Token start = c.expectPunct("{");
		List<Expression> elements = new ArrayList<>();
		while (!c.peekIsPunct("}")) {
			elements.add(c.peekIsPunct("{") ? nested(c, () -> parseArrayInitializer(c)) : parseExpression(c));
			if (!c.peekIsPunct(",")) {
				break;
			}
			c.next();
		}
		Token end = c.expectPunct("}");
		return new ArrayLiteral(List.copyOf(elements), start.span().to(end.span()));
	}

	// ---------------------------------------------------------------- expressions

	private List<Expression> parseExpressionList(Cursor c) {
		List<Expression> list = new ArrayList<>();
		list.add(parseExpression(c));
		while (c.peekIsPunct(",")) {
			c.next();
			list.add(parseExpression(c));
		}
		return list;
	}

	Expression parseExpression(Cursor c) {
		return nested(c, () -> parseAssignment(c));
	}

	private Expression parseAssignment(Cursor c) {
		Expression left = parseBinary(c, 0);
		Token t = c.peek();
		if (t.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(t.text())) {
			if (!isAssignable(left)) {
				throw new SyntaxException("Invalid assignment target", t.span());
			}
			c.next();
			// right associative: a = b = c
			Expression value = parseExpression(c);
			return new Assignment(left, t.text(), value, left.span().to(value.span()));
		}
		return left;
	}

	private Expression parseBinary(Cursor c, int level) {
		if (level == BINARY_LEVELS.size()) {
			return parseUnary(c);
		}
		Expression left = parseBinary(c, level + 1);
		while (c.peek().type() == TokenType.OPERATOR && BINARY_LEVELS.get(level).contains(c.peek().text())) {
			String op = c.next().text();
			Expression right = parseBinary(c, level + 1);
			left = new BinaryExpression(left, op, right, left.span().to(right.span()));
		}
		return left;
	}

	private Expression parseUnary(Cursor c) {
		Token t = c.peek();
		if (t.type() == TokenType.OPERATOR) {
			switch (t.text()) {
				case "!", "-", "+" -> {
					c.next();
					Expression operand = nested(c, () -> parseUnary(c));
					return new UnaryExpression(t.text(), operand, t.span().to(operand.span()));
				}
				case "++", "--" -> {
					c.next();
					Expression target = nested(c, () -> parseUnary(c));
					if (!isAssignable(target)) {
						throw new SyntaxException("Invalid operand for " + t.text(), t.span());
					}
					return new UpdateExpression(t.text(), target, true, t.span().to(target.span()));
				}
				default -> {
				}
			}
		}
		if (t.is(TokenType.PUNCTUATION, "(") && c.peekAt(1).type() == TokenType.IDENT
				&& CAST_TYPES.contains(c.peekAt(1).text()) && c.peekAt(2).is(TokenType.PUNCTUATION, ")")) {
			c.next();
			Token typeTok = c.next();
			c.next();
			Expression operand = nested(c, () -> parseUnary(c));
			return new Cast(new TypeRef(typeTok.text(), 0, typeTok.span()), operand, t.span().to(operand.span()));
		}
		return parsePostfix(c);
	}

	private Expression parsePostfix(Cursor c) {
		Expression expr = parsePrimary(c);
		while (true) {
			Token t = c.peek();
			if (t.is(TokenType.PUNCTUATION, ".")) {
				c.next();
				Token name = c.expect(TokenType.IDENT, "member name");
				if (c.peekIsPunct("(")) {
					List<Expression> args = parseArguments(c);
					expr = new MethodCall(expr, name.text(), args, expr.span().to(c.previous().span()));
				} else {
					expr = new MemberAccess(expr, name.text(), expr.span().to(name.span()));
				}
				continue;
			}
			if (t.is(TokenType.PUNCTUATION, "(")) {
				if (!(expr instanceof Identifier callee)) {
					throw new SyntaxException("Unexpected '('", t.span());
				}
				List<Expression> args = parseArguments(c);
				expr = new MethodCall(null, callee.name(), args, expr.span().to(c.previous().span()));
				continue;
			}
			if (t.is(TokenType.PUNCTUATION, "[")) {
				c.next();
				Expression index = parseExpression(c);
				Token end = c.expectPunct("]");
				expr = new ArrayAccess(expr, index, expr.span().to(end.span()));
				continue;
			}
			if (t.is(TokenType.OPERATOR, "++") || t.is(TokenType.OPERATOR, "--")) {
				if (!isAssignable(expr)) {
					throw new SyntaxException("Invalid operand for " + t.text(), t.span());
				}
				c.next();
				expr = new UpdateExpression(t.text(), expr, false, expr.span().to(t.span()));
				continue;
			}
			return expr;
		}
	}

	private List<Expression> parseArguments(Cursor c) {
		c.expectPunct("(");
		if (c.peekIsPunct(")")) {
			c.next();
			return List.of();
		}
		List<Expression> args = parseExpressionList(c);
		c.expectPunct(")");
		return List.copyOf(args);
	}

	private Expression parsePrimary(Cursor c) {
		Token t = c.peek();
		switch (t.type()) {
			case NUMBER -> {
				c.next();
				LiteralKind kind = t.text().contains(".") ? LiteralKind.REAL : LiteralKind.INTEGER;
				return new Literal(kind, t.text(), t.span());
			}
			case STRING -> {
				c.next();
				return new Literal(LiteralKind.STRING, t.text(), t.span());
			}
			case CHAR -> {
				c.next();
				if (language == SourceLanguage.TYPESCRIPT) {
					return new Literal(LiteralKind.STRING, toDoubleQuoted(t.text()), t.span());
				}
				return new Literal(LiteralKind.CHAR, t.text(), t.span());
			}
			case IDENT -> {
				return parseIdentifierPrimary(c);
			}
			case PUNCTUATION -> {
				if (t.text().equals("(")) {
					c.next();
					Expression inner = parseExpression(c);
					c.expectPunct(")");
					return inner;
				}
				if (t.text().equals("[") && language == SourceLanguage.TYPESCRIPT) {
					c.next();
					List<Expression> elements = c.peekIsPunct("]") ? List.of() : parseExpressionList(c);
					Token end = c.expectPunct("]");
					return new ArrayLiteral(List.copyOf(elements), t.span().to(end.span()));
				}
			}
			default -> {
			}
		}
		throw new SyntaxException(t.type() == TokenType.EOF ? "Unexpected end of input"
				: "Unexpected '" + t.text() + "'", t.span());
	}

	private Expression parseIdentifierPrimary(Cursor c) {
		Token t = c.next();
		switch (t.text()) {
			case "true", "false" -> {
				return new Literal(LiteralKind.BOOLEAN, t.text(), t.span());
			}
			case "null", "undefined" -> {
				return new Literal(LiteralKind.NULL, t.text(), t.span());
			}
			case "new" -> {
				return parseNewRest(c, t);
			}
			default -> {
				return new Identifier(t.text(), t.span());
			}
		}
	}

	private Expression parseNewRest(Cursor c, Token start) {
		TypeRef type = parseTypeName(c);
		if (c.peekIsOperator("<")) {
			skipBalanced(c, "<", ">");
		}
		if (c.peekIsPunct("[")) {
			List<Expression> dimensions = new ArrayList<>();
			int depth = 0;
			Token last = c.peek();
			while (c.peekIsPunct("[")) {
				c.next();
				depth++;
				if (!c.peekIsPunct("]")) {
					dimensions.add(parseExpression(c));
				}
				last = c.expectPunct("]");
			}
			ArrayLiteral initializer = c.peekIsPunct("{") ? parseArrayInitializer(c) : null;
			SourceSpan end = initializer != null ? initializer.span() : last.span();
			TypeRef elementType = new TypeRef(type.name(), depth, type.span());
			return new NewArray(elementType, List.copyOf(dimensions), initializer, start.span().to(end));
		}
		List<Expression> args = parseArguments(c);
		if (c.peekIsPunct("{")) {
			throw new SyntaxException("Anonymous classes are not supported", c.peek().span());
		}
		return new NewObject(type, args, start.span().to(c.previous().span()));
	}

	private static <T> T nested(Cursor c, Supplier<T> body) {
		c.enter();
		try {
			return body.get();
		} finally {
			c.leave();
		}
	}

	private static boolean isAssignable(Expression e) {
		return e instanceof Identifier || e instanceof MemberAccess || e instanceof ArrayAccess;
	}

	private static String toDoubleQuoted(String singleQuoted) {
		String inner = singleQuoted.substring(1, singleQuoted.length() - 1)
				.replace("\\'", "'")
				.replace("\"", "\\\"");
		return "\"" + inner + "\"";
	}

	private static final class Cursor {
		private final List<Token> tokens;
		private int pos;
		private int nesting;

		Cursor(List<Token> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == TokenType.EOF;
		}

		Token peek() {
			return tokens.get(pos);
		}

		Token peekAt(int offset) {
			return tokens.get(Math.min(pos + offset, tokens.size() - 1));
		}

		Token previous() {
			return tokens.get(Math.max(0, pos - 1));
		}

		Token next() {
			Token t = tokens.get(pos);
			if (t.type() != TokenType.EOF) {
				pos++;
			}
			return t;
		}

		void enter() {
			if (nesting >= MAX_NESTING) {
				throw new RecursionLimitExceededException("Source nested deeper than " + MAX_NESTING + " levels",
						peek().span());
			}
			nesting++;
		}

		void leave() {
			nesting--;
		}

		int mark() {
			return pos;
		}

		void reset(int mark) {
			pos = mark;
		}

		boolean peekIsIdent(String text) {
			return peek().is(TokenType.IDENT, text);
		}

		boolean peekIsPunct(String text) {
			return peek().is(TokenType.PUNCTUATION, text);
		}

		boolean peekIsOperator(String text) {
			return peek().is(TokenType.OPERATOR, text);
		}

		Token expectIdent(String text) {
			return expectExact(TokenType.IDENT, text);
		}

		Token expectPunct(String text) {
			return expectExact(TokenType.PUNCTUATION, text);
		}

		Token expectOperator(String text) {
			return expectExact(TokenType.OPERATOR, text);
		}

		private Token expectExact(TokenType type, String text) {
			if (!peek().is(type, text)) {
				throw error("'" + text + "'");
			}
			return next();
		}

		Token expect(TokenType type, String what) {
			if (peek().type() != type) {
				throw error(what);
			}
			return next();
		}

		SyntaxException error(String expected) {
			Token t = peek();
			String found = t.type() == TokenType.EOF ? "end of input" : "'" + t.text() + "'";
			return new SyntaxException("Expected " + expected + " but found " + found, t.span());
		}
	}
}
