package igcse.transform;

import igcse.Severity;
import igcse.UnsupportedConstructException;
import igcse.WarningCode;
import igcse.ast.ArrayLiteral;
import igcse.ast.Assignment;
import igcse.ast.Block;
import igcse.ast.BreakStatement;
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
import igcse.ast.MethodCall;
import igcse.ast.MethodDeclaration;
import igcse.ast.NewArray;
import igcse.ast.NewObject;
import igcse.ast.Node;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lowers an AST to indented IGCSE pseudocode lines.
 *
 * Every node passes through {@link RecursionGuard} before its kind is dispatched.
 * Indentation is decided here; the formatter only checks it.
 */
public final class ConversionEngine {
	private static final Logger LOG = LoggerFactory.getLogger(ConversionEngine.class);

	private static final String ARROW = " ← ";

	private final ExpressionTranslator expressions = new ExpressionTranslator();

	public List<String> convert(Node node, ConversionContext ctx) {
		return RecursionGuard.visit(node, ctx, inner -> dispatch(node, inner));
	}

	private List<String> dispatch(Node node, ConversionContext ctx) {
		return switch (node.kind()) {
			case PROGRAM -> program((Program) node, ctx);
			case CLASS_DECLARATION -> classDeclaration((ClassDeclaration) node, ctx);
			case METHOD_DECLARATION -> method((MethodDeclaration) node, ctx);
			case VARIABLE_DECLARATION -> variable((VariableDeclaration) node, ctx);
			case BLOCK -> statements(((Block) node).statements(), ctx);
			case EXPRESSION_STATEMENT -> effect(((ExpressionStatement) node).expression(), ctx);
			case IF_STATEMENT -> ifStatement((IfStatement) node, ctx);
			case FOR_STATEMENT -> forStatement((ForStatement) node, ctx);
			case ENHANCED_FOR_STATEMENT -> forEach((EnhancedForStatement) node, ctx);
			case WHILE_STATEMENT -> whileStatement((WhileStatement) node, ctx);
			case DO_WHILE_STATEMENT -> doWhile((DoWhileStatement) node, ctx);
			case SWITCH_STATEMENT -> switchStatement((SwitchStatement) node, ctx);
			case SWITCH_CASE -> statements(((SwitchCase) node).body(), ctx.withSwitch());
			case BREAK_STATEMENT -> breakStatement((BreakStatement) node, ctx);
			case CONTINUE_STATEMENT -> continueStatement((ContinueStatement) node, ctx);
			case RETURN_STATEMENT -> returnStatement((ReturnStatement) node, ctx);
			default -> List.of(ctx.line(expressions.translate((Expression) node, ctx).text()));
		};
	}

	// ---------------------------------------------------------------- statement lists

	/**
	 * Lowers a statement list. An unsupported statement becomes a placeholder comment
	 * unless strict mode is on. Inside a loop with sentinels, everything after a
	 * statement that may break or continue runs only while the sentinel is clear.
	 */
	List<String> statements(List<? extends Statement> list, ConversionContext ctx) {
		List<String> lines = new ArrayList<>();
		for (int i = 0; i < list.size(); i++) {
			Statement s = list.get(i);
			lines.addAll(statement(s, ctx));

			String guard = remainderGuard(s, ctx);
			if (guard != null && i + 1 < list.size()) {
				lines.add(ctx.line("IF " + guard + " THEN"));
				lines.addAll(statements(list.subList(i + 1, list.size()), ctx.indented()));
				lines.add(ctx.line("ENDIF"));
				break;
			}
		}
		return lines;
	}

	private List<String> statement(Statement s, ConversionContext ctx) {
		Map<String, Scope.Symbol> declared = ctx.scope().snapshot();
		try {
			return convert(s, ctx);
		} catch (UnsupportedConstructException e) {
			if (ctx.options().strictMode()) {
				throw e;
			}
			// the statement's DECLARE lines are discarded with it
			ctx.scope().restore(declared);
			LOG.debug("Replacing unsupported {} at line {}: {}", s.kind(), e.line(), e.getMessage());
			ctx.diagnostics().warn(WarningCode.UNSUPPORTED_CONSTRUCT, e.getMessage(), Severity.WARNING,
					e.hasPosition() ? e.line() : s.span().line());
			return List.of(ctx.line("// unsupported: " + e.getMessage()));
		}
	}

	private static String remainderGuard(Statement s, ConversionContext ctx) {
		LoopFrame frame = ctx.loop();
		if (frame == null) {
			return null;
		}
		List<String> flags = new ArrayList<>();
		if (frame.hasExit() && !ctx.inSwitch() && ControlFlowScan.mayBreak(s)) {
			flags.add("NOT " + frame.exitFlag());
		}
		if (frame.hasSkip() && ControlFlowScan.mayContinue(s)) {
			flags.add("NOT " + frame.skipFlag());
		}
		return flags.isEmpty() ? null : String.join(" AND ", flags);
	}

	/**
	 * Body of a compound statement, one level deeper than {@code ctx}.
	 */
	private List<String> body(Statement s, ConversionContext ctx) {
		ConversionContext inner = ctx.indented();
		if (s instanceof Block) {
			return convert(s, inner);
		}
		return statements(List.of(s), inner);
	}

	// ---------------------------------------------------------------- declarations

	private List<String> program(Program program, ConversionContext ctx) {
		registerFunctions(program.body(), ctx);
		return statements(program.body(), ctx);
	}

	private List<String> classDeclaration(ClassDeclaration c, ConversionContext ctx) {
		ctx.feature("class");
		ConversionContext classCtx = ctx.withScope(ctx.scope().child());
		registerFunctions(c.members(), classCtx);

		List<String> lines = new ArrayList<>();
		if (ctx.options().includeComments()) {
			lines.add(ctx.line("// class " + c.name()));
			if (c.superclass() != null) {
				lines.add(ctx.line("// inherits from " + c.superclass()));
			}
			if (!c.interfaces().isEmpty()) {
				lines.add(ctx.line("// implements " + String.join(", ", c.interfaces())));
			}
		}
		lines.addAll(statements(c.members(), classCtx));
		return lines;
	}

	/**
	 * Declares the return types of the functions in {@code members} so calls made
	 * before the definition still infer their type.
	 */
	private void registerFunctions(List<Statement> members, ConversionContext ctx) {
		for (Statement s : members) {
			if (s instanceof MethodDeclaration m && m.returnType() != null && !m.returnType().isVoid()) {
				String type = TypeTable.lookup(m.returnType().name(), ctx.options().customMappings());
				if (type != null) {
					ctx.scope().declare(m.name(), type, m.returnType().dimensions());
				}
			}
		}
	}

	private static boolean isMain(MethodDeclaration m) {
		return m.name().equals("main") && m.hasModifier("static") && m.returnType() != null
				&& m.returnType().isVoid() && m.parameters().size() == 1;
	}

	private List<String> method(MethodDeclaration m, ConversionContext ctx) {
		ConversionContext methodCtx = ctx.withScope(ctx.scope().child());
		List<String> lines = new ArrayList<>();

		if (isMain(m)) {
			if (ctx.options().includeComments()) {
				lines.add(ctx.line("// main program"));
			}
			lines.addAll(statements(m.body().statements(), methodCtx));
			return lines;
		}

		List<String> params = new ArrayList<>();
		for (Parameter p : m.parameters()) {
			Scope.Symbol type = declaredType(p.type(), p.name(), null, p.span(), methodCtx);
			methodCtx.scope().declare(p.name(), type.type(), type.dimensions());
			params.add(p.name() + " : " + typeName(type));
		}

		// the body goes first so an untyped TypeScript return can be inferred from its locals
		List<String> body = statements(m.body().statements(), methodCtx.indented());

		Scope.Symbol returns = returnType(m, methodCtx);
		if (ctx.options().includeComments() && m.hasModifier("static")) {
			lines.add(ctx.line("// static"));
		}
		String signature = m.name() + "(" + String.join(", ", params) + ")";
		if (returns != null) {
			ctx.feature("function");
			lines.add(ctx.line("FUNCTION " + signature + " RETURNS " + typeName(returns)));
			lines.addAll(body);
			lines.add(ctx.line("ENDFUNCTION"));
		} else {
			ctx.feature("procedure");
			lines.add(ctx.line("PROCEDURE " + signature));
			lines.addAll(body);
			lines.add(ctx.line("ENDPROCEDURE"));
		}
		return lines;
	}

	/**
	 * @return null for a procedure
	 */
	private Scope.Symbol returnType(MethodDeclaration m, ConversionContext ctx) {
		TypeRef declared = m.returnType();
		if (declared != null) {
			return declared.isVoid() ? null : declaredType(declared, m.name(), null, m.span(), ctx);
		}
		ReturnStatement valued = firstValuedReturn(m.body());
		if (valued == null) {
			return null;
		}
		String inferred = expressions.inferType(valued.value(), ctx);
		if (inferred == null) {
			return new Scope.Symbol(unknownType("return type of " + m.name(), m.span(), ctx), 0);
		}
		return new Scope.Symbol(inferred, 0);
	}

	private static ReturnStatement firstValuedReturn(Node node) {
		if (node instanceof ReturnStatement r && r.value() != null) {
			return r;
		}
		for (Node child : ControlFlowScan.children(node)) {
			// nested declarations return for themselves
			if (child instanceof ClassDeclaration || child instanceof MethodDeclaration) {
				continue;
			}
			if (child instanceof Statement || child instanceof SwitchCase) {
				ReturnStatement found = firstValuedReturn(child);
				if (found != null) {
					return found;
				}
			}
		}
		return null;
	}

	private static String typeName(Scope.Symbol type) {
		return type.dimensions() > 0 ? "ARRAY OF " + type.type() : type.type();
	}

	// ---------------------------------------------------------------- variables

	private List<String> variable(VariableDeclaration v, ConversionContext ctx) {
		Expression init = v.initializer();
		if (opensInputStream(v)) {
			String type = v.type() != null && !TypeTable.INFERRED.contains(v.type().name())
					? v.type().name()
					: ((NewObject) init).type().name();
			ctx.warn(WarningCode.INPUT_STREAM_DROPPED,
					type + " " + v.name() + " dropped; its reads become INPUT statements", Severity.INFO, v.span());
			return List.of();
		}

		Scope.Symbol type = declaredType(v.type(), v.name(), init, v.span(), ctx);
		ctx.scope().declare(v.name(), type.type(), type.dimensions());

		if (type.dimensions() > 0) {
			return arrayDeclaration(v, type, ctx);
		}
		if (isConstant(v)) {
			ctx.feature("constant");
			return List.of(ctx.line("CONSTANT " + v.name() + " = " + expressions.render(init, ctx)));
		}

		List<String> lines = new ArrayList<>();
		lines.add(ctx.line("DECLARE " + v.name() + " : " + type.type()));
		if (init != null) {
			lines.addAll(assignValue(v.name(), init, ctx));
		}
		return lines;
	}

	private static boolean opensInputStream(VariableDeclaration v) {
		if (v.type() != null && TypeTable.INPUT_STREAM_TYPES.contains(v.type().name())) {
			return true;
		}
		return v.initializer() instanceof NewObject n && TypeTable.INPUT_STREAM_TYPES.contains(n.type().name());
	}

	private static boolean isConstant(VariableDeclaration v) {
		Expression init = v.initializer();
		if (init == null || BuiltinCalls.readIn(init) != null) {
			return false;
		}
		if (v.hasModifier("const")) {
			return isLiteral(init);
		}
		return v.hasModifier("final") || v.hasModifier("static");
	}

	private static boolean isLiteral(Expression e) {
		if (e instanceof UnaryExpression u && (u.operator().equals("-") || u.operator().equals("+"))) {
			return u.operand() instanceof Literal;
		}
		return e instanceof Literal;
	}

	/**
	 * The declared type, or the type of the initializer when there is no usable annotation.
	 */
	private Scope.Symbol declaredType(TypeRef declared, String name, Expression init, SourceSpan span,
			ConversionContext ctx) {
		if (declared != null && !TypeTable.INFERRED.contains(declared.name())) {
			String base = TypeTable.lookup(declared.name(), ctx.options().customMappings());
			if (base == null) {
				base = unknownType(declared.name(), span, ctx);
			} else if (declared.name().equals("number") && init != null && allIntegers(init)) {
				base = TypeTable.INTEGER;
			}
			return new Scope.Symbol(base, declared.dimensions());
		}

		if (init instanceof NewArray array) {
			return declaredType(array.elementType(), name, array.initializer(), span, ctx);
		}
		if (init instanceof ArrayLiteral literal) {
			int dimensions = 0;
			Expression leaf = literal;
			while (leaf instanceof ArrayLiteral nested) {
				dimensions++;
				leaf = nested.elements().isEmpty() ? null : nested.elements().get(0);
			}
			String base = leaf == null ? null : expressions.inferType(leaf, ctx);
			if (TypeTable.REAL.equals(base) && allIntegers(literal)) {
				base = TypeTable.INTEGER;
			}
			return new Scope.Symbol(base != null ? base : unknownType("elements of " + name, span, ctx), dimensions);
		}
		if (init != null) {
			String inferred = BuiltinCalls.readIn(init) != null ? BuiltinCalls.readType(init)
					: expressions.inferType(init, ctx);
			if (inferred != null) {
				return new Scope.Symbol(inferred, 0);
			}
		}
		return new Scope.Symbol(unknownType(declared != null ? declared.name() + " " + name : name, span, ctx), 0);
	}

	private static String unknownType(String what, SourceSpan span, ConversionContext ctx) {
		String message = "No IGCSE type for " + what + "; using STRING";
		if (ctx.options().strictMode()) {
			throw new UnsupportedConstructException("No IGCSE type for " + what, span);
		}
		ctx.warn(WarningCode.UNKNOWN_TYPE, message, Severity.WARNING, span);
		return TypeTable.STRING;
	}

	private static boolean allIntegers(Expression e) {
		if (e instanceof ArrayLiteral literal) {
			return !literal.elements().isEmpty() && literal.elements().stream().allMatch(ConversionEngine::allIntegers);
		}
		if (e instanceof NewArray array) {
			return array.initializer() != null && allIntegers(array.initializer());
		}
		return ExpressionTranslator.intValue(e) != null
				|| (e instanceof Literal l && l.literalKind() == LiteralKind.INTEGER);
	}

	/**
	 * {@code ARRAY[0:n-1] OF T}; literal contents become one assignment per element.
	 */
	private List<String> arrayDeclaration(VariableDeclaration v, Scope.Symbol type, ConversionContext ctx) {
		ctx.feature("array");
		Expression init = v.initializer();
		ArrayLiteral literal = init instanceof ArrayLiteral a ? a
				: init instanceof NewArray n ? n.initializer() : null;

		List<String> bounds = new ArrayList<>();
		if (literal != null) {
			Expression level = literal;
			while (level instanceof ArrayLiteral nested && !nested.elements().isEmpty()) {
				bounds.add("0:" + (nested.elements().size() - 1));
				level = nested.elements().get(0);
			}
		} else if (init instanceof NewArray n) {
			for (Expression dimension : n.dimensions()) {
				bounds.add("0:" + expressions.plus(dimension, -1, ctx).text());
			}
		}

		List<String> lines = new ArrayList<>();
		if (bounds.isEmpty()) {
			ctx.warn(WarningCode.APPROXIMATION, "Size of array " + v.name() + " is not known", Severity.WARNING,
					v.span());
			lines.add(ctx.line("DECLARE " + v.name() + " : ARRAY OF " + type.type()));
		} else {
			lines.add(ctx.line("DECLARE " + v.name() + " : ARRAY[" + String.join(", ", bounds) + "] OF "
					+ type.type()));
		}

		if (literal != null) {
			elementAssignments(v.name(), literal, new ArrayList<>(), lines, ctx);
		} else if (init != null && !(init instanceof NewArray)) {
			lines.addAll(assignValue(v.name(), init, ctx));
		}
		return lines;
	}

	private void elementAssignments(String name, ArrayLiteral literal, List<Integer> prefix, List<String> lines,
			ConversionContext ctx) {
		for (int i = 0; i < literal.elements().size(); i++) {
			Expression element = literal.elements().get(i);
			List<Integer> index = new ArrayList<>(prefix);
			index.add(i);
			if (element instanceof ArrayLiteral nested) {
				elementAssignments(name, nested, index, lines, ctx);
				continue;
			}
			List<String> parts = new ArrayList<>();
			for (Integer n : index) {
				parts.add(String.valueOf(n));
			}
			lines.add(ctx.line(name + "[" + String.join(", ", parts) + "]" + ARROW + expressions.render(element, ctx)));
		}
	}

	/**
	 * {@code target ← value}, or {@code INPUT target} when the value is a console read.
	 */
	private List<String> assignValue(String target, Expression value, ConversionContext ctx) {
		MethodCall read = BuiltinCalls.readIn(value);
		if (read == null) {
			return List.of(ctx.line(target + ARROW + expressions.render(value, ctx)));
		}
		ctx.feature("input");
		List<String> lines = new ArrayList<>();
		if (read.name().equals("prompt") && !read.arguments().isEmpty()) {
			ctx.feature("output");
			lines.add(ctx.line("OUTPUT " + expressions.render(read.arguments().get(0), ctx)));
		}
		lines.add(ctx.line("INPUT " + target));
		return lines;
	}

	// ---------------------------------------------------------------- simple statements

	/**
	 * An expression used as a statement.
	 */
	private List<String> effect(Expression e, ConversionContext ctx) {
		switch (e.kind()) {
			case ASSIGNMENT:
				return assignment((Assignment) e, ctx);
			case UPDATE_EXPRESSION: {
				UpdateExpression u = (UpdateExpression) e;
				String target = expressions.render(u.target(), ctx);
				return List.of(ctx.line(target + ARROW + target + (u.isIncrement() ? " + 1" : " - 1")));
			}
			case METHOD_CALL:
				return callStatement((MethodCall) e, ctx);
			default:
				throw new UnsupportedConstructException("expression statement without effect", e.span());
		}
	}

	private List<String> assignment(Assignment a, ConversionContext ctx) {
		String target = expressions.render(a.target(), ctx);
		if (!a.isCompound()) {
			return assignValue(target, a.value(), ctx);
		}
		String op = a.operator().substring(0, a.operator().length() - 1);
		boolean text = op.equals("+") && (expressions.isText(a.target(), ctx) || expressions.isText(a.value(), ctx));
		String pseudo = OperatorTable.spell(op, text, ctx.options().forceIntegerDivision());
		Rendered value = ExpressionTranslator.compose(Rendered.atom(target), pseudo,
				expressions.renderPrec(a.value(), ctx));
		return List.of(ctx.line(target + ARROW + value.text()));
	}

	private List<String> callStatement(MethodCall call, ConversionContext ctx) {
		if (BuiltinCalls.isOutput(call)) {
			ctx.feature("output");
			if (call.name().equals("printf")) {
				ctx.warn(WarningCode.APPROXIMATION, "printf format string is output as plain text", Severity.WARNING,
						call.span());
			}
			List<String> items = call.arguments().isEmpty() ? List.of("\"\"")
					: expressions.outputItems(call.arguments(), ctx);
			return List.of(ctx.line("OUTPUT " + String.join(", ", items)));
		}
		if (BuiltinCalls.isRead(call)) {
			ctx.warn(WarningCode.INPUT_STREAM_DROPPED, "Read whose value is unused dropped", Severity.INFO,
					call.span());
			return List.of();
		}
		Rendered mapped = ctx.options().customMappings().isEmpty() ? null : BuiltinCalls.translate(call, expressions, ctx);
		if (mapped != null) {
			return List.of(ctx.line("CALL " + mapped.text()));
		}
		return List.of(ctx.line("CALL " + expressions.callee(call, ctx) + "("
				+ expressions.arguments(call.arguments(), ctx) + ")"));
	}

	private List<String> returnStatement(ReturnStatement r, ConversionContext ctx) {
		if (r.value() == null) {
			return List.of(ctx.line("RETURN"));
		}
		return List.of(ctx.line("RETURN " + expressions.render(r.value(), ctx)));
	}

	private static List<String> breakStatement(BreakStatement b, ConversionContext ctx) {
		if (ctx.inSwitch()) {
			ctx.warn(WarningCode.SWITCH_BREAK_DROPPED, "break before the end of a case body dropped",
					Severity.WARNING, b.span());
			return List.of();
		}
		LoopFrame frame = ctx.loop();
		if (frame == null || !frame.hasExit()) {
			throw new UnsupportedConstructException("break outside a loop", b.span());
		}
		return List.of(ctx.line(frame.exitFlag() + ARROW + "TRUE"));
	}

	private static List<String> continueStatement(ContinueStatement c, ConversionContext ctx) {
		LoopFrame frame = ctx.loop();
		if (frame == null || !frame.hasSkip()) {
			throw new UnsupportedConstructException("continue outside a loop", c.span());
		}
		return List.of(ctx.line(frame.skipFlag() + ARROW + "TRUE"));
	}

	// ---------------------------------------------------------------- selection

	/**
	 * Else-if chains are flattened so the whole chain closes with a single ENDIF.
	 */
	private List<String> ifStatement(IfStatement s, ConversionContext ctx) {
		ctx.feature("if");
		List<String> lines = new ArrayList<>();
		lines.add(ctx.line("IF " + expressions.render(s.condition(), ctx) + " THEN"));
		lines.addAll(body(s.thenBranch(), ctx));

		Statement elseBranch = s.elseBranch();
		while (elseBranch instanceof IfStatement elseIf) {
			lines.add(ctx.line("ELSE IF " + expressions.render(elseIf.condition(), ctx) + " THEN"));
			lines.addAll(body(elseIf.thenBranch(), ctx));
			elseBranch = elseIf.elseBranch();
		}
		if (elseBranch != null) {
			lines.add(ctx.line("ELSE"));
			lines.addAll(body(elseBranch, ctx));
		}
		lines.add(ctx.line("ENDIF"));
		return lines;
	}

	private record CaseGroup(List<Expression> labels, boolean isDefault, List<Statement> body) {
	}

	private List<String> switchStatement(SwitchStatement s, ConversionContext ctx) {
		ctx.feature("case");
		List<CaseGroup> groups = new ArrayList<>();
		CaseGroup otherwise = null;

		List<Expression> pending = new ArrayList<>();
		boolean pendingDefault = false;
		List<SwitchCase> cases = s.cases();
		for (int i = 0; i < cases.size(); i++) {
			SwitchCase c = cases.get(i);
			if (c.isDefault()) {
				pendingDefault = true;
			} else {
				pending.add(c.label());
			}
			boolean last = i == cases.size() - 1;
			if (c.body().isEmpty() && !last) {
				continue;
			}
			if (!last && !endsWithJump(c.body())) {
				ctx.warn(WarningCode.APPROXIMATION, "Fall-through into the next case is not represented",
						Severity.WARNING, c.span());
			}
			CaseGroup group = new CaseGroup(List.copyOf(pending), pendingDefault, c.body());
			if (pendingDefault) {
				otherwise = group;
			} else {
				groups.add(group);
			}
			pending.clear();
			pendingDefault = false;
		}
		if (otherwise != null) {
			// OTHERWISE must come last
			groups.add(otherwise);
		}

		ConversionContext caseCtx = ctx.withSwitch();
		ConversionContext labelCtx = caseCtx.indented();
		List<String> lines = new ArrayList<>();
		lines.add(ctx.line("CASE OF " + expressions.render(s.discriminant(), ctx)));
		for (CaseGroup group : groups) {
			String label;
			if (group.isDefault()) {
				label = "OTHERWISE";
			} else {
				List<String> parts = new ArrayList<>();
				for (Expression e : group.labels()) {
					parts.add(expressions.render(e, labelCtx));
				}
				label = String.join(", ", parts);
			}

			List<String> body = statements(withoutTrailingBreak(group.body()), caseCtx.indented(2));
			if (body.size() == 1) {
				lines.add(labelCtx.line(label + " : " + body.get(0).strip()));
			} else {
				lines.add(labelCtx.line(label + " :"));
				lines.addAll(body);
			}
		}
		lines.add(ctx.line("ENDCASE"));
		return lines;
	}

	private static boolean endsWithJump(List<Statement> body) {
		if (body.isEmpty()) {
			return false;
		}
		Statement last = body.get(body.size() - 1);
		if (last instanceof Block b) {
			return endsWithJump(b.statements());
		}
		return last instanceof BreakStatement || last instanceof ReturnStatement
				|| last instanceof ContinueStatement;
	}

	private static List<Statement> withoutTrailingBreak(List<Statement> body) {
		if (!body.isEmpty() && body.get(body.size() - 1) instanceof BreakStatement) {
			return body.subList(0, body.size() - 1);
		}
		if (body.size() == 1 && body.get(0) instanceof Block b) {
			return withoutTrailingBreak(b.statements());
		}
		return body;
	}

	// ---------------------------------------------------------------- loops

	private LoopFrame enterLoop(Statement body, ConversionContext ctx) {
		return LoopFrame.enter(ctx.loop(), ControlFlowScan.mayBreak(body), ControlFlowScan.mayContinue(body));
	}

	/**
	 * Declarations and resets of the loop sentinels, emitted before the loop header.
	 */
	private static List<String> sentinels(LoopFrame frame, ConversionContext ctx) {
		List<String> lines = new ArrayList<>();
		for (String flag : new String[] {frame.exitFlag(), frame.skipFlag()}) {
			if (flag != null && !ctx.scope().isDeclaredHere(flag)) {
				ctx.scope().declare(flag, TypeTable.BOOLEAN, 0);
				lines.add(ctx.line("DECLARE " + flag + " : " + TypeTable.BOOLEAN));
			}
		}
		if (frame.hasExit()) {
			lines.add(ctx.line(frame.exitFlag() + ARROW + "FALSE"));
		}
		return lines;
	}

	/**
	 * Loop body one level below {@code ctx}. Counted loops cannot test the exit flag in
	 * their header, so with {@code guardExit} the body is skipped once it is set.
	 */
	private List<String> loopBody(Statement body, LoopFrame frame, boolean guardExit, ConversionContext ctx) {
		ConversionContext inner = ctx.withLoop(frame);
		List<String> lines = new ArrayList<>();
		if (guardExit && frame.hasExit()) {
			lines.add(inner.indented().line("IF NOT " + frame.exitFlag() + " THEN"));
			inner = inner.indented();
		}
		if (frame.hasSkip()) {
			lines.add(inner.indented().line(frame.skipFlag() + ARROW + "FALSE"));
		}
		lines.addAll(body(body, inner));
		if (guardExit && frame.hasExit()) {
			lines.add(ctx.indented().line("ENDIF"));
		}
		return lines;
	}

	private Rendered withExit(Rendered condition, LoopFrame frame) {
		if (!frame.hasExit()) {
			return condition;
		}
		return ExpressionTranslator.compose(condition, "AND",
				new Rendered("NOT " + frame.exitFlag(), OperatorTable.UNARY));
	}

	private List<String> whileStatement(WhileStatement w, ConversionContext ctx) {
		ctx.feature("while");
		LoopFrame frame = enterLoop(w.body(), ctx);
		List<String> lines = sentinels(frame, ctx);
		Rendered condition = withExit(expressions.renderPrec(w.condition(), ctx), frame);
		lines.add(ctx.line("WHILE " + condition.text() + " DO"));
		lines.addAll(loopBody(w.body(), frame, false, ctx));
		lines.add(ctx.line("ENDWHILE"));
		return lines;
	}

	/**
	 * {@code do ... while (c)} repeats until {@code c} is false.
	 */
	private List<String> doWhile(DoWhileStatement d, ConversionContext ctx) {
		ctx.feature("repeat");
		LoopFrame frame = enterLoop(d.body(), ctx);
		List<String> lines = sentinels(frame, ctx);
		lines.add(ctx.line("REPEAT"));
		lines.addAll(loopBody(d.body(), frame, false, ctx));
		Rendered until = expressions.negate(d.condition(), ctx);
		if (frame.hasExit()) {
			until = ExpressionTranslator.compose(until, "OR", Rendered.atom(frame.exitFlag()));
		}
		lines.add(ctx.line("UNTIL " + until.text()));
		return lines;
	}

	private List<String> forStatement(ForStatement f, ConversionContext ctx) {
		ForLoopBounds.CountingLoop counting = ForLoopBounds.analyze(f);
		if (counting == null) {
			return forAsWhile(f, ctx);
		}
		ctx.feature("for");
		String variable = counting.variable();
		if (ctx.scope().lookup(variable) == null) {
			ctx.scope().declare(variable, TypeTable.INTEGER, 0);
		}

		StringBuilder header = new StringBuilder("FOR ").append(variable).append(ARROW)
				.append(expressions.render(counting.start(), ctx))
				.append(" TO ")
				.append(expressions.plus(counting.bound(), counting.boundShift(), ctx).text());
		String step = step(counting, ctx);
		if (step != null) {
			header.append(" STEP ").append(step);
		}

		LoopFrame frame = enterLoop(f.body(), ctx);
		List<String> lines = sentinels(frame, ctx);
		lines.add(ctx.line(header.toString()));
		lines.addAll(loopBody(f.body(), frame, true, ctx));
		lines.add(ctx.line("NEXT " + variable));
		return lines;
	}

	/**
	 * @return the STEP operand, or null for a step of +1
	 */
	private String step(ForLoopBounds.CountingLoop loop, ConversionContext ctx) {
		if (loop.step() == null) {
			return loop.descending() ? "-1" : null;
		}
		Integer value = ExpressionTranslator.intValue(loop.step());
		if (value != null) {
			int magnitude = Math.abs(value);
			if (!loop.descending() && magnitude == 1) {
				return null;
			}
			return String.valueOf(loop.descending() ? -magnitude : magnitude);
		}
		Rendered size = expressions.renderPrec(loop.step(), ctx);
		return loop.descending() ? "-" + size.within(OperatorTable.ATOM) : size.text();
	}

	/**
	 * {@code for (init; cond; update) body} as init, then a WHILE loop whose body ends with the update.
	 */
	private List<String> forAsWhile(ForStatement f, ConversionContext ctx) {
		ctx.feature("while");
		ctx.warn(WarningCode.FOR_LOOP_REWRITTEN, "for loop is not a simple counting loop; rewritten as WHILE",
				Severity.WARNING, f.span());

		List<String> lines = new ArrayList<>(statements(f.init(), ctx));
		LoopFrame frame = enterLoop(f.body(), ctx);
		lines.addAll(sentinels(frame, ctx));

		Rendered condition = f.condition() == null ? Rendered.atom("TRUE") : expressions.renderPrec(f.condition(), ctx);
		lines.add(ctx.line("WHILE " + withExit(condition, frame).text() + " DO"));
		lines.addAll(loopBody(f.body(), frame, false, ctx));

		ConversionContext updateCtx = ctx.indented();
		List<String> updates = new ArrayList<>();
		for (Expression update : f.updates()) {
			updates.addAll(effect(update, frame.hasExit() ? updateCtx.indented() : updateCtx));
		}
		if (frame.hasExit() && !updates.isEmpty()) {
			lines.add(updateCtx.line("IF NOT " + frame.exitFlag() + " THEN"));
			lines.addAll(updates);
			lines.add(updateCtx.line("ENDIF"));
		} else {
			lines.addAll(updates);
		}
		lines.add(ctx.line("ENDWHILE"));
		return lines;
	}

	private List<String> forEach(EnhancedForStatement f, ConversionContext ctx) {
		ctx.feature("for-each");
		Scope.Symbol element = elementType(f, ctx);
		ctx.scope().declare(f.variable(), element.type(), element.dimensions());

		LoopFrame frame = enterLoop(f.body(), ctx);
		List<String> lines = sentinels(frame, ctx);
		lines.add(ctx.line("FOR EACH " + f.variable() + " IN " + expressions.render(f.iterable(), ctx)));
		lines.addAll(loopBody(f.body(), frame, true, ctx));
		lines.add(ctx.line("NEXT " + f.variable()));
		return lines;
	}

	private Scope.Symbol elementType(EnhancedForStatement f, ConversionContext ctx) {
		TypeRef declared = f.variableType();
		if (declared != null && !TypeTable.INFERRED.contains(declared.name())) {
			return declaredType(declared, f.variable(), null, f.span(), ctx);
		}
		if (f.iterable() instanceof Identifier id) {
			Scope.Symbol collection = ctx.scope().lookup(id.name());
			if (collection != null && collection.dimensions() > 0) {
				return new Scope.Symbol(collection.type(), collection.dimensions() - 1);
			}
			if (collection != null && collection.type().equals(TypeTable.STRING)) {
				return new Scope.Symbol(TypeTable.CHAR, 0);
			}
		}
		return new Scope.Symbol(unknownType("loop variable " + f.variable(), f.span(), ctx), 0);
	}
}
