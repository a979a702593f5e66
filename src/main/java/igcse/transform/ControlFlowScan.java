package igcse.transform;

import igcse.ast.ArrayAccess;
import igcse.ast.ArrayLiteral;
import igcse.ast.Assignment;
import igcse.ast.BinaryExpression;
import igcse.ast.Block;
import igcse.ast.Cast;
import igcse.ast.ClassDeclaration;
import igcse.ast.DoWhileStatement;
import igcse.ast.EnhancedForStatement;
import igcse.ast.ExpressionStatement;
import igcse.ast.ForStatement;
import igcse.ast.Identifier;
import igcse.ast.IfStatement;
import igcse.ast.MemberAccess;
import igcse.ast.MethodCall;
import igcse.ast.MethodDeclaration;
import igcse.ast.NewArray;
import igcse.ast.NewObject;
import igcse.ast.Node;
import igcse.ast.Program;
import igcse.ast.ReturnStatement;
import igcse.ast.Statement;
import igcse.ast.SwitchCase;
import igcse.ast.SwitchStatement;
import igcse.ast.UnaryExpression;
import igcse.ast.UpdateExpression;
import igcse.ast.VariableDeclaration;
import igcse.ast.WhileStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only queries over statement trees used to plan loop lowering.
 */
final class ControlFlowScan {
	private ControlFlowScan() {
	}

	/**
	 * Whether {@code s} can execute a {@code break} that leaves the enclosing loop.
	 * Nested loops and switches own their breaks.
	 */
	static boolean mayBreak(Statement s) {
		return switch (s.kind()) {
			case BREAK_STATEMENT -> true;
			case BLOCK -> ((Block) s).statements().stream().anyMatch(ControlFlowScan::mayBreak);
			case IF_STATEMENT -> {
				IfStatement i = (IfStatement) s;
				yield mayBreak(i.thenBranch()) || (i.elseBranch() != null && mayBreak(i.elseBranch()));
			}
			default -> false;
		};
	}

	/**
	 * Whether {@code s} can execute a {@code continue} of the enclosing loop.
	 * Unlike breaks, continues pass through switches.
	 */
	static boolean mayContinue(Statement s) {
		return switch (s.kind()) {
			case CONTINUE_STATEMENT -> true;
			case BLOCK -> ((Block) s).statements().stream().anyMatch(ControlFlowScan::mayContinue);
			case IF_STATEMENT -> {
				IfStatement i = (IfStatement) s;
				yield mayContinue(i.thenBranch()) || (i.elseBranch() != null && mayContinue(i.elseBranch()));
			}
			case SWITCH_STATEMENT -> ((SwitchStatement) s).cases().stream()
					.flatMap(c -> c.body().stream())
					.anyMatch(ControlFlowScan::mayContinue);
			default -> false;
		};
	}

	/**
	 * Whether anything under {@code node} assigns to or increments the variable {@code name}.
	 */
	static boolean writes(Node node, String name) {
		if (node instanceof Assignment a && isName(a.target(), name)) {
			return true;
		}
		if (node instanceof UpdateExpression u && isName(u.target(), name)) {
			return true;
		}
		for (Node child : children(node)) {
			if (writes(child, name)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isName(Node target, String name) {
		return target instanceof Identifier id && id.name().equals(name);
	}

	static List<Node> children(Node node) {
		List<Node> out = new ArrayList<>();
		switch (node.kind()) {
			case PROGRAM -> out.addAll(((Program) node).body());
			case CLASS_DECLARATION -> out.addAll(((ClassDeclaration) node).members());
			case METHOD_DECLARATION -> out.add(((MethodDeclaration) node).body());
			case VARIABLE_DECLARATION -> addIfPresent(out, ((VariableDeclaration) node).initializer());
			case BLOCK -> out.addAll(((Block) node).statements());
			case EXPRESSION_STATEMENT -> out.add(((ExpressionStatement) node).expression());
			case IF_STATEMENT -> {
				IfStatement i = (IfStatement) node;
				out.add(i.condition());
				out.add(i.thenBranch());
				addIfPresent(out, i.elseBranch());
			}
			case FOR_STATEMENT -> {
				ForStatement f = (ForStatement) node;
				out.addAll(f.init());
				addIfPresent(out, f.condition());
				out.addAll(f.updates());
				out.add(f.body());
			}
			case ENHANCED_FOR_STATEMENT -> {
				EnhancedForStatement f = (EnhancedForStatement) node;
				out.add(f.iterable());
				out.add(f.body());
			}
			case WHILE_STATEMENT -> {
				WhileStatement w = (WhileStatement) node;
				out.add(w.condition());
				out.add(w.body());
			}
			case DO_WHILE_STATEMENT -> {
				DoWhileStatement d = (DoWhileStatement) node;
				out.add(d.body());
				out.add(d.condition());
			}
			case SWITCH_STATEMENT -> {
				SwitchStatement s = (SwitchStatement) node;
				out.add(s.discriminant());
				out.addAll(s.cases());
			}
			case SWITCH_CASE -> {
				SwitchCase c = (SwitchCase) node;
				addIfPresent(out, c.label());
				out.addAll(c.body());
			}
			case RETURN_STATEMENT -> addIfPresent(out, ((ReturnStatement) node).value());
			case ASSIGNMENT -> {
				Assignment a = (Assignment) node;
				out.add(a.target());
				out.add(a.value());
			}
			case BINARY_EXPRESSION -> {
				BinaryExpression b = (BinaryExpression) node;
				out.add(b.left());
				out.add(b.right());
			}
			case UNARY_EXPRESSION -> out.add(((UnaryExpression) node).operand());
			case UPDATE_EXPRESSION -> out.add(((UpdateExpression) node).target());
			case METHOD_CALL -> {
				MethodCall m = (MethodCall) node;
				addIfPresent(out, m.receiver());
				out.addAll(m.arguments());
			}
			case MEMBER_ACCESS -> out.add(((MemberAccess) node).target());
			case ARRAY_ACCESS -> {
				ArrayAccess a = (ArrayAccess) node;
				out.add(a.array());
				out.add(a.index());
			}
			case NEW_OBJECT -> out.addAll(((NewObject) node).arguments());
			case NEW_ARRAY -> {
				NewArray n = (NewArray) node;
				out.addAll(n.dimensions());
				addIfPresent(out, n.initializer());
			}
			case ARRAY_LITERAL -> out.addAll(((ArrayLiteral) node).elements());
			case CAST -> out.add(((Cast) node).operand());
			case BREAK_STATEMENT, CONTINUE_STATEMENT, LITERAL, IDENTIFIER -> {
			}
		}
		return out;
	}

	private static void addIfPresent(List<Node> out, Node node) {
		if (node != null) {
			out.add(node);
		}
	}
}
