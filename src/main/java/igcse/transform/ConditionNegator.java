package igcse.transform;

import igcse.ast.BinaryExpression;
import igcse.ast.Expression;
import igcse.ast.Literal;
import igcse.ast.LiteralKind;
import igcse.ast.MethodCall;
import igcse.ast.UnaryExpression;

/**
 * Logical negation written out algebraically, for {@code REPEAT ... UNTIL}.
 *
 * Comparisons flip, AND/OR follow De Morgan, {@code NOT x} loses its NOT and
 * boolean literals swap. Anything else is wrapped in {@code NOT}.
 */
final class ConditionNegator {
	private ConditionNegator() {
	}

	static Rendered negate(Expression e, ExpressionTranslator t, ConversionContext ctx) {
		if (e instanceof BinaryExpression b) {
			switch (b.operator()) {
				case "&&":
					return ExpressionTranslator.compose(negate(b.left(), t, ctx.descend()), "OR",
							negate(b.right(), t, ctx.descend()));
				case "||":
					return ExpressionTranslator.compose(negate(b.left(), t, ctx.descend()), "AND",
							negate(b.right(), t, ctx.descend()));
				default:
					String op = OperatorTable.spell(b.operator(), false, false);
					String flipped = OperatorTable.negatedComparison(op);
					if (flipped != null) {
						return ExpressionTranslator.compose(t.renderPrec(b.left(), ctx), flipped,
								t.renderPrec(b.right(), ctx));
					}
					break;
			}
		}
		if (e instanceof UnaryExpression u && u.operator().equals("!")) {
			return t.renderPrec(u.operand(), ctx);
		}
		if (e instanceof Literal l && l.literalKind() == LiteralKind.BOOLEAN) {
			return Rendered.atom(l.text().equals("true") ? "FALSE" : "TRUE");
		}
		if (e instanceof MethodCall call && call.name().equals("equals") && call.receiver() != null
				&& call.arguments().size() == 1) {
			return ExpressionTranslator.compose(t.renderPrec(call.receiver(), ctx), "<>",
					t.renderPrec(call.arguments().get(0), ctx));
		}
		Rendered whole = t.renderPrec(e, ctx);
		return new Rendered("NOT " + whole.within(OperatorTable.UNARY), OperatorTable.UNARY);
	}
}
