package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ZBuilder {
	private ZBuilder() {}

	public static ZIdentifier id(String name) {
		return new ZIdentifier(SourceLocation.unknown(), name);
	}

	public static List<ZIdentifier> ids(String... names) {
		List<ZIdentifier> result = new ArrayList<>();
		for(String name : names) {
			result.add(id(name));
		}
		return result;
	}

	public static ZNumber num(int value) {
		return new ZNumber(SourceLocation.unknown(), Integer.toString(value));
	}

	public static ZNumber num(String value) {
		return new ZNumber(SourceLocation.unknown(), value);
	}

	// operators

	public static ZBinOp binop(ZOperator operator, ZExpression lhs, ZExpression rhs) {
		return new ZBinOp(SourceLocation.unknown(), operator.getCanonicalSpelling(), operator, lhs, rhs, false);
	}

	public static ZBinOp binopBreak(ZOperator operator, ZExpression lhs, ZExpression rhs) {
		return new ZBinOp(SourceLocation.unknown(), operator.getCanonicalSpelling(), operator, lhs, rhs, true);
	}

	public static ZBinOp and(ZExpression lhs, ZExpression rhs) {
		return binop(ZOperator.AND, lhs, rhs);
	}

	public static ZBinOp or(ZExpression lhs, ZExpression rhs) {
		return binop(ZOperator.OR, lhs, rhs);
	}

	public static ZBinOp implies(ZExpression lhs, ZExpression rhs) {
		return binop(ZOperator.IMPLIES, lhs, rhs);
	}

	public static ZBinOp iff(ZExpression lhs, ZExpression rhs) {
		return binop(ZOperator.IFF, lhs, rhs);
	}

	public static ZUnary unary(ZOperator operator, ZExpression operand) {
		return new ZUnary(SourceLocation.unknown(), operator.getCanonicalSpelling(), operator, operand);
	}

	public static ZUnary not(ZExpression operand) {
		return unary(ZOperator.NOT, operand);
	}

	public static ZRelationChain chain(ZExpression first, Object... operatorsAndOperands) {
		List<ZExpression> operands = new ArrayList<>();
		List<String> surfaces = new ArrayList<>();
		List<ZOperator> operators = new ArrayList<>();
		operands.add(first);
		for(int i = 0; i < operatorsAndOperands.length; i += 2) {
			ZOperator op = (ZOperator) operatorsAndOperands[i];
			operators.add(op);
			surfaces.add(op.getCanonicalSpelling());
			operands.add((ZExpression) operatorsAndOperands[i + 1]);
		}
		return new ZRelationChain(SourceLocation.unknown(), operands, surfaces, operators);
	}

	// binders

	public static ZBindingGroup bind(ZExpression domain, String... names) {
		return new ZBindingGroup(SourceLocation.unknown(), ids(names), domain);
	}

	public static List<ZBindingGroup> bindings(ZBindingGroup... groups) {
		return Arrays.asList(groups);
	}

	public static ZQuantifier quantifier(ZQuantifier.Kind kind, List<ZBindingGroup> bindings, ZExpression predicate,
	                                     ZExpression result) {
		return new ZQuantifier(SourceLocation.unknown(), kind, bindings, ";", predicate, result);
	}

	public static ZQuantifier forall(List<ZBindingGroup> bindings, ZExpression predicate) {
		return quantifier(ZQuantifier.Kind.FORALL, bindings, predicate, null);
	}

	public static ZQuantifier exists(List<ZBindingGroup> bindings, ZExpression predicate) {
		return quantifier(ZQuantifier.Kind.EXISTS, bindings, predicate, null);
	}

	public static ZQuantifier lambda(List<ZBindingGroup> bindings, ZExpression body) {
		return quantifier(ZQuantifier.Kind.LAMBDA, bindings, null, body);
	}

	public static ZQuantifier mu(List<ZBindingGroup> bindings, ZExpression predicate, ZExpression result) {
		return quantifier(ZQuantifier.Kind.MU, bindings, predicate, result);
	}

	public static ZSetComprehension comprehension(List<ZBindingGroup> bindings, ZExpression predicate,
	                                              ZExpression result) {
		return new ZSetComprehension(SourceLocation.unknown(), bindings, predicate, result);
	}

	// constructors

	public static ZSetLiteral set(ZExpression... elements) {
		return new ZSetLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZSequenceLiteral seq(ZExpression... elements) {
		return new ZSequenceLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZBagLiteral bag(ZExpression... elements) {
		return new ZBagLiteral(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZTuple tuple(ZExpression... elements) {
		return new ZTuple(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ZRange range(ZExpression from, ZExpression to) {
		return new ZRange(SourceLocation.unknown(), from, to);
	}

	public static ZConditional conditional(ZExpression condition, ZExpression thenBranch, ZExpression elseBranch) {
		return new ZConditional(SourceLocation.unknown(), condition, thenBranch, elseBranch);
	}

	public static ZParenthesized parens(ZExpression inner) {
		return new ZParenthesized(SourceLocation.unknown(), inner);
	}

	// postfix forms

	public static ZFunctionCall call(ZExpression target, ZExpression... arguments) {
		return new ZFunctionCall(SourceLocation.unknown(), target, Arrays.asList(arguments));
	}

	public static ZApplication apply(ZExpression function, ZExpression argument) {
		return new ZApplication(SourceLocation.unknown(), function, argument);
	}

	public static ZProjection project(ZExpression target, String field) {
		return new ZProjection(SourceLocation.unknown(), target, field);
	}

	public static ZGenericInstantiation instantiate(ZExpression base, ZExpression... parameters) {
		return new ZGenericInstantiation(SourceLocation.unknown(), base, Arrays.asList(parameters));
	}

	public static ZRelationalImage image(ZExpression relation, ZExpression set) {
		return new ZRelationalImage(SourceLocation.unknown(), relation, set);
	}

	public static ZSuperscript sup(ZExpression base, ZExpression exponent) {
		return new ZSuperscript(SourceLocation.unknown(), base, exponent);
	}

	public static ZSubscript sub(ZExpression base, ZExpression index) {
		return new ZSubscript(SourceLocation.unknown(), base, index);
	}

	// document items

	public static ZDocument document(ZDocumentItem... items) {
		return new ZDocument(SourceLocation.unknown(), Arrays.asList(items), null, null, null);
	}

	public static ZDisplayExpression display(ZExpression expression) {
		return new ZDisplayExpression(SourceLocation.unknown(), expression);
	}

	public static ZGivenType given(String... names) {
		return new ZGivenType(SourceLocation.unknown(), Arrays.asList(names));
	}

	public static ZFreeTypeBranch branch(String constructor, ZExpression parameter) {
		return new ZFreeTypeBranch(SourceLocation.unknown(), constructor, parameter);
	}

	public static ZFreeType freeType(String name, ZFreeTypeBranch... branches) {
		return new ZFreeType(SourceLocation.unknown(), name, Arrays.asList(branches));
	}

	public static ZAbbreviation abbreviation(String name, List<String> genericParameters, ZExpression body) {
		return new ZAbbreviation(SourceLocation.unknown(), name, genericParameters, body);
	}

	public static ZDeclaration decl(ZExpression type, String... names) {
		return new ZDeclaration(SourceLocation.unknown(), ids(names), type);
	}

	public static List<ZDeclaration> decls(ZDeclaration... declarations) {
		return Arrays.asList(declarations);
	}

	@SafeVarargs
	public static List<List<ZExpression>> groups(List<ZExpression> first, List<ZExpression>... rest) {
		List<List<ZExpression>> result = new ArrayList<>();
		result.add(first);
		result.addAll(Arrays.asList(rest));
		return result;
	}

	public static List<ZExpression> exprs(ZExpression... expressions) {
		return Arrays.asList(expressions);
	}

	public static ZBoxedBlock axdef(List<ZDeclaration> declarations, List<List<ZExpression>> predicateGroups) {
		return new ZBoxedBlock(SourceLocation.unknown(), ZBoxedBlock.Kind.AXDEF, null, Collections.emptyList(),
				declarations, predicateGroups);
	}

	public static ZBoxedBlock schema(String name, List<ZDeclaration> declarations,
	                                 List<List<ZExpression>> predicateGroups) {
		return new ZBoxedBlock(SourceLocation.unknown(), ZBoxedBlock.Kind.SCHEMA, name, Collections.emptyList(),
				declarations, predicateGroups);
	}

	public static ZEquivStep step(ZOperator connective, ZExpression expression, String justification) {
		return new ZEquivStep(SourceLocation.unknown(), connective, expression, justification);
	}

	public static ZProofNode proofNode(ZExpression expression, String justification, ZProofStep... children) {
		return new ZProofNode(SourceLocation.unknown(), expression, justification, null, false, false,
				Arrays.asList(children));
	}

	public static ZProofNode sibling(ZExpression expression, String justification, ZProofStep... children) {
		return new ZProofNode(SourceLocation.unknown(), expression, justification, null, false, true,
				Arrays.asList(children));
	}

	public static ZProofNode assumption(int label, ZExpression expression, String justification,
	                                    ZProofStep... children) {
		return new ZProofNode(SourceLocation.unknown(), expression, justification, label, true, false,
				Arrays.asList(children));
	}

	public static ZProofCase proofCase(ZExpression name, ZProofStep... children) {
		return new ZProofCase(SourceLocation.unknown(), name, Arrays.asList(children));
	}

	public static ZProofTree proof(ZProofNode root) {
		return new ZProofTree(SourceLocation.unknown(), root);
	}
}
