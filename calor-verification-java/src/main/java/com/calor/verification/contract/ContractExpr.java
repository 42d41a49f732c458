package com.calor.verification.contract;

import java.util.List;

/**
 * Bound contract expression tree, as handed over by the binder.
 * Only the shapes the hasher and the solver translation understand are modelled;
 * anything else arrives as {@link Opaque}.
 */
public interface ContractExpr {

    record IntLiteral(long value) implements ContractExpr {}

    record BoolLiteral(boolean value) implements ContractExpr {}

    record FloatLiteral(double value) implements ContractExpr {}

    record StringLiteral(String value) implements ContractExpr {}

    /** Reference to a parameter, the result value or a quantifier-bound variable. */
    record Reference(String name) implements ContractExpr {}

    record Binary(BinaryOperator operator, ContractExpr left, ContractExpr right) implements ContractExpr {}

    record Unary(UnaryOperator operator, ContractExpr operand) implements ContractExpr {}

    record Forall(List<Parameter> boundVariables, ContractExpr body) implements ContractExpr {
        public Forall {
            boundVariables = List.copyOf(boundVariables);
        }
    }

    record Exists(List<Parameter> boundVariables, ContractExpr body) implements ContractExpr {
        public Exists {
            boundVariables = List.copyOf(boundVariables);
        }
    }

    record Implies(ContractExpr antecedent, ContractExpr consequent) implements ContractExpr {}

    record Conditional(ContractExpr condition, ContractExpr whenTrue, ContractExpr whenFalse) implements ContractExpr {}

    record ArrayAccess(ContractExpr array, ContractExpr index) implements ContractExpr {}

    record ArrayLength(ContractExpr array) implements ContractExpr {}

    /** A node the verification layer has no encoding for; {@code nodeType} names it. */
    record Opaque(String nodeType) implements ContractExpr {}
}
