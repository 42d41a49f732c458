package com.calor.analysis.ir;

import java.util.List;

/**
 * Bound statements. {@link If}, {@link While}, {@link Break} and {@link Continue} are structured
 * control flow and never appear inside a basic block; every other statement does.
 */
public interface BoundStatement {

    SourceSpan span();

    /** Declares or reassigns a local variable. */
    record Bind(String variable, BoundExpr value, SourceSpan span) implements BoundStatement {}

    record FieldAssign(BoundExpr target, String field, BoundExpr value, SourceSpan span) implements BoundStatement {}

    /** Assigning a property runs its setter, {@code Type::set_Name()}. */
    record PropertySet(BoundExpr receiver, String typeName, String property, BoundExpr value, SourceSpan span)
            implements BoundStatement {
        public String accessorSignature() {
            return typeName + "::set_" + property + "()";
        }
    }

    record ExpressionStatement(BoundExpr expression, SourceSpan span) implements BoundStatement {}

    /** Console output. */
    record Print(BoundExpr value, SourceSpan span) implements BoundStatement {}

    record Throw(BoundExpr value, SourceSpan span) implements BoundStatement {}

    /** {@code value} is null for a function without a result. */
    record Return(BoundExpr value, SourceSpan span) implements BoundStatement {}

    record If(BoundExpr condition, List<BoundStatement> thenBody, List<BoundStatement> elseBody, SourceSpan span)
            implements BoundStatement {
        public If {
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }
    }

    record While(BoundExpr condition, List<BoundStatement> body, SourceSpan span) implements BoundStatement {
        public While {
            body = List.copyOf(body);
        }
    }

    record Break(SourceSpan span) implements BoundStatement {}

    record Continue(SourceSpan span) implements BoundStatement {}
}
