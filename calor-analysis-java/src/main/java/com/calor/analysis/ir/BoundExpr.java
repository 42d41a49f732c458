package com.calor.analysis.ir;

import java.util.List;

/**
 * Bound expression tree. Call-like nodes carry the signature they resolve to and a span.
 *
 * <p>Signatures follow {@code Namespace.Type::Method(ParamTypes)}. A call whose signature names
 * a function of the module being compiled is an internal call; any other signature is looked up
 * in the effect catalog.
 */
public interface BoundExpr {

    record Literal(String text, String typeName) implements BoundExpr {}

    record VariableRef(String name) implements BoundExpr {
        /** Name under which instance members refer to their receiver. */
        public static final String SELF = "this";
    }

    record Unary(String operator, BoundExpr operand) implements BoundExpr {}

    record Binary(String operator, BoundExpr left, BoundExpr right) implements BoundExpr {}

    record Call(String signature, List<BoundExpr> arguments, SourceSpan span) implements BoundExpr {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    record Await(BoundExpr operand) implements BoundExpr {}

    /** Reading a property runs its getter, {@code Type::get_Name()}. */
    record PropertyGet(BoundExpr receiver, String typeName, String property, SourceSpan span) implements BoundExpr {
        public String accessorSignature() {
            return typeName + "::get_" + property + "()";
        }
    }

    /** {@code new Type(args)}, which runs {@code Type::.ctor(ArgTypes)}. */
    record ObjectCreation(String typeName, List<String> argumentTypes, List<BoundExpr> arguments, SourceSpan span)
            implements BoundExpr {
        public ObjectCreation {
            argumentTypes = List.copyOf(argumentTypes);
            arguments = List.copyOf(arguments);
        }

        public String constructorSignature() {
            return typeName + "::.ctor(" + String.join(",", argumentTypes) + ")";
        }
    }

    record FieldAccess(BoundExpr receiver, String field) implements BoundExpr {}

    /** Lambda bodies belong to the enclosing function for effect purposes. */
    record Lambda(List<String> parameters, List<BoundStatement> body) implements BoundExpr {
        public Lambda {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }
}
