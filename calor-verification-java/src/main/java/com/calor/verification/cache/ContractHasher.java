package com.calor.verification.cache;

import com.calor.verification.contract.ContractExpr;
import com.calor.verification.contract.ContractExpr.*;
import com.calor.verification.contract.ContractKind;
import com.calor.verification.contract.Parameter;
import com.calor.verification.solver.ContractQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives cache keys from contracts.
 *
 * The key is the SHA-256 of a canonical S-expression string:
 * <pre>
 *   PRE:{name:type,...}::{expr}
 *   POST:{name:type,...}:{outputType|void}:PRECS:{pre;}*::POST:{expr}
 * </pre>
 * Literals are typed and printed exactly (doubles with round-trip precision, strings escaped).
 * No algebraic normalization is applied, so {@code a + b} and {@code b + a} hash differently.
 */
public class ContractHasher {

    public String hashPrecondition(List<Parameter> parameters, ContractExpr precondition) {
        return sha256Hex(canonicalPrecondition(parameters, precondition));
    }

    public String hashPostcondition(
            List<Parameter> parameters,
            String outputType,
            List<ContractExpr> preconditions,
            ContractExpr postcondition) {
        return sha256Hex(canonicalPostcondition(parameters, outputType, preconditions, postcondition));
    }

    /** Key for a solver query; postcondition queries hash their assumptions as preconditions. */
    public String hash(ContractQuery query) {
        if (query.kind() == ContractKind.PRE) {
            return hashPrecondition(query.parameters(), query.goal());
        }
        return hashPostcondition(query.parameters(), query.outputType(), query.assumptions(), query.goal());
    }

    public String canonicalPrecondition(List<Parameter> parameters, ContractExpr precondition) {
        StringBuilder sb = new StringBuilder("PRE:");
        appendParameters(sb, parameters);
        sb.append("::");
        appendExpression(sb, precondition);
        return sb.toString();
    }

    public String canonicalPostcondition(
            List<Parameter> parameters,
            String outputType,
            List<ContractExpr> preconditions,
            ContractExpr postcondition) {
        StringBuilder sb = new StringBuilder("POST:");
        appendParameters(sb, parameters);
        sb.append(':').append(outputType != null ? outputType : "void");
        sb.append(":PRECS:");
        for (ContractExpr pre : preconditions) {
            appendExpression(sb, pre);
            sb.append(';');
        }
        sb.append("::POST:");
        appendExpression(sb, postcondition);
        return sb.toString();
    }

    public String canonicalExpression(ContractExpr expr) {
        StringBuilder sb = new StringBuilder();
        appendExpression(sb, expr);
        return sb.toString();
    }

    private static void appendParameters(StringBuilder sb, List<Parameter> parameters) {
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(',');
            Parameter p = parameters.get(i);
            sb.append(p.name()).append(':').append(p.typeName());
        }
    }

    private static void appendExpression(StringBuilder sb, ContractExpr expr) {
        if (expr instanceof IntLiteral lit) {
            sb.append("INT:").append(lit.value());
        } else if (expr instanceof BoolLiteral lit) {
            sb.append("BOOL:").append(lit.value() ? "true" : "false");
        } else if (expr instanceof FloatLiteral lit) {
            sb.append("FLOAT:").append(Double.toString(lit.value()));
        } else if (expr instanceof StringLiteral lit) {
            sb.append("STR:\"");
            appendEscaped(sb, lit.value());
            sb.append('"');
        } else if (expr instanceof Reference ref) {
            sb.append("REF:").append(ref.name());
        } else if (expr instanceof Binary bin) {
            sb.append('(').append(bin.operator().symbol()).append(' ');
            appendExpression(sb, bin.left());
            sb.append(' ');
            appendExpression(sb, bin.right());
            sb.append(')');
        } else if (expr instanceof Unary un) {
            sb.append('(').append(un.operator().symbol()).append(' ');
            appendExpression(sb, un.operand());
            sb.append(')');
        } else if (expr instanceof Forall q) {
            appendQuantifier(sb, "FORALL", q.boundVariables(), q.body());
        } else if (expr instanceof Exists q) {
            appendQuantifier(sb, "EXISTS", q.boundVariables(), q.body());
        } else if (expr instanceof Implies impl) {
            sb.append("(-> ");
            appendExpression(sb, impl.antecedent());
            sb.append(' ');
            appendExpression(sb, impl.consequent());
            sb.append(')');
        } else if (expr instanceof Conditional cond) {
            sb.append("(ITE ");
            appendExpression(sb, cond.condition());
            sb.append(' ');
            appendExpression(sb, cond.whenTrue());
            sb.append(' ');
            appendExpression(sb, cond.whenFalse());
            sb.append(')');
        } else if (expr instanceof ArrayAccess access) {
            sb.append("(IDX ");
            appendExpression(sb, access.array());
            sb.append(' ');
            appendExpression(sb, access.index());
            sb.append(')');
        } else if (expr instanceof ArrayLength len) {
            sb.append("(LEN ");
            appendExpression(sb, len.array());
            sb.append(')');
        } else if (expr instanceof Opaque opaque) {
            sb.append("UNSUPPORTED:").append(opaque.nodeType());
        } else {
            throw new IllegalArgumentException("Unhandled contract expression: " + expr);
        }
    }

    private static void appendQuantifier(StringBuilder sb, String tag, List<Parameter> bound, ContractExpr body) {
        sb.append('(').append(tag).append(" (");
        for (Parameter bv : bound) {
            sb.append('(').append(bv.name()).append(' ').append(bv.typeName()).append(')');
        }
        sb.append(") ");
        appendExpression(sb, body);
        sb.append(')');
    }

    private static void appendEscaped(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
    }

    static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }
}
