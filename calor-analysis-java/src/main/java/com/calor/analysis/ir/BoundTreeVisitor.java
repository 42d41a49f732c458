package com.calor.analysis.ir;

import com.calor.analysis.ir.BoundExpr.*;
import com.calor.analysis.ir.BoundStatement.*;

import java.util.List;

/**
 * Depth-first walker over bound statements and expressions.
 *
 * Override the {@code visit} methods of interest. Returning {@code false} skips the node's
 * children; {@code endVisit} is called after the children of a lambda, the only node that
 * opens a scope.
 */
public abstract class BoundTreeVisitor {

    public boolean visit(Bind node)                { return true; }
    public boolean visit(FieldAssign node)         { return true; }
    public boolean visit(PropertySet node)         { return true; }
    public boolean visit(ExpressionStatement node) { return true; }
    public boolean visit(Print node)               { return true; }
    public boolean visit(Throw node)               { return true; }
    public boolean visit(Return node)              { return true; }
    public boolean visit(If node)                  { return true; }
    public boolean visit(While node)               { return true; }
    public void visit(Break node)                  {}
    public void visit(Continue node)               {}

    public void visit(Literal node)                {}
    public void visit(VariableRef node)            {}
    public boolean visit(Unary node)               { return true; }
    public boolean visit(Binary node)              { return true; }
    public boolean visit(Call node)                { return true; }
    public boolean visit(Await node)               { return true; }
    public boolean visit(PropertyGet node)         { return true; }
    public boolean visit(ObjectCreation node)      { return true; }
    public boolean visit(FieldAccess node)         { return true; }
    public boolean visit(Lambda node)              { return true; }
    public void endVisit(Lambda node)              {}

    public final void accept(List<BoundStatement> statements) {
        for (BoundStatement statement : statements) {
            accept(statement);
        }
    }

    public final void accept(BoundStatement statement) {
        if (statement instanceof Bind s) {
            if (visit(s)) accept(s.value());
        } else if (statement instanceof FieldAssign s) {
            if (visit(s)) {
                accept(s.target());
                accept(s.value());
            }
        } else if (statement instanceof PropertySet s) {
            if (visit(s)) {
                accept(s.receiver());
                accept(s.value());
            }
        } else if (statement instanceof ExpressionStatement s) {
            if (visit(s)) accept(s.expression());
        } else if (statement instanceof Print s) {
            if (visit(s)) accept(s.value());
        } else if (statement instanceof Throw s) {
            if (visit(s)) accept(s.value());
        } else if (statement instanceof Return s) {
            if (visit(s) && s.value() != null) accept(s.value());
        } else if (statement instanceof If s) {
            if (visit(s)) {
                accept(s.condition());
                accept(s.thenBody());
                accept(s.elseBody());
            }
        } else if (statement instanceof While s) {
            if (visit(s)) {
                accept(s.condition());
                accept(s.body());
            }
        } else if (statement instanceof Break s) {
            visit(s);
        } else if (statement instanceof Continue s) {
            visit(s);
        } else {
            throw new IllegalArgumentException("Unhandled statement: " + statement);
        }
    }

    public final void accept(BoundExpr expr) {
        if (expr == null) return;
        if (expr instanceof Literal e) {
            visit(e);
        } else if (expr instanceof VariableRef e) {
            visit(e);
        } else if (expr instanceof Unary e) {
            if (visit(e)) accept(e.operand());
        } else if (expr instanceof Binary e) {
            if (visit(e)) {
                accept(e.left());
                accept(e.right());
            }
        } else if (expr instanceof Call e) {
            if (visit(e)) e.arguments().forEach(this::accept);
        } else if (expr instanceof Await e) {
            if (visit(e)) accept(e.operand());
        } else if (expr instanceof PropertyGet e) {
            if (visit(e)) accept(e.receiver());
        } else if (expr instanceof ObjectCreation e) {
            if (visit(e)) e.arguments().forEach(this::accept);
        } else if (expr instanceof FieldAccess e) {
            if (visit(e)) accept(e.receiver());
        } else if (expr instanceof Lambda e) {
            if (visit(e)) accept(e.body());
            endVisit(e);
        } else {
            throw new IllegalArgumentException("Unhandled expression: " + expr);
        }
    }
}
