package com.calor.analysis.cfg;

import com.calor.analysis.ir.BoundExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Straight-line run of instructions with an optional branch condition evaluated on exit.
 *
 * <p>A block without a condition falls through to exactly one successor. A block with a
 * condition has exactly two, in the order {@code [whenTrue, whenFalse]}. The exit block has none.
 * Blocks are wired up by {@link CfgBuilder} and never change once the graph is returned.
 */
public final class BasicBlock {

    private final int id;
    private final List<Instruction> instructions = new ArrayList<>();
    private final List<BasicBlock> successors = new ArrayList<>();
    private final List<BasicBlock> predecessors = new ArrayList<>();
    private BoundExpr branchCondition;
    private Set<String> conditionUses = Set.of();

    BasicBlock(int id) {
        this.id = id;
    }

    public int id() { return id; }
    public List<Instruction> instructions()  { return Collections.unmodifiableList(instructions); }
    public List<BasicBlock> successors()     { return Collections.unmodifiableList(successors); }
    public List<BasicBlock> predecessors()   { return Collections.unmodifiableList(predecessors); }
    public BoundExpr branchCondition()       { return branchCondition; }
    public boolean hasBranch()               { return branchCondition != null; }

    /** Variables read by the branch condition; empty when there is none. */
    public Set<String> conditionUses()       { return conditionUses; }

    // --- builder access ---

    List<Instruction> mutableInstructions() { return instructions; }

    void setBranchCondition(BoundExpr condition) {
        this.branchCondition = condition;
        this.conditionUses = condition != null ? VariableUses.of(condition) : Set.of();
    }

    void addSuccessor(BasicBlock target) {
        successors.add(target);
        target.predecessors.add(this);
    }

    void removePredecessor(BasicBlock source) {
        predecessors.removeIf(p -> p == source);
    }

    @Override
    public String toString() {
        return "B" + id;
    }
}
