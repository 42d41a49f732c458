package com.calor.analysis.dataflow.analyses;

import com.calor.analysis.cfg.BasicBlock;
import com.calor.analysis.cfg.ControlFlowGraph;
import com.calor.analysis.cfg.DefinitionSite;
import com.calor.analysis.cfg.Instruction;
import com.calor.analysis.dataflow.*;

import java.util.*;

/**
 * Backward may-analysis of variables whose current value can still be read.
 * An instruction kills the variable it assigns and then generates the variables it reads.
 */
public final class LiveVariables {

    private static final TransferFunction<Set<String>> TRANSFER = new TransferFunction<>() {
        @Override
        public Set<String> apply(Instruction instruction, Set<String> liveAfter) {
            String defined = instruction.definedVariable();
            if (defined == null && liveAfter.containsAll(instruction.uses())) {
                return liveAfter;
            }
            Set<String> live = new HashSet<>(liveAfter);
            if (defined != null) live.remove(defined);
            live.addAll(instruction.uses());
            return Collections.unmodifiableSet(live);
        }

        @Override
        public Set<String> applyBranch(BasicBlock block, Set<String> liveAfter) {
            if (liveAfter.containsAll(block.conditionUses())) {
                return liveAfter;
            }
            Set<String> live = new HashSet<>(liveAfter);
            live.addAll(block.conditionUses());
            return Collections.unmodifiableSet(live);
        }
    };

    private final ControlFlowGraph cfg;
    private final DataflowEngine<Set<String>> engine;
    private final DataflowResult<Set<String>> result;

    private LiveVariables(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.engine = new DataflowEngine<>(new SetLattice<>(universeSize(cfg)), TRANSFER, Direction.BACKWARD);
        this.result = engine.solve(cfg);
    }

    public static LiveVariables analyze(ControlFlowGraph cfg) {
        return new LiveVariables(cfg);
    }

    public Set<String> liveAtEntry(int blockId) { return result.in(blockId); }
    public Set<String> liveAtExit(int blockId)  { return result.out(blockId); }

    public boolean isLive(int blockId, String variable, boolean atEntry) {
        return (atEntry ? liveAtEntry(blockId) : liveAtExit(blockId)).contains(variable);
    }

    /** Live set immediately after {@code instruction} executes. */
    public Set<String> liveAfter(Instruction instruction) {
        BasicBlock block = cfg.block(instruction.blockId());
        Set<String> live = TRANSFER.applyBranch(block, result.out(block.id()));
        List<Instruction> instructions = block.instructions();
        for (int i = instructions.size() - 1; i > instruction.index(); i--) {
            live = TRANSFER.apply(instructions.get(i), live);
        }
        return live;
    }

    public Set<String> liveBefore(Instruction instruction) {
        return TRANSFER.apply(instruction, liveAfter(instruction));
    }

    /** Assignments whose value is never read, in definition order. */
    public List<DefinitionSite> deadAssignments() {
        List<DefinitionSite> dead = new ArrayList<>();
        for (BasicBlock block : cfg.blocks()) {
            Set<String> live = TRANSFER.applyBranch(block, result.out(block.id()));
            List<Instruction> instructions = block.instructions();
            for (int i = instructions.size() - 1; i >= 0; i--) {
                Instruction instruction = instructions.get(i);
                DefinitionSite definition = instruction.definition();
                if (definition != null && !live.contains(definition.variable())) {
                    dead.add(definition);
                }
                live = TRANSFER.apply(instruction, live);
            }
        }
        dead.sort(Comparator.naturalOrder());
        return dead;
    }

    public int passes() {
        return result.passes();
    }

    private static int universeSize(ControlFlowGraph cfg) {
        Set<String> names = new HashSet<>(cfg.variables());
        for (BasicBlock block : cfg.blocks()) {
            names.addAll(block.conditionUses());
            for (Instruction instruction : block.instructions()) {
                names.addAll(instruction.uses());
            }
        }
        return names.size();
    }
}
