package com.calor.analysis.dataflow.analyses;

import com.calor.analysis.cfg.ControlFlowGraph;
import com.calor.analysis.cfg.DefinitionSite;
import com.calor.analysis.cfg.Instruction;
import com.calor.analysis.dataflow.*;

import java.util.*;

/**
 * Forward may-analysis of which assignments can supply a variable's value. An assignment kills
 * every other definition of the same variable and generates its own. Parameters are defined on
 * entry.
 */
public final class ReachingDefinitions {

    private final ControlFlowGraph cfg;
    private final TransferFunction<Set<DefinitionSite>> transfer;
    private final DataflowResult<Set<DefinitionSite>> result;

    private ReachingDefinitions(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.transfer = (instruction, reaching) -> {
            DefinitionSite generated = instruction.definition();
            if (generated == null) {
                return reaching;
            }
            Set<DefinitionSite> out = new HashSet<>(reaching);
            out.removeAll(cfg.definitionsOf(generated.variable()));
            out.add(generated);
            return Collections.unmodifiableSet(out);
        };
        Set<DefinitionSite> parameters = new HashSet<>();
        for (DefinitionSite d : cfg.definitions()) {
            if (d.isParameter()) parameters.add(d);
        }
        DataflowEngine<Set<DefinitionSite>> engine = new DataflowEngine<>(
                new SetLattice<>(cfg.definitions().size()), transfer, Direction.FORWARD);
        this.result = engine.solve(cfg, Collections.unmodifiableSet(parameters));
    }

    public static ReachingDefinitions analyze(ControlFlowGraph cfg) {
        return new ReachingDefinitions(cfg);
    }

    public Set<DefinitionSite> reachingIn(int blockId)  { return result.in(blockId); }
    public Set<DefinitionSite> reachingOut(int blockId) { return result.out(blockId); }

    /** Definitions reaching the point just before {@code instruction}. */
    public Set<DefinitionSite> reachingBefore(Instruction instruction) {
        Set<DefinitionSite> reaching = result.in(instruction.blockId());
        List<Instruction> instructions = cfg.block(instruction.blockId()).instructions();
        for (int i = 0; i < instruction.index(); i++) {
            reaching = transfer.apply(instructions.get(i), reaching);
        }
        return reaching;
    }

    /** Definitions of {@code variable} reaching {@code instruction}, in id order. */
    public List<DefinitionSite> definitionsReaching(Instruction instruction, String variable) {
        return ofVariable(reachingBefore(instruction), variable);
    }

    /** Definitions of {@code variable} reaching the branch condition at the end of a block. */
    public List<DefinitionSite> definitionsReachingBranch(int blockId, String variable) {
        return ofVariable(result.out(blockId), variable);
    }

    public boolean hasMultipleReachingDefinitions(int blockId, String variable) {
        return ofVariable(result.in(blockId), variable).size() > 1;
    }

    public boolean hasMultipleReachingDefinitions(Instruction instruction, String variable) {
        return definitionsReaching(instruction, variable).size() > 1;
    }

    public int passes() {
        return result.passes();
    }

    private static List<DefinitionSite> ofVariable(Set<DefinitionSite> reaching, String variable) {
        List<DefinitionSite> matches = new ArrayList<>();
        for (DefinitionSite d : reaching) {
            if (d.variable().equals(variable)) matches.add(d);
        }
        matches.sort(Comparator.naturalOrder());
        return matches;
    }
}
