package com.calor.analysis.cfg;

import com.calor.analysis.ir.BoundStatement;

import java.util.Set;

/**
 * A statement placed in a basic block, with the definition it creates (if any).
 */
public record Instruction(int blockId, int index, BoundStatement statement, DefinitionSite definition, Set<String> uses) {

    public Instruction {
        uses = Set.copyOf(uses);
    }

    public String definedVariable() {
        return definition != null ? definition.variable() : null;
    }
}
