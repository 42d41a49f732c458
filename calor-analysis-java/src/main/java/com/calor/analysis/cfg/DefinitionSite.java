package com.calor.analysis.cfg;

import com.calor.analysis.ir.BoundStatement;

/**
 * One assignment of a variable. Ids are dense and assigned once when the graph is built, so
 * analyses never look definitions up by statement identity.
 *
 * @param index     position of the assigning instruction in its block, or {@link #PARAMETER_INDEX}
 *                  for the synthetic definition of a parameter on entry
 * @param statement the assigning statement; null for parameter definitions
 */
public record DefinitionSite(int id, String variable, int blockId, int index, BoundStatement statement)
        implements Comparable<DefinitionSite> {

    public static final int PARAMETER_INDEX = -1;

    public boolean isParameter() {
        return index == PARAMETER_INDEX;
    }

    @Override
    public int compareTo(DefinitionSite other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return variable + "@" + (isParameter() ? "param" : "B" + blockId + ":" + index);
    }
}
