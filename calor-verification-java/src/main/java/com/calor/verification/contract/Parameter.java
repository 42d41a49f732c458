package com.calor.verification.contract;

/**
 * One entry of a function's ordered parameter signature.
 */
public record Parameter(String name, String typeName) {

    @Override
    public String toString() {
        return name + ":" + typeName;
    }
}
