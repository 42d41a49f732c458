package com.calor.analysis.ir;

public enum FunctionKind {
    FUNCTION,
    CONSTRUCTOR,
    GETTER,
    SETTER
}
