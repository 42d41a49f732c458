package com.calor.analysis.dataflow;

public enum Direction {
    FORWARD,
    BACKWARD
}
