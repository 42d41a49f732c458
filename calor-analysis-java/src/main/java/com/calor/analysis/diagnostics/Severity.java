package com.calor.analysis.diagnostics;

import com.google.gson.annotations.SerializedName;

public enum Severity {
    @SerializedName("error")   ERROR,
    @SerializedName("warning") WARNING,
    @SerializedName("info")    INFO
}
