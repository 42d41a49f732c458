package com.calor.analysis.driver;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs for verification_report.json, snake_case via @SerializedName.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class ReportRoot {
        @SerializedName("report_version") public String reportVersion;
        @SerializedName("module")         public String module;
        @SerializedName("passed")         public boolean passed;
        @SerializedName("diagnostics")    public List<ReportDiagnostic> diagnostics;
        @SerializedName("functions")      public List<ReportFunction> functions;
        @SerializedName("components")     public List<List<String>> components;
        @SerializedName("contracts")      public List<ReportContract> contracts;
        @SerializedName("cache")          public ReportCache cache;
    }

    public static class ReportDiagnostic {
        @SerializedName("code")       public String code;
        @SerializedName("severity")   public String severity;
        @SerializedName("function")   public String function;
        @SerializedName("message")    public String message;
        @SerializedName("call_chain") public List<String> callChain;
    }

    public static class ReportFunction {
        @SerializedName("function")         public String function;
        @SerializedName("declared_effects") public List<String> declaredEffects;
        @SerializedName("computed_effects") public List<String> computedEffects;
        @SerializedName("accepted")         public boolean accepted;
    }

    public static class ReportContract {
        @SerializedName("function")       public String function;
        @SerializedName("kind")           public String kind;        // pre, post
        @SerializedName("index")          public int index;
        @SerializedName("contract_hash")  public String contractHash;
        @SerializedName("status")         public String status;
        @SerializedName("counterexample") public String counterexample;
        @SerializedName("duration_ms")    public long durationMillis;
        @SerializedName("from_cache")     public boolean fromCache;
    }

    public static class ReportCache {
        @SerializedName("hits")      public long hits;
        @SerializedName("misses")    public long misses;
        @SerializedName("writes")    public long writes;
        @SerializedName("errors")    public long errors;
        @SerializedName("evictions") public long evictions;
        @SerializedName("hit_rate")  public double hitRate;
    }
}
