package com.calor.analysis.effects;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an effect catalog file ({@code .calor-effects.json}).
 */
public class CatalogFile {

    @SerializedName("version")
    private String version;

    @SerializedName("entries")
    private List<Entry> entries;

    public String getVersion()       { return version; }
    public List<Entry> getEntries()  { return entries != null ? entries : Collections.emptyList(); }

    public static class Entry {
        @SerializedName("signature")
        private String signature;

        @SerializedName("effects")
        private List<String> effects;

        public String getSignature()     { return signature; }
        public List<String> getEffects() { return effects != null ? effects : Collections.emptyList(); }
    }
}
