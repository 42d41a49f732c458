package com.calor.analysis.effects;

import java.util.*;

/**
 * A declarable side-effect capability, e.g. {@code (IO, console_write)} written {@code cw}.
 */
public record Effect(EffectCategory category, String kind) implements Comparable<Effect> {

    public static final Effect UNKNOWN = new Effect(EffectCategory.UNKNOWN, "*");

    private static final String READWRITE = "_readwrite";

    private static final Map<String, Effect> BY_CODE = new LinkedHashMap<>();
    private static final Map<Effect, String> CODES = new HashMap<>();

    static {
        code("cw", EffectCategory.IO, "console_write");
        code("cr", EffectCategory.IO, "console_read");
        code("fs:r", EffectCategory.IO, "filesystem_read");
        code("fs:w", EffectCategory.IO, "filesystem_write");
        code("fs:rw", EffectCategory.IO, "filesystem_readwrite");
        code("net:r", EffectCategory.IO, "network_read");
        code("net:w", EffectCategory.IO, "network_write");
        code("net:rw", EffectCategory.IO, "network_readwrite");
        code("db:r", EffectCategory.IO, "database_read");
        code("db:w", EffectCategory.IO, "database_write");
        code("db:rw", EffectCategory.IO, "database_readwrite");
        code("env:r", EffectCategory.IO, "environment_read");
        code("env:w", EffectCategory.IO, "environment_write");
        code("env:rw", EffectCategory.IO, "environment_readwrite");
        code("proc", EffectCategory.IO, "process");
        code("time", EffectCategory.NONDETERMINISM, "time");
        code("rand", EffectCategory.NONDETERMINISM, "random");
        code("mut", EffectCategory.MUTATION, "heap_write");
        code("throw", EffectCategory.EXCEPTION, "intentional");
    }

    private static void code(String code, EffectCategory category, String kind) {
        Effect effect = new Effect(category, kind);
        BY_CODE.put(code, effect);
        CODES.put(effect, code);
    }

    public static final Effect CONSOLE_WRITE = BY_CODE.get("cw");
    public static final Effect HEAP_WRITE = BY_CODE.get("mut");
    public static final Effect THROW = BY_CODE.get("throw");

    /**
     * Parses a surface code ({@code cw}, {@code fs:rw}) or the long {@code category:kind} form
     * ({@code io:console_write}). Empty for anything else.
     */
    public static Optional<Effect> parse(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        Effect known = BY_CODE.get(normalized);
        if (known != null) {
            return Optional.of(known);
        }
        int colon = normalized.indexOf(':');
        if (colon <= 0 || colon == normalized.length() - 1) {
            return Optional.empty();
        }
        EffectCategory category = switch (normalized.substring(0, colon)) {
            case "io" -> EffectCategory.IO;
            case "mutation" -> EffectCategory.MUTATION;
            case "nondeterminism" -> EffectCategory.NONDETERMINISM;
            case "exception" -> EffectCategory.EXCEPTION;
            default -> null;
        };
        return category == null ? Optional.empty() : Optional.of(new Effect(category, normalized.substring(colon + 1)));
    }

    public String surfaceCode() {
        if (this.equals(UNKNOWN)) return "unknown";
        String code = CODES.get(this);
        return code != null ? code : category.name().toLowerCase(Locale.ROOT) + ":" + kind;
    }

    /** True when declaring this effect also permits {@code other}; {@code fs:rw} covers {@code fs:r}. */
    public boolean encompasses(Effect other) {
        if (equals(other) || equals(UNKNOWN)) {
            return true;
        }
        if (category != other.category || !kind.endsWith(READWRITE)) {
            return false;
        }
        String resource = kind.substring(0, kind.length() - READWRITE.length());
        return other.kind.equals(resource + "_read") || other.kind.equals(resource + "_write");
    }

    @Override
    public int compareTo(Effect other) {
        int byCategory = category.compareTo(other.category);
        return byCategory != 0 ? byCategory : kind.compareTo(other.kind);
    }

    @Override
    public String toString() {
        return surfaceCode();
    }
}
