package com.company.datasetsplitter.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Treatment of rows whose category value is missing: {@code Fill(sentinel)} or {@code Skip}.
 */
public final class NullPolicy {

    public enum Kind {
        FILL,
        SKIP
    }

    private static final NullPolicy SKIP = new NullPolicy(Kind.SKIP, null);

    private final Kind kind;
    private final String sentinel;

    private NullPolicy(Kind kind, String sentinel) {
        this.kind = kind;
        this.sentinel = sentinel;
    }

    public static NullPolicy fill(String sentinel) {
        Objects.requireNonNull(sentinel, "sentinel");
        return new NullPolicy(Kind.FILL, sentinel);
    }

    public static NullPolicy skip() {
        return SKIP;
    }

    /**
     * {@code Fill} when a sentinel is supplied, {@code Skip} otherwise.
     */
    public static NullPolicy fromFillValue(String fillValue) {
        return fillValue != null ? fill(fillValue) : skip();
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getSentinel() {
        return Optional.ofNullable(sentinel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NullPolicy)) {
            return false;
        }
        NullPolicy that = (NullPolicy) o;
        return kind == that.kind && Objects.equals(sentinel, that.sentinel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sentinel);
    }

    @Override
    public String toString() {
        return kind == Kind.FILL ? "Fill(" + sentinel + ")" : "Skip";
    }
}
