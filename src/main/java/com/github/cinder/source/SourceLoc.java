package com.github.cinder.source;

/**
 * Opaque position in a source buffer. Only validity is interpreted here.
 */
public record SourceLoc(int offset) {

    public static final SourceLoc INVALID = new SourceLoc(-1);

    public static SourceLoc at(int offset) {
        return new SourceLoc(offset);
    }

    public boolean isValid() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isValid() ? "@" + offset : "@invalid";
    }
}
