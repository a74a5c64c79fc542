package com.github.cinder.source;

public record SourceRange(SourceLoc start, SourceLoc end) {

    public static final SourceRange INVALID = new SourceRange(SourceLoc.INVALID, SourceLoc.INVALID);

    public SourceRange(SourceLoc loc) {
        this(loc, loc);
    }

    public boolean isValid() {
        return start.isValid() && end.isValid();
    }
}
