package com.demanglekit.core.model;

/**
 * Reference-storage qualifiers that wrap a stored type.
 */
public enum ReferenceOwnership {
    WEAK("weak"),
    UNOWNED("unowned"),
    UNMANAGED("unowned(unsafe)");

    private final String keyword;

    ReferenceOwnership(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the source keyword for this ownership (e.g. {@code unowned(unsafe)}).
     *
     * @return source keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Maps a reference-storage node tag to its ownership.
     *
     * @param kind one of {@link NodeKind#WEAK}, {@link NodeKind#UNOWNED}, {@link NodeKind#UNMANAGED}
     * @return matching ownership
     * @throws AssertionError if the tag is not a reference-storage tag
     */
    public static ReferenceOwnership of(NodeKind kind) {
        return switch (kind) {
            case WEAK -> WEAK;
            case UNOWNED -> UNOWNED;
            case UNMANAGED -> UNMANAGED;
            default -> throw new AssertionError("not a reference storage kind: " + kind);
        };
    }
}
