package com.purchasingpower.lahk.model.graph;

/**
 * Boolean annotations a node can carry.
 *
 * <p>Each flag renders to the tag text used in the node's display meta.
 *
 * @since 1.0.0
 */
public enum NodeFlag {
    IMPLICIT_START("implicit start"),
    IMPLICIT_END("implicit end"),
    EXPLICIT_END("explicit end"),
    INLINE_LOOP("inline-loop"),
    INLINE_NEXT("inline-next"),
    FUN_BLOCK_COLLAPSED("fun-block collapsed"),
    FUN_BLOCK_EXPANDED("fun-block expanded"),
    FUN_BODY_MEMBER("fun-body-member"),
    FUN_FOOTER("fun-footer");

    private final String tag;

    NodeFlag(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
