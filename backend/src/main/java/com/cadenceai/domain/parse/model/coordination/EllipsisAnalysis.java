package com.cadenceai.domain.parse.model.coordination;

/**
 * @param patternId matched ellipsis pattern ("verb_sharing", ...), null when none matched
 * @param type      ellipsis category
 * @param shared    material shared across conjuncts
 */
public record EllipsisAnalysis(
        String patternId,
        EllipsisType type,
        String shared
) {
    public static final EllipsisAnalysis NONE = new EllipsisAnalysis(null, EllipsisType.NONE, null);

    public boolean detected() {
        return type != EllipsisType.NONE;
    }
}
