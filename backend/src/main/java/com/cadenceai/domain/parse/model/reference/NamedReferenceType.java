package com.cadenceai.domain.parse.model.reference;

public enum NamedReferenceType {
    /** 'Glass Pad' */
    QUOTED_STANDALONE,
    /** the 'Glass Pad' track */
    QUOTED_WITH_TYPE,
    /** the track called 'Glass Pad' */
    CALLED_PATTERN,
    /** the layer named 'Glass Pad' */
    NAMED_PATTERN,
    /** the clip labelled 'Take 3' */
    LABELLED_PATTERN,
    /** the version titled 'Final' */
    TITLED_PATTERN,
    /** call it 'Glass Pad' */
    NAMING_COMMAND,
    /** rename it to 'Glass Pad' */
    RENAMING_COMMAND,
    /** the track called Glass Pad (unquoted) */
    BARE_NAME,
    /** #lead, @vocals */
    TAGGED_REFERENCE
}
