package com.cadenceai.domain.parse.model.coordination;

public enum EllipsisType {
    /** "boost the bass and [boost] the drums in the chorus" */
    GAPPING,
    /** "brighten and [widen] the pad" */
    RIGHT_NODE,
    STRIPPING,
    /** "add reverb and [add] delay" */
    CONJUNCTION_REDUCTION,
    NONE
}
