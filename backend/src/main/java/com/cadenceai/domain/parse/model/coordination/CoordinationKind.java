package com.cadenceai.domain.parse.model.coordination;

public enum CoordinationKind {
    PARALLEL,
    SEQUENTIAL,
    CONTRASTIVE,
    ALTERNATIVE,
    CONDITIONAL,
    CONCURRENT,
    ADDITIVE,
    CORRECTIVE,
    ELABORATIVE,
    CAUSAL;

    /**
     * Discourse relation a coordination of this kind contributes.
     */
    public RhetoricalRelation rhetoricalRelation() {
        return switch (this) {
            case PARALLEL, CONCURRENT, ADDITIVE -> RhetoricalRelation.LIST;
            case SEQUENTIAL -> RhetoricalRelation.SEQUENCE;
            case CONTRASTIVE -> RhetoricalRelation.CONTRAST;
            case ALTERNATIVE -> RhetoricalRelation.ALTERNATIVE;
            case CONDITIONAL -> RhetoricalRelation.CONDITION;
            case CORRECTIVE -> RhetoricalRelation.CORRECTION;
            case ELABORATIVE -> RhetoricalRelation.ELABORATION;
            case CAUSAL -> RhetoricalRelation.PURPOSE;
        };
    }
}
