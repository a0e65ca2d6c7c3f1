package com.cadenceai.domain.parse.model;

/**
 * Machine-readable warning code. Each analyzer defines its own enum of codes.
 */
public interface WarningCode {

    String name();

    /**
     * Snake-case code as exposed to API consumers, e.g. {@code scope_ambiguity}.
     */
    default String code() {
        return name().toLowerCase();
    }
}
