package com.cadenceai.domain.parse.model.locality;

/**
 * Preservation constraint implied by a marker: "just X" implies "leave everything else alone".
 *
 * @param target     what should be preserved
 * @param strength   how strongly
 * @param defeasible true if an explicit instruction may override it
 */
public record ImpliedPreservation(
        PreservationTarget target,
        PreservationStrength strength,
        boolean defeasible
) {}
