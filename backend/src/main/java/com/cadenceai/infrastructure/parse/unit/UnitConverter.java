package com.cadenceai.infrastructure.parse.unit;

import com.cadenceai.domain.parse.model.unit.CanonicalUnit;
import com.cadenceai.domain.parse.model.unit.UnitExpression;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Converts between units of one dimension through the dimension's base unit.
 */
@Component
public class UnitConverter {

    /**
     * @return the converted value, or empty if the units belong to different dimensions
     */
    public OptionalDouble convert(double value, CanonicalUnit from, CanonicalUnit to) {
        if (!from.sameDimension(to)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value * from.toBaseFactor() / to.toBaseFactor());
    }

    public OptionalDouble convert(UnitExpression expression, CanonicalUnit to) {
        return convert(expression.value().value(), expression.unit(), to);
    }
}
