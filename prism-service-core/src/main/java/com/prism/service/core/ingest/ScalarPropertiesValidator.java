package com.prism.service.core.ingest;

import com.prism.core.support.ScalarValues;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.Map;

/** Reports each offending property under its own name, e.g. {@code events[1].properties.items}. */
public class ScalarPropertiesValidator implements ConstraintValidator<ScalarProperties, Map<String, Object>> {

    @Override
    public boolean isValid(Map<String, Object> properties, ConstraintValidatorContext context) {
        if (properties == null) {
            return true;
        }
        boolean valid = true;
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            Object value = entry.getValue();
            if (value != null && !ScalarValues.isScalar(value)) {
                if (valid) {
                    context.disableDefaultConstraintViolation();
                    valid = false;
                }
                context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                        .addPropertyNode(entry.getKey())
                        .addConstraintViolation();
            }
        }
        return valid;
    }
}
