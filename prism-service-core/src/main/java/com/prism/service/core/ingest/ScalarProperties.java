package com.prism.service.core.ingest;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Every value of the annotated property map is a string, number, boolean or null. */
@Documented
@Constraint(validatedBy = ScalarPropertiesValidator.class)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ScalarProperties {

    String message() default "must be a string, number, boolean or null";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
