package sec.skeleton.api.config;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must be an absolute URI (scheme required).
 * Any scheme is accepted, so values like {@code postgres://host/db} are valid.
 * {@code null} and empty strings are considered valid.
 */
@Documented
@Constraint(validatedBy = WellFormedUriValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface WellFormedUri {

    String message() default "must be a well-formed URI";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
