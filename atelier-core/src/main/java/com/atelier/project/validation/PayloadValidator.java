package com.atelier.project.validation;

/**
 * Pure predicate deciding whether an entity payload may leave the local store.
 *
 * <p>Implementations must not mutate the payload.
 */
@FunctionalInterface
public interface PayloadValidator {

    ValidationResult validate(Object payload);

    static PayloadValidator acceptAll() {
        return payload -> ValidationResult.accepted();
    }
}
