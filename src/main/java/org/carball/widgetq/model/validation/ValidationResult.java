package org.carball.widgetq.model.validation;

import org.carball.widgetq.error.ValidationException;

import java.util.Optional;

/**
 * Tagged result of an explicit validator: {@link Ok} or {@link Err}.
 */
public interface ValidationResult {

    boolean isOk();

    Optional<ValidationIssue> issue();

    static ValidationResult ok() {
        return Ok.INSTANCE;
    }

    static ValidationResult error(ValidationIssue issue) {
        return new Err(issue);
    }

    default void orThrow() {
        issue().ifPresent(i -> {
            throw new ValidationException(i.messageKey(), i.path(), i.message(), i.suggestion());
        });
    }

    final class Ok implements ValidationResult {
        private static final Ok INSTANCE = new Ok();

        private Ok() {
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<ValidationIssue> issue() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Ok";
        }
    }

    record Err(ValidationIssue error) implements ValidationResult {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<ValidationIssue> issue() {
            return Optional.of(error);
        }
    }
}
