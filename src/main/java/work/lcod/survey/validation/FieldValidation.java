package work.lcod.survey.validation;

import java.util.List;
import java.util.Optional;

/**
 * Every failed rule of one field, in rule order. Warnings are reported but do not block.
 */
public record FieldValidation(String fieldName, List<ValidationFailure> failures) {
    public FieldValidation {
        failures = List.copyOf(failures);
    }

    public static FieldValidation passed(String fieldName) {
        return new FieldValidation(fieldName, List.of());
    }

    public boolean valid() {
        return failures.stream().noneMatch(failure -> !failure.isWarning());
    }

    /** Message of the first error-severity failure, the one shown under the input. */
    public Optional<String> firstError() {
        return failures.stream()
            .filter(failure -> !failure.isWarning())
            .map(ValidationFailure::message)
            .findFirst();
    }

    public List<ValidationFailure> warnings() {
        return failures.stream().filter(ValidationFailure::isWarning).toList();
    }
}
