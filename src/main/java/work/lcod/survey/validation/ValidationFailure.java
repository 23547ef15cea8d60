package work.lcod.survey.validation;

import work.lcod.survey.model.Severity;

public record ValidationFailure(int ruleIndex, String operator, String message, Severity severity) {
    public boolean isWarning() {
        return severity == Severity.WARNING;
    }
}
