package work.lcod.survey.navigation;

/**
 * Paged surveys group blocks into pages; pageless surveys show every block as its own step.
 */
public enum SurveyMode {
    PAGED,
    PAGELESS
}
