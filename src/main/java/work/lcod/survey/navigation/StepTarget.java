package work.lcod.survey.navigation;

/**
 * Where the respondent goes next: a block position, or submission.
 */
public record StepTarget(Kind kind, int pageIndex, int blockIndex, String nodeId) {
    private static final StepTarget SUBMIT = new StepTarget(Kind.SUBMIT, -1, -1, null);

    public static StepTarget submit() {
        return SUBMIT;
    }

    public static StepTarget position(int pageIndex, int blockIndex, String nodeId) {
        return new StepTarget(Kind.POSITION, pageIndex, blockIndex, nodeId);
    }

    public boolean isSubmit() {
        return kind == Kind.SUBMIT;
    }

    public enum Kind {
        POSITION,
        SUBMIT
    }
}
