package work.lcod.survey.graph;

/**
 * Axis-aligned box; {@code (x, y)} is the top-left corner.
 */
public record Bounds(double x, double y, double width, double height) {
    public Bounds at(double newX, double newY) {
        return new Bounds(newX, newY, width, height);
    }

    /** Overlap test with {@code padding} of clearance around {@code other}. */
    public boolean overlaps(Bounds other, double padding) {
        return !(x + width + padding < other.x
            || x > other.x + other.width + padding
            || y + height + padding < other.y
            || y > other.y + other.height + padding);
    }
}
