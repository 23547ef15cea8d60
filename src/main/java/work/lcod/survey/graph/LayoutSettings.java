package work.lcod.survey.graph;

/**
 * Layout constants. {@link #defaults()} reproduces the builder canvas spacing.
 *
 * @param siblingSpacing  horizontal distance between nodes of the same level
 * @param levelSpacing    minimum vertical distance between consecutive levels
 * @param padding         clearance kept around every placed node
 * @param radiusStep      radius growth per collision-search ring
 * @param angleStep       angle between candidates on a ring, in degrees
 * @param maxAttempts     rings tried before giving up on a free slot
 */
public record LayoutSettings(
    double startX,
    double startY,
    double siblingSpacing,
    double levelSpacing,
    double padding,
    double radiusStep,
    double angleStep,
    int maxAttempts,
    double terminalWidth,
    double terminalHeight,
    double sectionWidth,
    double sectionHeight,
    double pageWidth,
    double minPageHeight,
    double blockOffsetX,
    double blockOffsetY,
    double blockHeight,
    double blockSpacing
) {
    public LayoutSettings {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (angleStep <= 0 || angleStep > 360) {
            throw new IllegalArgumentException("angleStep must be in (0, 360]");
        }
    }

    public static LayoutSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .startX(startX)
            .startY(startY)
            .siblingSpacing(siblingSpacing)
            .levelSpacing(levelSpacing)
            .padding(padding)
            .radiusStep(radiusStep)
            .angleStep(angleStep)
            .maxAttempts(maxAttempts)
            .terminalSize(terminalWidth, terminalHeight)
            .sectionSize(sectionWidth, sectionHeight)
            .pageSize(pageWidth, minPageHeight)
            .blockOffset(blockOffsetX, blockOffsetY)
            .blockHeight(blockHeight)
            .blockSpacing(blockSpacing);
    }

    public double blockWidth() {
        return pageWidth - 2 * blockOffsetX;
    }

    /** Height of a container drawing {@code blockCount} blocks. */
    public double containerHeight(double baseHeight, int blockCount) {
        if (blockCount == 0) {
            return baseHeight;
        }
        return Math.max(baseHeight, blockOffsetY + blockCount * blockSpacing + padding);
    }

    public static final class Builder {
        private double startX = 400;
        private double startY = 100;
        private double siblingSpacing = 450;
        private double levelSpacing = 400;
        private double padding = 20;
        private double radiusStep = 50;
        private double angleStep = 45;
        private int maxAttempts = 50;
        private double terminalWidth = 100;
        private double terminalHeight = 60;
        private double sectionWidth = 400;
        private double sectionHeight = 100;
        private double pageWidth = 350;
        private double minPageHeight = 160;
        private double blockOffsetX = 20;
        private double blockOffsetY = 60;
        private double blockHeight = 80;
        private double blockSpacing = 100;

        public Builder startX(double startX) {
            this.startX = startX;
            return this;
        }

        public Builder startY(double startY) {
            this.startY = startY;
            return this;
        }

        public Builder siblingSpacing(double siblingSpacing) {
            this.siblingSpacing = siblingSpacing;
            return this;
        }

        public Builder levelSpacing(double levelSpacing) {
            this.levelSpacing = levelSpacing;
            return this;
        }

        public Builder padding(double padding) {
            this.padding = padding;
            return this;
        }

        public Builder radiusStep(double radiusStep) {
            this.radiusStep = radiusStep;
            return this;
        }

        public Builder angleStep(double angleStep) {
            this.angleStep = angleStep;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder terminalSize(double width, double height) {
            this.terminalWidth = width;
            this.terminalHeight = height;
            return this;
        }

        public Builder sectionSize(double width, double height) {
            this.sectionWidth = width;
            this.sectionHeight = height;
            return this;
        }

        public Builder pageSize(double width, double minHeight) {
            this.pageWidth = width;
            this.minPageHeight = minHeight;
            return this;
        }

        public Builder blockOffset(double x, double y) {
            this.blockOffsetX = x;
            this.blockOffsetY = y;
            return this;
        }

        public Builder blockHeight(double blockHeight) {
            this.blockHeight = blockHeight;
            return this;
        }

        public Builder blockSpacing(double blockSpacing) {
            this.blockSpacing = blockSpacing;
            return this;
        }

        public LayoutSettings build() {
            return new LayoutSettings(
                startX,
                startY,
                siblingSpacing,
                levelSpacing,
                padding,
                radiusStep,
                angleStep,
                maxAttempts,
                terminalWidth,
                terminalHeight,
                sectionWidth,
                sectionHeight,
                pageWidth,
                minPageHeight,
                blockOffsetX,
                blockOffsetY,
                blockHeight,
                blockSpacing
            );
        }
    }
}
