package work.lcod.survey.graph;

import java.util.Collection;
import java.util.Objects;

/**
 * Radial search for a free slot: the preferred position first, then rings of growing radius
 * sampled at a fixed angle step. Gives up after a bounded number of rings and keeps the
 * preferred position.
 */
public final class CollisionResolver {
    private final LayoutSettings settings;

    public CollisionResolver(LayoutSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public boolean collides(Bounds candidate, Collection<Bounds> placed) {
        for (var other : placed) {
            if (candidate.overlaps(other, settings.padding())) {
                return true;
            }
        }
        return false;
    }

    public Bounds findAvailablePosition(Bounds preferred, Collection<Bounds> placed) {
        if (!collides(preferred, placed)) {
            return preferred;
        }
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            var radius = attempt * settings.radiusStep();
            for (double angle = 0; angle < 360; angle += settings.angleStep()) {
                var radians = Math.toRadians(angle);
                var candidate = preferred.at(
                    Math.round(preferred.x() + radius * Math.cos(radians)),
                    Math.round(preferred.y() + radius * Math.sin(radians))
                );
                if (!collides(candidate, placed)) {
                    return candidate;
                }
            }
        }
        return preferred;
    }
}
