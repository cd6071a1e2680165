package dev.vigil.infrastructure.gateway;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Model ids in server order plus the instant of the refresh that produced them.
 * A catalog that was never refreshed is always stale.
 */
public record ModelCatalog(List<String> models, Instant refreshedAt) {

    public ModelCatalog {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public static ModelCatalog empty() {
        return new ModelCatalog(List.of(), null);
    }

    public boolean isStale(Instant now, Duration ttl) {
        return refreshedAt == null || Duration.between(refreshedAt, now).compareTo(ttl) > 0;
    }
}
