package de.bsommerfeld.xivpatch.updater.model;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Installed version per repository: 0 is the base game, 1 to 5 are the
 * expansions. A missing entry means the repository is not installed.
 */
public record VersionVector(Map<Integer, GameVersion> versions) {

    public static final int BASE = 0;
    public static final int MAX_EXPANSION = 5;

    public VersionVector {
        for (Integer repository : versions.keySet()) {
            checkRepository(repository);
        }
        versions = ImmutableSortedMap.copyOf(versions);
    }

    public static VersionVector empty() {
        return new VersionVector(Map.of());
    }

    public Optional<GameVersion> get(int repository) {
        return Optional.ofNullable(versions.get(repository));
    }

    public Optional<GameVersion> base() {
        return get(BASE);
    }

    public boolean contains(int repository) {
        return versions.containsKey(repository);
    }

    /** Returns a copy with {@code repository} set to {@code version}. */
    public VersionVector with(int repository, GameVersion version) {
        checkRepository(repository);
        return new VersionVector(ImmutableSortedMap.<Integer, GameVersion>naturalOrder()
                .putAll(versions.entrySet().stream()
                        .filter(e -> e.getKey() != repository)
                        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)))
                .put(repository, version)
                .build());
    }

    @Override
    public String toString() {
        return versions.entrySet().stream()
                .map(e -> "ex" + e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static void checkRepository(int repository) {
        if (repository < BASE || repository > MAX_EXPANSION) {
            throw new IllegalArgumentException("Unknown repository: " + repository);
        }
    }
}
