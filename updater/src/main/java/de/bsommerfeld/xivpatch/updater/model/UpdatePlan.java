package de.bsommerfeld.xivpatch.updater.model;

import com.google.common.collect.ImmutableSortedMap;
import de.bsommerfeld.xivpatch.core.util.ByteFormatter;

import java.util.List;
import java.util.Map;

/**
 * The patches to apply, in application order: ascending repository id,
 * ascending version within a repository. Built fresh on every check.
 *
 * @param patches        patches in application order
 * @param localVersions  installed versions the plan was computed against
 * @param latestVersions newest version the server knows per repository
 */
public record UpdatePlan(List<PatchDescriptor> patches, VersionVector localVersions,
                         Map<Integer, GameVersion> latestVersions) {

    public UpdatePlan {
        patches = List.copyOf(patches);
        latestVersions = ImmutableSortedMap.copyOf(latestVersions);
    }

    public static UpdatePlan empty(VersionVector localVersions) {
        return new UpdatePlan(List.of(), localVersions, Map.of());
    }

    public boolean isEmpty() {
        return patches.isEmpty();
    }

    public int patchCount() {
        return patches.size();
    }

    public long totalSize() {
        return patches.stream().mapToLong(PatchDescriptor::size).sum();
    }

    public String formattedTotalSize() {
        return ByteFormatter.format(totalSize());
    }
}
