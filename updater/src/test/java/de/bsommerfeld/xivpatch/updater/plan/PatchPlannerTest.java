package de.bsommerfeld.xivpatch.updater.plan;

import de.bsommerfeld.xivpatch.updater.model.GameVersion;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.UpdatePlan;
import de.bsommerfeld.xivpatch.updater.model.VersionVector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PatchPlannerTest {

    private final PatchPlanner planner = new PatchPlanner();

    private static PatchDescriptor patch(int repository, String version, String name) {
        return new PatchDescriptor(100, 100, 1, 1, GameVersion.parse(version), repository, "sha1", 0,
                List.of(), "http://host/game/ex" + repository + "/" + name + ".patch");
    }

    private static VersionVector local(Object... repositoryVersionPairs) {
        Map<Integer, GameVersion> versions = new HashMap<>();
        for (int i = 0; i < repositoryVersionPairs.length; i += 2) {
            versions.put((Integer) repositoryVersionPairs[i], GameVersion.parse((String) repositoryVersionPairs[i + 1]));
        }
        return new VersionVector(versions);
    }

    @Test
    void plan_shouldIncludeEverythingForAbsentBase() {
        List<PatchDescriptor> all = List.of(
                patch(0, "2012.01.01.0000.0000", "H1"),
                patch(0, "2012.01.01.0000.0001", "H2"),
                patch(0, "2025.05.29.0000.0000", "D1"));

        UpdatePlan plan = planner.plan(all, VersionVector.empty());

        assertEquals(3, plan.patchCount());
        assertEquals(300, plan.totalSize());
    }

    @Test
    void plan_shouldSkipAbsentExpansion() {
        List<PatchDescriptor> all = List.of(
                patch(0, "2025.06.01.0000.0000", "base"),
                patch(2, "2025.06.01.0000.0000", "ex2"));

        UpdatePlan plan = planner.plan(all, local(0, "2025.05.29.0000.0000"));

        assertEquals(1, plan.patchCount());
        assertEquals(0, plan.patches().get(0).repository());
    }

    @Test
    void plan_shouldDropFullInstallAndOlderPatchesForPresentRepository() {
        List<PatchDescriptor> all = List.of(
                patch(0, "2012.01.01.0000.0000", "full"),
                patch(0, "2025.05.01.0000.0000", "old"),
                patch(0, "2025.05.29.0000.0000", "same"),
                patch(0, "2025.06.01.0000.0000", "new"));

        UpdatePlan plan = planner.plan(all, local(0, "2025.05.29.0000.0000"));

        assertEquals(List.of("new.patch"), plan.patches().stream().map(PatchDescriptor::fileName).toList());
    }

    @Test
    void plan_shouldOrderByRepositoryThenVersion() {
        List<PatchDescriptor> all = List.of(
                patch(1, "2025.07.01.0000.0000", "ex1-b"),
                patch(0, "2025.07.01.0000.0000", "base-b"),
                patch(1, "2025.06.01.0000.0000", "ex1-a"),
                patch(0, "2025.06.01.0000.0000", "base-a"));

        UpdatePlan plan = planner.plan(all, local(0, "2025.05.29.0000.0000", 1, "2025.05.29.0000.0000"));

        assertEquals(List.of("base-a.patch", "base-b.patch", "ex1-a.patch", "ex1-b.patch"),
                plan.patches().stream().map(PatchDescriptor::fileName).toList());
    }

    @Test
    void plan_shouldKeepServerOrderForEqualVersions() {
        List<PatchDescriptor> all = List.of(
                patch(0, "2025.06.01.0000.0000", "part-a"),
                patch(0, "2025.06.01.0000.0000", "part-b"));

        UpdatePlan plan = planner.plan(all, local(0, "2025.05.29.0000.0000"));

        assertEquals(List.of("part-a.patch", "part-b.patch"),
                plan.patches().stream().map(PatchDescriptor::fileName).toList());
    }

    @Test
    void plan_shouldReportLatestVersionPerRepository() {
        List<PatchDescriptor> all = List.of(
                patch(0, "2025.06.01.0000.0000", "a"),
                patch(0, "2025.07.01.0000.0000", "b"),
                patch(3, "2025.06.15.0000.0000", "c"));

        UpdatePlan plan = planner.plan(all, local(0, "2025.05.29.0000.0000"));

        assertEquals("2025.07.01.0000.0000", plan.latestVersions().get(0).value());
        assertEquals("2025.06.15.0000.0000", plan.latestVersions().get(3).value());
    }

    @Test
    void plan_shouldBeIndependentOfInputOrder() {
        List<PatchDescriptor> all = new ArrayList<>();
        for (int repository = 0; repository <= 3; repository++) {
            for (int day = 1; day <= 9; day++) {
                all.add(patch(repository, "2025.06.0" + day + ".0000.0000", repository + "-" + day));
            }
        }
        VersionVector local = local(0, "2025.06.03.0000.0000", 1, "2025.06.05.0000.0000", 3, "2025.06.01.0000.0000");
        List<PatchDescriptor> expected = planner.plan(all, local).patches();

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            List<PatchDescriptor> shuffled = new ArrayList<>(all);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, planner.plan(shuffled, local).patches());
        }
        assertEquals(6 + 4 + 8, expected.size());
    }

    @Test
    void plan_shouldBeEmptyWhenUpToDate() {
        UpdatePlan plan = planner.plan(List.of(patch(0, "2025.05.29.0000.0000", "a")),
                local(0, "2025.05.29.0000.0000"));
        assertTrue(plan.isEmpty());
    }
}
