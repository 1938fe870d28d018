package de.bsommerfeld.xivpatch.updater.plan;

import de.bsommerfeld.xivpatch.updater.model.GameVersion;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.UpdatePlan;
import de.bsommerfeld.xivpatch.updater.model.VersionVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reduces the server's patch list to the patches the local installation
 * still needs.
 *
 * <h3>Selection per repository</h3>
 * <ul>
 * <li>Base game not installed: every base patch is needed, full install
 * packages included.</li>
 * <li>Expansion not installed: skipped. Expansions are installed by the base
 * patches that introduce them, not by this planner.</li>
 * <li>Installed: full install packages are dropped, and only versions
 * strictly newer than the local one are kept.</li>
 * </ul>
 *
 * <p>
 * The result is ordered by ascending repository id, then ascending version.
 * The sort is stable, so multi-part patches sharing a version keep the
 * server's order.
 */
public class PatchPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(PatchPlanner.class);

    public UpdatePlan plan(List<PatchDescriptor> available, VersionVector local) {
        Map<Integer, List<PatchDescriptor>> byRepository = new TreeMap<>();
        Map<Integer, GameVersion> latest = new HashMap<>();
        for (PatchDescriptor patch : available) {
            byRepository.computeIfAbsent(patch.repository(), r -> new ArrayList<>()).add(patch);
            latest.merge(patch.repository(), patch.version(), (a, b) -> a.compareTo(b) >= 0 ? a : b);
        }

        List<PatchDescriptor> selected = new ArrayList<>();
        for (Map.Entry<Integer, List<PatchDescriptor>> entry : byRepository.entrySet()) {
            int repository = entry.getKey();
            Optional<GameVersion> installed = local.get(repository);
            List<PatchDescriptor> needed = new ArrayList<>();

            if (installed.isEmpty()) {
                if (repository != VersionVector.BASE) {
                    LOG.debug("Skipping ex{}, not installed", repository);
                    continue;
                }
                needed.addAll(entry.getValue());
            } else {
                for (PatchDescriptor patch : entry.getValue()) {
                    if (!patch.isFullInstallPackage() && patch.version().isNewerThan(installed.get())) {
                        needed.add(patch);
                    }
                }
            }

            needed.sort(Comparator.comparing(PatchDescriptor::version));
            selected.addAll(needed);
        }

        UpdatePlan plan = new UpdatePlan(selected, local, latest);
        LOG.info("Planned {} patch(es), {} in total, against {}",
                plan.patchCount(), plan.formattedTotalSize(), local);
        return plan;
    }
}
