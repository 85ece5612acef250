package de.bycsitsm.calsync.ics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies an ordered list of {@link IcsRepairPass repair passes}.
 */
public final class IcsRepairPipeline {

    private static final Logger log = LoggerFactory.getLogger(IcsRepairPipeline.class);

    private final String name;
    private final List<IcsRepairPass> passes;

    public IcsRepairPipeline(String name, List<IcsRepairPass> passes) {
        this.name = name;
        this.passes = List.copyOf(passes);
    }

    /**
     * Repairs applied to every incoming object before the standards parse.
     */
    public static IcsRepairPipeline preClean() {
        return new IcsRepairPipeline("pre-clean", List.of(
                IcsRepairPasses.brokenAttendeeFolding(),
                IcsRepairPasses.scheduleStatusInRrule()));
    }

    /**
     * Repairs applied only after the standards parse rejected an object.
     */
    public static IcsRepairPipeline aggressive() {
        return new IcsRepairPipeline("aggressive", List.of(
                IcsRepairPasses.rruleAttendeeFragments(),
                IcsRepairPasses.rruleTruncation(),
                IcsRepairPasses.danglingMailto()));
    }

    public String apply(String ics) {
        var current = ics;
        for (var pass : passes) {
            var repaired = pass.repair(current);
            if (!repaired.equals(current)) {
                log.debug("{} pass '{}' modified the calendar data", name, pass.name());
            }
            current = repaired;
        }
        return current;
    }

    public List<IcsRepairPass> passes() {
        return passes;
    }
}
