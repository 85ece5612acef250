package de.bycsitsm.calsync.ics;

import java.util.function.UnaryOperator;

/**
 * A named, side-effect free text transformation that repairs one known kind of
 * corruption in iCalendar data. Passes must leave input they do not recognize
 * unchanged.
 */
public interface IcsRepairPass {

    String name();

    String repair(String ics);

    static IcsRepairPass of(String name, UnaryOperator<String> repair) {
        return new IcsRepairPass() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String repair(String ics) {
                return repair.apply(ics);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
