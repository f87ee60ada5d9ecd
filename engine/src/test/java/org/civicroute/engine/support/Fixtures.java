package org.civicroute.engine.support;

import org.civicroute.engine.domain.model.CircleCoverage;
import org.civicroute.engine.domain.model.GeoPoint;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.ItemStatus;
import org.civicroute.engine.domain.model.Priority;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.domain.model.UnitSettings;
import org.civicroute.engine.domain.model.UnitStats;
import org.civicroute.engine.domain.model.WorkItem;

/**
 * Shared test data around a city centre point.
 */
public final class Fixtures {

    public static final String WATER = "Water Supply";
    public static final String WASTE = "Waste Management";
    public static final String TRAFFIC = "Traffic Management";

    public static final GeoPoint CITY_CENTRE = new GeoPoint(23.3441, 85.3096);
    public static final GeoPoint FAR_AWAY = new GeoPoint(28.6139, 77.2090);

    private Fixtures() {
    }

    public static HandlingUnit.Builder unit(String id, String... categories) {
        HandlingUnit.Builder builder = new HandlingUnit.Builder()
                .id(id)
                .name("Dept " + id)
                .coverage(new CircleCoverage(CITY_CENTRE, 10_000))
                .settings(new UnitSettings(true, 10, 24))
                .stats(new UnitStats(50, 20));
        for (String category : categories) {
            builder.category(category);
        }
        return builder;
    }

    public static StaffMember staff(String id, String unitId, boolean active) {
        return new StaffMember(id, unitId, "Worker " + id, active);
    }

    public static WorkItem.Builder item(String id, String category) {
        return new WorkItem.Builder()
                .id(id)
                .title("Issue " + id)
                .category(category)
                .location(CITY_CENTRE)
                .priority(Priority.MEDIUM)
                .status(ItemStatus.NEW)
                .reporterId("citizen-" + id);
    }
}
