package org.civicroute.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.civicroute.engine.domain.model.CircleCoverage;
import org.civicroute.engine.domain.model.CoverageArea;
import org.civicroute.engine.domain.model.GeoPoint;
import org.civicroute.engine.domain.model.HandlingUnit;
import org.civicroute.engine.domain.model.PolygonCoverage;
import org.civicroute.engine.domain.model.StaffMember;
import org.civicroute.engine.domain.model.UnitSettings;
import org.civicroute.engine.domain.model.UnitStats;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for a department as returned by GET /departments?active=true.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class HandlingUnitDto {

    @JsonProperty("id")
    @JsonAlias("_id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("isActive")
    private boolean active = true;

    @JsonProperty("categories")
    private List<String> categories;

    @JsonProperty("coverage")
    private CoverageDto coverage;

    @JsonProperty("settings")
    private SettingsDto settings;

    @JsonProperty("stats")
    private StatsDto stats;

    @JsonProperty("staff")
    private List<StaffDto> staff;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public CoverageDto getCoverage() {
        return coverage;
    }

    public void setCoverage(CoverageDto coverage) {
        this.coverage = coverage;
    }

    public SettingsDto getSettings() {
        return settings;
    }

    public void setSettings(SettingsDto settings) {
        this.settings = settings;
    }

    public StatsDto getStats() {
        return stats;
    }

    public void setStats(StatsDto stats) {
        this.stats = stats;
    }

    public List<StaffDto> getStaff() {
        return staff;
    }

    public void setStaff(List<StaffDto> staff) {
        this.staff = staff;
    }

    /**
     * Convert to the domain model, applying store defaults for missing settings and stats.
     */
    public HandlingUnit toDomain() {
        List<StaffMember> members = new ArrayList<>();
        if (staff != null) {
            for (StaffDto dto : staff) {
                if (dto != null && dto.getId() != null) {
                    members.add(new StaffMember(dto.getId(), id, dto.getName(), dto.isActive()));
                }
            }
        }

        return new HandlingUnit.Builder()
                .id(id)
                .name(name)
                .active(active)
                .categories(categories)
                .coverage(coverage != null ? coverage.toCoverageArea() : null)
                .settings(settings != null ? settings.toDomain() : UnitSettings.defaults())
                .stats(stats != null ? stats.toDomain() : UnitStats.empty())
                .staff(members)
                .build();
    }

    /**
     * Either a circle (center + radiusMeters) or a polygon (coordinates), both in [lon, lat] order.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CoverageDto {

        @JsonProperty("type")
        private String type;

        @JsonProperty("center")
        private List<Double> center;

        @JsonProperty("radiusMeters")
        private double radiusMeters;

        @JsonProperty("coordinates")
        private List<List<Double>> coordinates;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public List<Double> getCenter() {
            return center;
        }

        public void setCenter(List<Double> center) {
            this.center = center;
        }

        public double getRadiusMeters() {
            return radiusMeters;
        }

        public void setRadiusMeters(double radiusMeters) {
            this.radiusMeters = radiusMeters;
        }

        public List<List<Double>> getCoordinates() {
            return coordinates;
        }

        public void setCoordinates(List<List<Double>> coordinates) {
            this.coordinates = coordinates;
        }

        CoverageArea toCoverageArea() {
            if ("circle".equalsIgnoreCase(type) && center != null && center.size() >= 2) {
                return new CircleCoverage(new GeoPoint(center.get(1), center.get(0)), radiusMeters);
            }
            if ("polygon".equalsIgnoreCase(type) && coordinates != null) {
                List<GeoPoint> vertices = new ArrayList<>();
                for (List<Double> pair : coordinates) {
                    vertices.add(new GeoPoint(pair.get(1), pair.get(0)));
                }
                return new PolygonCoverage(vertices);
            }
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SettingsDto {

        @JsonProperty("autoAssign")
        private boolean autoAssign = true;

        @JsonProperty("maxConcurrentIssues")
        private int maxConcurrentIssues = UnitSettings.DEFAULT_MAX_CONCURRENT_ITEMS;

        @JsonProperty("responseTimeTarget")
        private double responseTimeTarget = UnitSettings.DEFAULT_RESPONSE_TIME_TARGET_HOURS;

        public boolean isAutoAssign() {
            return autoAssign;
        }

        public void setAutoAssign(boolean autoAssign) {
            this.autoAssign = autoAssign;
        }

        public int getMaxConcurrentIssues() {
            return maxConcurrentIssues;
        }

        public void setMaxConcurrentIssues(int maxConcurrentIssues) {
            this.maxConcurrentIssues = maxConcurrentIssues;
        }

        public double getResponseTimeTarget() {
            return responseTimeTarget;
        }

        public void setResponseTimeTarget(double responseTimeTarget) {
            this.responseTimeTarget = responseTimeTarget;
        }

        UnitSettings toDomain() {
            return new UnitSettings(autoAssign, maxConcurrentIssues, responseTimeTarget);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StatsDto {

        @JsonProperty("resolutionRate")
        private Double resolutionRate;

        @JsonProperty("avgResponseTime")
        private Double avgResponseTime;

        public Double getResolutionRate() {
            return resolutionRate;
        }

        public void setResolutionRate(Double resolutionRate) {
            this.resolutionRate = resolutionRate;
        }

        public Double getAvgResponseTime() {
            return avgResponseTime;
        }

        public void setAvgResponseTime(Double avgResponseTime) {
            this.avgResponseTime = avgResponseTime;
        }

        UnitStats toDomain() {
            return new UnitStats(
                    resolutionRate != null ? resolutionRate : 0.0,
                    avgResponseTime != null ? avgResponseTime : UnitStats.DEFAULT_AVG_RESPONSE_TIME_HOURS);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StaffDto {

        @JsonProperty("id")
        @JsonAlias("_id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("isActive")
        private boolean active = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }
}
