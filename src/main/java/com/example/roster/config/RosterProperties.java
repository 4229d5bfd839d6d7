package com.example.roster.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * application.yml の {@code roster.*} 設定。
 */
@Validated
@ConfigurationProperties(prefix = "roster")
public class RosterProperties {

    @Valid
    private Constraints constraints = new Constraints();
    @Valid
    private List<Shift> shifts = new ArrayList<>();
    @Valid
    private List<Store> stores = new ArrayList<>();
    private List<String> flexibleCodes = new ArrayList<>(List.of("1F", "2F", "3F"));
    private List<Double> restThresholds = new ArrayList<>(List.of(7.0, 8.0, 8.5, 9.0, 9.5));
    @Valid
    private Iteration iteration = new Iteration();

    public Constraints getConstraints() { return constraints; }
    public void setConstraints(Constraints constraints) { this.constraints = constraints; }
    public List<Shift> getShifts() { return shifts; }
    public void setShifts(List<Shift> shifts) { this.shifts = shifts; }
    public List<Store> getStores() { return stores; }
    public void setStores(List<Store> stores) { this.stores = stores; }
    public List<String> getFlexibleCodes() { return flexibleCodes; }
    public void setFlexibleCodes(List<String> flexibleCodes) { this.flexibleCodes = flexibleCodes; }
    public List<Double> getRestThresholds() { return restThresholds; }
    public void setRestThresholds(List<Double> restThresholds) { this.restThresholds = restThresholds; }
    public Iteration getIteration() { return iteration; }
    public void setIteration(Iteration iteration) { this.iteration = iteration; }

    public static class Constraints {
        @Positive
        private double minShiftHours = 3.0;
        @Positive
        private double maxShiftHours = 12.0;
        @Positive
        private double minRestHours = 10.0;
        @Positive
        private double dailyHourCap = 12.0;
        /** Keys are full-time, part-time, casual. */
        private Map<String, Double> weeklyHourCaps = new LinkedHashMap<>(Map.of(
                "full-time", 38.0, "part-time", 30.0, "casual", 40.0));
        @Min(1)
        private int maxManagersPerStorePerDay = 10;

        public double getMinShiftHours() { return minShiftHours; }
        public void setMinShiftHours(double minShiftHours) { this.minShiftHours = minShiftHours; }
        public double getMaxShiftHours() { return maxShiftHours; }
        public void setMaxShiftHours(double maxShiftHours) { this.maxShiftHours = maxShiftHours; }
        public double getMinRestHours() { return minRestHours; }
        public void setMinRestHours(double minRestHours) { this.minRestHours = minRestHours; }
        public double getDailyHourCap() { return dailyHourCap; }
        public void setDailyHourCap(double dailyHourCap) { this.dailyHourCap = dailyHourCap; }
        public Map<String, Double> getWeeklyHourCaps() { return weeklyHourCaps; }
        public void setWeeklyHourCaps(Map<String, Double> weeklyHourCaps) { this.weeklyHourCaps = weeklyHourCaps; }
        public int getMaxManagersPerStorePerDay() { return maxManagersPerStorePerDay; }
        public void setMaxManagersPerStorePerDay(int maxManagersPerStorePerDay) { this.maxManagersPerStorePerDay = maxManagersPerStorePerDay; }
    }

    public static class Shift {
        @NotBlank
        private String code;
        private String time = "TBD";
        @PositiveOrZero
        private double hours;
        private String name;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }
        public String getTime() { return time; }
        public void setTime(String time) { this.time = time; }
        public double getHours() { return hours; }
        public void setHours(double hours) { this.hours = hours; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    public static class Store {
        @NotBlank
        private String name;
        @PositiveOrZero
        private double trafficWeight;
        @Valid
        private List<Station> stations = new ArrayList<>();
        @Valid
        private List<Peak> peakWindows = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public double getTrafficWeight() { return trafficWeight; }
        public void setTrafficWeight(double trafficWeight) { this.trafficWeight = trafficWeight; }
        public List<Station> getStations() { return stations; }
        public void setStations(List<Station> stations) { this.stations = stations; }
        public List<Peak> getPeakWindows() { return peakWindows; }
        public void setPeakWindows(List<Peak> peakWindows) { this.peakWindows = peakWindows; }
    }

    public static class Station {
        @NotBlank
        private String name;
        @PositiveOrZero
        private int minimum;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getMinimum() { return minimum; }
        public void setMinimum(int minimum) { this.minimum = minimum; }
    }

    public static class Peak {
        /** MONDAY..SUNDAY; empty for every day. */
        private List<String> days = new ArrayList<>();
        @NotBlank
        private String start;
        @NotBlank
        private String end;

        public List<String> getDays() { return days; }
        public void setDays(List<String> days) { this.days = days; }
        public String getStart() { return start; }
        public void setStart(String start) { this.start = start; }
        public String getEnd() { return end; }
        public void setEnd(String end) { this.end = end; }
    }

    public static class Iteration {
        @Min(1)
        private int maxIterations = 5;
        @Min(1)
        private int interactiveMaxIterations = 7;
        private long baseSeed = 42;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getInteractiveMaxIterations() { return interactiveMaxIterations; }
        public void setInteractiveMaxIterations(int interactiveMaxIterations) { this.interactiveMaxIterations = interactiveMaxIterations; }
        public long getBaseSeed() { return baseSeed; }
        public void setBaseSeed(long baseSeed) { this.baseSeed = baseSeed; }
    }
}
