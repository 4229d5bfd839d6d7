package com.example.roster.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Shift managers available to a run. Managers are rostered separately from the staff list, so the pool is
 * made of generated names; the same seed always yields the same pool.
 */
public final class ManagerPool {

    public static final int MINIMUM_SIZE = 20;

    private static final List<String> FIRST_NAMES = List.of(
            "Alex", "Jordan", "Taylor", "Morgan", "Casey", "Riley", "Avery", "Quinn", "Blake", "Cameron",
            "Dakota", "Emery", "Finley", "Harper", "Hayden", "Jamie", "Kai", "Logan", "Parker", "Reese",
            "River", "Sage", "Skylar");
    private static final List<String> LAST_NAMES = List.of(
            "Anderson", "Brown", "Davis", "Garcia", "Harris", "Jackson", "Johnson", "Jones", "Lee", "Martinez",
            "Miller", "Moore", "Robinson", "Smith", "Taylor", "Thomas", "Thompson", "Walker", "White", "Williams",
            "Wilson", "Wright", "Young");

    private final List<Manager> managers;
    private final Set<String> ids;

    public ManagerPool(List<Manager> managers) {
        this.managers = List.copyOf(managers);
        Set<String> set = new HashSet<>();
        this.managers.forEach(m -> set.add(m.id()));
        this.ids = Collections.unmodifiableSet(set);
    }

    /**
     * At least {@value #MINIMUM_SIZE} managers, or one per two workers when the staff list is larger.
     */
    public static ManagerPool generate(int workerCount, long seed) {
        int size = Math.min(Math.max(MINIMUM_SIZE, workerCount / 2), FIRST_NAMES.size() * LAST_NAMES.size());
        Random random = new Random(seed);
        Set<String> used = new HashSet<>();
        List<Manager> list = new ArrayList<>(size);
        while (list.size() < size) {
            String name = FIRST_NAMES.get(random.nextInt(FIRST_NAMES.size())) + " "
                    + LAST_NAMES.get(random.nextInt(LAST_NAMES.size()));
            if (used.add(name)) {
                list.add(new Manager(String.format("MGR-%02d", list.size() + 1), name));
            }
        }
        return new ManagerPool(list);
    }

    public List<Manager> managers() {
        return managers;
    }

    public boolean contains(String managerId) {
        return managerId != null && ids.contains(managerId);
    }

    public boolean isEmpty() {
        return managers.isEmpty();
    }

    public int size() {
        return managers.size();
    }

    public record Manager(String id, String name) {
    }
}
