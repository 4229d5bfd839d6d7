package com.example.roster.engine;

import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.ManagerPool.Manager;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * 店舗・日付ごとに責任者を割り当てる。1グループあたりの人数は上限を超えない。
 */
public class ManagerAllocator {

    private final ManagerPool pool;
    private final int maxPerStorePerDay;
    private final Random random;
    private final Map<StoreDay, Set<Manager>> used = new HashMap<>();

    public ManagerAllocator(ManagerPool pool, int maxPerStorePerDay, Random random) {
        this.pool = pool;
        this.maxPerStorePerDay = Math.max(1, maxPerStorePerDay);
        this.random = random;
    }

    public Optional<Manager> allocate(String store, LocalDate date) {
        if (pool.isEmpty()) {
            return Optional.empty();
        }
        Set<Manager> group = used.computeIfAbsent(new StoreDay(store, date), k -> new LinkedHashSet<>());
        Manager chosen;
        if (group.size() < maxPerStorePerDay) {
            List<Manager> fresh = new ArrayList<>();
            for (Manager m : pool.managers()) {
                if (!group.contains(m)) {
                    fresh.add(m);
                }
            }
            List<Manager> candidates = fresh.isEmpty() ? pool.managers() : fresh;
            chosen = candidates.get(random.nextInt(candidates.size()));
        } else {
            List<Manager> existing = new ArrayList<>(group);
            chosen = existing.get(random.nextInt(existing.size()));
        }
        group.add(chosen);
        return Optional.of(chosen);
    }

    public int distinctManagers(String store, LocalDate date) {
        return used.getOrDefault(new StoreDay(store, date), Set.of()).size();
    }

    private record StoreDay(String store, LocalDate date) {
    }
}
