package com.example.roster.schedule;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.worker.Horizon;
import com.example.roster.worker.Worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inputs of one roster run. Workers and catalog are shared read-only by every component of the run.
 */
public final class RosterInput {

    private final List<Worker> workers;
    private final ConstraintCatalog catalog;
    private final Horizon horizon;
    private final Map<String, Worker> workersById;

    public RosterInput(List<Worker> workers, ConstraintCatalog catalog, Horizon horizon) {
        this.workers = workers == null ? List.of() : List.copyOf(workers);
        this.catalog = catalog;
        this.horizon = horizon;
        Map<String, Worker> byId = new LinkedHashMap<>();
        for (Worker w : this.workers) {
            byId.putIfAbsent(w.id(), w);
        }
        this.workersById = Collections.unmodifiableMap(byId);
    }

    public List<Worker> workers() {
        return workers;
    }

    public ConstraintCatalog catalog() {
        return catalog;
    }

    public Horizon horizon() {
        return horizon;
    }

    public Optional<Worker> worker(String id) {
        return Optional.ofNullable(workersById.get(id));
    }
}
