package com.example.roster.schedule;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assignments for the whole horizon in generation order. Each iteration builds a new one.
 */
public record Schedule(LocalDate startDate, LocalDate endDate, List<Assignment> assignments) {

    public Schedule {
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    public int shiftCount() {
        return assignments.size();
    }

    public double totalHours() {
        return assignments.stream().mapToDouble(Assignment::hours).sum();
    }

    public Set<String> distinctWorkers() {
        Set<String> ids = new LinkedHashSet<>();
        assignments.forEach(a -> ids.add(a.workerId()));
        return ids;
    }

    public Optional<Assignment> find(String workerId, LocalDate date) {
        return assignments.stream()
                .filter(a -> a.workerId().equals(workerId) && a.date().equals(date))
                .findFirst();
    }

    public List<Assignment> forWorker(String workerId) {
        return assignments.stream().filter(a -> a.workerId().equals(workerId)).toList();
    }
}
