package com.example.roster.roster;

import com.example.roster.iteration.TerminationReason;
import com.example.roster.report.RosterStatus;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 1回のロスター作成結果の保存レコード。
 */
@Entity
@Table(name = "roster_runs")
public class RosterRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String runKey;

    @Column(nullable = false)
    private LocalDate startDate;

    @Column(nullable = false)
    private LocalDate endDate;

    private int iterations;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private TerminationReason terminationReason;

    private int assignmentCount;
    private double totalHours;
    private int workersScheduled;
    private int violationCount;
    private int criticalCount;
    private double coveragePercent;
    private int totalSlots;
    private int filledSlots;
    private int unfilledSlots;
    private int mismatchedSlots;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RosterStatus status;

    @Column(length = 255)
    private String summary;

    // 1行1件
    @Lob
    private String recommendations;

    @Lob
    private String reportText;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("workDate ASC, id ASC")
    private List<RosterAssignmentRecord> assignments = new ArrayList<>();

    protected RosterRun() {
    }

    public RosterRun(String runKey, LocalDate startDate, LocalDate endDate) {
        this.runKey = runKey;
        this.startDate = startDate;
        this.endDate = endDate;
        this.createdAt = LocalDateTime.now();
    }

    public void addAssignment(RosterAssignmentRecord record) {
        record.setRun(this);
        assignments.add(record);
    }

    public Long getId() { return id; }
    public String getRunKey() { return runKey; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }
    public TerminationReason getTerminationReason() { return terminationReason; }
    public void setTerminationReason(TerminationReason terminationReason) { this.terminationReason = terminationReason; }
    public int getAssignmentCount() { return assignmentCount; }
    public void setAssignmentCount(int assignmentCount) { this.assignmentCount = assignmentCount; }
    public double getTotalHours() { return totalHours; }
    public void setTotalHours(double totalHours) { this.totalHours = totalHours; }
    public int getWorkersScheduled() { return workersScheduled; }
    public void setWorkersScheduled(int workersScheduled) { this.workersScheduled = workersScheduled; }
    public int getViolationCount() { return violationCount; }
    public void setViolationCount(int violationCount) { this.violationCount = violationCount; }
    public int getCriticalCount() { return criticalCount; }
    public void setCriticalCount(int criticalCount) { this.criticalCount = criticalCount; }
    public double getCoveragePercent() { return coveragePercent; }
    public void setCoveragePercent(double coveragePercent) { this.coveragePercent = coveragePercent; }
    public RosterStatus getStatus() { return status; }
    public void setStatus(RosterStatus status) { this.status = status; }
    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }
    public int getTotalSlots() { return totalSlots; }
    public void setTotalSlots(int totalSlots) { this.totalSlots = totalSlots; }
    public int getFilledSlots() { return filledSlots; }
    public void setFilledSlots(int filledSlots) { this.filledSlots = filledSlots; }
    public int getUnfilledSlots() { return unfilledSlots; }
    public void setUnfilledSlots(int unfilledSlots) { this.unfilledSlots = unfilledSlots; }
    public int getMismatchedSlots() { return mismatchedSlots; }
    public void setMismatchedSlots(int mismatchedSlots) { this.mismatchedSlots = mismatchedSlots; }

    public List<String> getRecommendations() {
        if (recommendations == null || recommendations.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(recommendations.split("\n"));
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = String.join("\n", recommendations);
    }

    public String getReportText() { return reportText; }
    public void setReportText(String reportText) { this.reportText = reportText; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public List<RosterAssignmentRecord> getAssignments() { return assignments; }
}
