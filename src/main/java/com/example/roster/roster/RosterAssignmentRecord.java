package com.example.roster.roster;

import com.example.roster.catalog.EmploymentClass;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.AssignmentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.time.LocalDate;

@Entity
@Table(name = "roster_assignments")
public class RosterAssignmentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private RosterRun run;

    @Column(nullable = false)
    private LocalDate workDate;

    @Column(nullable = false, length = 16)
    private String weekday;

    @Column(nullable = false)
    private String workerId;

    private String workerName;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EmploymentClass employmentClass;

    @Column(nullable = false, length = 16)
    private String shiftCode;

    @Column(length = 32)
    private String shiftTime;

    private double hours;
    private String store;
    private String station;
    private String managerId;
    private String managerName;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AssignmentStatus status;

    protected RosterAssignmentRecord() {
    }

    public static RosterAssignmentRecord from(Assignment a) {
        RosterAssignmentRecord r = new RosterAssignmentRecord();
        r.workDate = a.date();
        r.weekday = a.weekday();
        r.workerId = a.workerId();
        r.workerName = a.workerName();
        r.employmentClass = a.employmentClass();
        r.shiftCode = a.shiftCode();
        r.shiftTime = a.shiftTime();
        r.hours = a.hours();
        r.store = a.store();
        r.station = a.station();
        r.managerId = a.managerId();
        r.managerName = a.managerName();
        r.status = a.status();
        return r;
    }

    public Assignment toAssignment() {
        return new Assignment(workDate, weekday, workerId, workerName, employmentClass, shiftCode, shiftTime,
                hours, store, station, managerId, managerName, status);
    }

    public Long getId() { return id; }
    public RosterRun getRun() { return run; }
    void setRun(RosterRun run) { this.run = run; }
    public LocalDate getWorkDate() { return workDate; }
    public String getWorkerId() { return workerId; }
    public String getShiftCode() { return shiftCode; }
}
