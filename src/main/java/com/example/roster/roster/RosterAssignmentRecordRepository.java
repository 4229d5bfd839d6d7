package com.example.roster.roster;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RosterAssignmentRecordRepository extends JpaRepository<RosterAssignmentRecord, Long> {

    /**
     * 指定実行の割り当てを日付順で取得
     */
    List<RosterAssignmentRecord> findByRun_IdOrderByWorkDateAscIdAsc(Long runId);
}
