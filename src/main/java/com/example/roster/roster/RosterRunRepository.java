package com.example.roster.roster;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RosterRunRepository extends JpaRepository<RosterRun, Long> {

    /**
     * 最新の作成結果を取得
     */
    Optional<RosterRun> findTopByOrderByCreatedAtDescIdDesc();
}
