package com.example.roster.roster;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * ロスター作成リクエスト。従業員の希望は日番号(1〜14) → シフトコード。
 *
 * @param maxIterations 省略時は設定値
 */
public record RosterRequest(@NotNull LocalDate startDate,
                            @NotNull List<@Valid WorkerEntry> workers,
                            @Min(1) @Max(10) Integer maxIterations) {

    public record WorkerEntry(@NotBlank String id,
                              String name,
                              String employmentType,
                              String station,
                              Map<Integer, String> availability) {
    }
}
