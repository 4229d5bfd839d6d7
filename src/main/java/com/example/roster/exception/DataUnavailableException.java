package com.example.roster.exception;

/**
 * 作成対象のデータがない（従業員ゼロ、制約未設定）。反復を始める前に投げる。
 */
public class DataUnavailableException extends RosterException {

    public static final String NO_WORKERS = "NO_WORKERS";
    public static final String NO_CONSTRAINTS = "NO_CONSTRAINTS";

    public DataUnavailableException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static DataUnavailableException noWorkers() {
        return new DataUnavailableException(NO_WORKERS, "従業員データがありません");
    }

    public static DataUnavailableException noConstraints() {
        return new DataUnavailableException(NO_CONSTRAINTS, "制約条件が設定されていません");
    }
}
