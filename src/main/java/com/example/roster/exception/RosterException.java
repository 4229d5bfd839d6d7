package com.example.roster.exception;

/**
 * ロスター作成処理の業務例外。エラーコードを持つ。
 */
public class RosterException extends RuntimeException {

    private final String errorCode;

    public RosterException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
