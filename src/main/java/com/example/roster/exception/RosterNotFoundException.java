package com.example.roster.exception;

public class RosterNotFoundException extends RosterException {

    public RosterNotFoundException(Long id) {
        super("ROSTER_NOT_FOUND", id == null ? "ロスターがまだ作成されていません" : "ロスターが見つかりません: " + id);
    }
}
