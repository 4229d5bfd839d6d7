package com.example.roster.iteration;

public enum Phase {
    GENERATE,
    VALIDATE,
    LOOP,
    FINALIZE
}
