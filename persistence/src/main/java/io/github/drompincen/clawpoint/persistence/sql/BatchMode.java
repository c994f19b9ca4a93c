package io.github.drompincen.clawpoint.persistence.sql;

public enum BatchMode {
    WRITE,
    READ,
    DEFERRED
}
