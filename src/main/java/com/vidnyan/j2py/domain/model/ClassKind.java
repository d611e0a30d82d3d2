package com.vidnyan.j2py.domain.model;

public enum ClassKind {
    CLASS,
    INTERFACE
}
