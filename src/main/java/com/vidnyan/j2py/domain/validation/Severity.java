package com.vidnyan.j2py.domain.validation;

public enum Severity {
    ERROR,
    WARNING
}
