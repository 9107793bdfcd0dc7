package com.synthetic.cycleengine.domain.exception;

public enum ErrorKind {
    STATE,
    VALIDATION,
    AUTHORIZATION,
    CONSISTENCY,
    STALENESS,
    NOT_FOUND
}
