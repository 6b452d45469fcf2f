package com.anthem.rxadj.pa;

public enum PriorAuthRequestType {
    INITIAL,
    RENEWAL
}
