package com.anthem.rxadj.pa;

public enum Urgency {
    ROUTINE,
    URGENT,
    EMERGENCY
}
