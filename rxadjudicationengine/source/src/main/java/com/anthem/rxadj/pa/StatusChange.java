package com.anthem.rxadj.pa;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class StatusChange {
    PriorAuthStatus status;
    LocalDateTime timestamp;
    String note;
}
