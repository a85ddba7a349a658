package com.demo.altcredit.service.refresh;

public enum RefresherState {
    STOPPED,
    SCHEDULED,
    RUNNING
}
