package com.jobbus;

public enum TestSubscription {
    Orders_Billing,
    Orders_Audit,
    JobDefinitions_ScheduleFirstRun,
    WindowReady_ScheduleNextRun,
    WindowReady_Recorder,
    PermanentErrors_Inspector
}
