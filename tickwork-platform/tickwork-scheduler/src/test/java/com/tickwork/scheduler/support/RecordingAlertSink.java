package com.tickwork.scheduler.support;

import com.tickwork.scheduler.alert.AlertType;
import com.tickwork.scheduler.alert.JobAlert;
import com.tickwork.scheduler.alert.JobAlertSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingAlertSink implements JobAlertSink {

    private final List<JobAlert> alerts = new CopyOnWriteArrayList<>();

    @Override
    public void raise(JobAlert alert) {
        alerts.add(alert);
    }

    public List<JobAlert> alerts() {
        return List.copyOf(alerts);
    }

    public List<JobAlert> ofType(AlertType type) {
        return alerts.stream().filter(a -> a.type() == type).collect(Collectors.toList());
    }
}
