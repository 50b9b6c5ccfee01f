package com.dealfinder.checker.domain.run;

public interface RunSummaryPublisher {

    void publish(RunSummary summary);
}
