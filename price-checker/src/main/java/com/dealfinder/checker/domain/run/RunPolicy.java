package com.dealfinder.checker.domain.run;

import java.time.Duration;

public record RunPolicy(Duration runTimeout) {}
