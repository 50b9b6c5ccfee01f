package com.dealfinder.checker.domain.cost;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Budget held for one chargeable call until it is committed. */
public record Reservation(BillableApi api, BigDecimal estimated, LocalDate dateBucket) {}
