package com.campus.lending.dto.response;

import java.util.List;

/** Chart-ready series: {@code labels[i]} is an equipment name, {@code values[i]} its item count. */
public record ReservationStatsResponse(
    List<String> labels,
    List<Long> values
) {}
