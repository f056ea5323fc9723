package com.campus.lending.dto.response;

import java.util.Map;

public record DashboardResponse(
    UserResponse user,
    Map<String, Long> counters
) {}
