package com.keystone.accessservice.api;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

/**
 * @param framework framework id, e.g. {@code soc2}
 * @param startDate period start (default 90 days before the end)
 * @param endDate   period end (default now)
 */
public record GenerateReportRequest(@NotBlank String framework, Instant startDate, Instant endDate) {
}
