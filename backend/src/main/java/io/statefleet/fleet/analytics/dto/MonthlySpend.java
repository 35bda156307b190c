package io.statefleet.fleet.analytics.dto;

import java.math.BigDecimal;

/** Total maintenance spend for one calendar month, {@code month} formatted as {@code YYYY-MM}. */
public record MonthlySpend(String month, BigDecimal total) {}
