package io.statefleet.fleet.analytics.dto;

import java.math.BigDecimal;

public record SupplierSpend(String name, BigDecimal total) {}
