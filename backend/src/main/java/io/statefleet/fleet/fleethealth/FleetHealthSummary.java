package io.statefleet.fleet.fleethealth;

/**
 * Per-status vehicle counts for a fleet report.
 *
 * @param critical flagged vehicles with CRITICAL status
 * @param warning flagged vehicles with WARNING status
 * @param ok vehicles with history and no issues
 * @param noData vehicles with neither inspections nor maintenance
 * @param totalActive number of active vehicles evaluated
 */
public record FleetHealthSummary(int critical, int warning, int ok, int noData, int totalActive) {}
