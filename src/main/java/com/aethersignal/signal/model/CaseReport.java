/* (C)2026 */
package com.aethersignal.signal.model;

import java.time.LocalDate;

/**
 * One individual case safety report as held by the in-memory metrics provider.
 */
public record CaseReport(
        String caseId,
        String drug,
        String reaction,
        boolean serious,
        LocalDate eventDate,
        Integer ageYears,
        String region,
        String outcome,
        String source,
        Integer timeToOnsetDays) {}
