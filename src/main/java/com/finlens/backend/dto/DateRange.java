package com.finlens.backend.dto;

import java.time.LocalDate;

public record DateRange(LocalDate start, LocalDate end, long days) {
}
