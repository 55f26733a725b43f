package com.library.circulation.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record FeePaymentRequest(@NotNull @DecimalMin("0.01") BigDecimal amount) {
}
