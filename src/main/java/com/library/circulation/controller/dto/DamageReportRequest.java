package com.library.circulation.controller.dto;

import jakarta.validation.constraints.Size;

public record DamageReportRequest(@Size(max = 500) String notes) {
}
