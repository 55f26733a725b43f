package com.library.circulation.controller.dto;

import jakarta.validation.constraints.Min;

public record CopiesRequest(@Min(1) int count) {
}
