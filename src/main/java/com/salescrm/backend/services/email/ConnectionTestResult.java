package com.salescrm.backend.services.email;

public record ConnectionTestResult(boolean success, String message) {
}
