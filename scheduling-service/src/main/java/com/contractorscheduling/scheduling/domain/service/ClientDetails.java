package com.contractorscheduling.scheduling.domain.service;

/**
 * Who the appointment is for. Either a known client id, or a name and email for a walk-in client.
 */
public record ClientDetails(Long clientId, String name, String email, String phone, String notes) {

    public boolean identifiesClient() {
        return clientId != null || (hasText(name) && hasText(email));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
