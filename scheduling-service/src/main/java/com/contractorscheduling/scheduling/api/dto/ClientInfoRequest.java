package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.service.ClientDetails;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record ClientInfoRequest(
        Long clientId,

        @Size(max = 200, message = "Name is too long")
        String name,

        @Email(message = "Email must be a valid address")
        String email,

        @Size(max = 50, message = "Phone is too long")
        String phone,

        @Size(max = 2000, message = "Notes are too long")
        String notes
) {
    public ClientDetails toDetails() {
        return new ClientDetails(clientId, name, email, phone, notes);
    }
}
