package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Optional filters for appointment listings. A null argument leaves the listing unfiltered on that attribute.
 */
public final class AppointmentSpecifications {

    private AppointmentSpecifications() {
    }

    public static Specification<Appointment> forContractor(Long contractorId) {
        return (root, query, cb) -> cb.equal(root.get("contractorId"), contractorId);
    }

    public static Specification<Appointment> hasStatus(AppointmentStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Appointment> startsAtOrAfter(Instant from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("scheduledStart"), from);
    }

    public static Specification<Appointment> startsBefore(Instant to) {
        return (root, query, cb) -> to == null ? null : cb.lessThan(root.get("scheduledStart"), to);
    }
}
