package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.scheduling.config.RetryConfig;
import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.BufferMode;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.domain.repository.AppointmentStatusChangeRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import com.contractorscheduling.scheduling.domain.service.BookingCommand;
import com.contractorscheduling.scheduling.domain.service.ClientDetails;
import com.contractorscheduling.scheduling.exception.BookingConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.CONTRACTOR_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.MONDAY;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.NOW;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.SERVICE_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.at;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.service;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.weekdaySchedule;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races real bookings against PostgreSQL to check that the row-lock and version-check strategies
 * never let two overlapping appointments for one contractor commit, buffers included.
 *
 * Only the JPA layer and the strategies are loaded (no Redis, Kafka or Feign).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.contractorscheduling.scheduling.domain.model")
@Import({
        PessimisticLockBookingStrategy.class,
        OptimisticLockBookingStrategy.class,
        LedgerCommitSupport.class,
        AvailabilityCalculator.class,
        RetryConfig.class,
        BookingConcurrencyIntegrationTest.FixedClockConfig.class
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class BookingConcurrencyIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("scheduling_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
        registry.add("spring.flyway.enabled", () -> "false");
        registry.add("scheduling.ledger.retry.initial-backoff-ms", () -> "10");
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    @Qualifier("pessimistic")
    private BookingStrategy pessimistic;

    @Autowired
    @Qualifier("optimistic")
    private BookingStrategy optimistic;

    @Autowired
    private ContractorLedgerRepository ledgerRepository;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private AppointmentStatusChangeRepository statusChangeRepository;

    @BeforeEach
    void seedLedger() {
        ledgerRepository.saveAndFlush(ContractorLedger.builder()
                .contractorId(CONTRACTOR_ID)
                .bookingSequence(0L)
                .build());
    }

    @AfterEach
    void cleanUp() {
        statusChangeRepository.deleteAll();
        appointmentRepository.deleteAll();
        ledgerRepository.deleteAll();
    }

    @Test
    @DisplayName("Row lock: of two simultaneous bookings for the same slot exactly one commits")
    void pessimistic_sameSlot_oneWinner() throws Exception {
        List<Outcome> outcomes = race(pessimistic, List.of(at(MONDAY, 10, 0), at(MONDAY, 10, 0)));

        assertThat(outcomes).filteredOn(Outcome::booked).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o.failure() instanceof BookingConflictException).hasSize(1);
        assertThat(appointmentRepository.count()).isEqualTo(1);
        assertThat(ledgerRepository.findById(CONTRACTOR_ID).orElseThrow().getBookingSequence()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Version check: the losing booking retries, sees the winner and reports a conflict")
    void optimistic_sameSlot_oneWinner() throws Exception {
        List<Outcome> outcomes = race(optimistic, List.of(at(MONDAY, 10, 0), at(MONDAY, 10, 0)));

        assertThat(outcomes).filteredOn(Outcome::booked).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o.failure() instanceof BookingConflictException).hasSize(1);
        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Non-overlapping bookings for the same contractor all commit")
    void pessimistic_disjointSlots_allCommit() throws Exception {
        List<Outcome> outcomes = race(pessimistic, List.of(at(MONDAY, 9, 0), at(MONDAY, 10, 0), at(MONDAY, 11, 0)));

        assertThat(outcomes).allMatch(Outcome::booked);
        assertThat(ledgerRepository.findById(CONTRACTOR_ID).orElseThrow().getBookingSequence()).isEqualTo(3L);
    }

    @ParameterizedTest(name = "{0} strategy, {1} buffer")
    @CsvSource({
            "pessimistic, SYMMETRIC",
            "pessimistic, SHARED",
            "optimistic, SYMMETRIC",
            "optimistic, SHARED"
    })
    @DisplayName("Randomized overlapping requests never leave two buffered busy intervals overlapping")
    void randomOverlaps_respectBuffer(String strategyName, BufferMode bufferMode) throws Exception {
        Duration buffer = Duration.ofMinutes(15);
        ScheduleSnapshot schedule = weekdaySchedule().buffer(buffer).bufferMode(bufferMode).build();
        // Neighbours must be two buffers apart when both are padded, one buffer apart otherwise.
        Duration requiredGap = bufferMode == BufferMode.SYMMETRIC ? buffer.multipliedBy(2) : buffer;

        Random random = new Random(20261102L);
        List<Instant> starts = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            starts.add(at(MONDAY, 9, 0).plus(Duration.ofMinutes(15L * random.nextInt(24))));
        }

        race(strategyName.equals("pessimistic") ? pessimistic : optimistic, schedule, starts);

        List<Appointment> active = appointmentRepository.findIntersecting(
                CONTRACTOR_ID, AppointmentStatus.ACTIVE, at(MONDAY, 0, 0), at(MONDAY.plusDays(1), 0, 0));
        assertThat(active).isNotEmpty();
        for (int i = 0; i < active.size(); i++) {
            for (int j = i + 1; j < active.size(); j++) {
                Appointment a = active.get(i);
                Appointment b = active.get(j);
                boolean tooClose = a.getScheduledStart().isBefore(b.getScheduledEnd().plus(requiredGap))
                        && b.getScheduledStart().isBefore(a.getScheduledEnd().plus(requiredGap));
                assertThat(tooClose)
                        .as("%s (%s) and %s (%s) closer than %s", a.getId(), a.getScheduledStart(),
                                b.getId(), b.getScheduledStart(), requiredGap)
                        .isFalse();
            }
        }
    }

    @Test
    @DisplayName("Version check: back-to-back requests inside the shared buffer let only one commit")
    void optimistic_sharedBuffer_oneWinner() throws Exception {
        ScheduleSnapshot schedule = weekdaySchedule()
                .buffer(Duration.ofMinutes(15))
                .bufferMode(BufferMode.SHARED)
                .build();

        List<Outcome> outcomes = race(optimistic, schedule, List.of(at(MONDAY, 10, 0), at(MONDAY, 11, 0)));

        assertThat(outcomes).filteredOn(Outcome::booked).hasSize(1);
        assertThat(appointmentRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("findIntersecting returns appointments that start before the range and run into it")
    void findIntersecting_spanningAppointment() throws Exception {
        race(pessimistic, List.of(at(MONDAY, 16, 0)));

        List<Appointment> found = appointmentRepository.findIntersecting(
                CONTRACTOR_ID, AppointmentStatus.ACTIVE, at(MONDAY, 16, 30), at(MONDAY, 18, 0));
        List<Appointment> adjacent = appointmentRepository.findIntersecting(
                CONTRACTOR_ID, AppointmentStatus.ACTIVE, at(MONDAY, 17, 0), at(MONDAY, 18, 0));

        assertThat(found).hasSize(1);
        assertThat(adjacent).isEmpty();
    }

    private List<Outcome> race(BookingStrategy strategy, List<Instant> starts) throws InterruptedException {
        return race(strategy, weekdaySchedule().build(), starts);
    }

    private List<Outcome> race(BookingStrategy strategy, ScheduleSnapshot schedule, List<Instant> starts)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(starts.size());
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<Appointment>> futures = new ArrayList<>();
        for (Instant start : starts) {
            Callable<Appointment> booking = () -> {
                ready.await();
                return strategy.commit(draft(schedule, start));
            };
            futures.add(executor.submit(booking));
        }
        ready.countDown();

        List<Outcome> outcomes = new ArrayList<>();
        for (Future<Appointment> future : futures) {
            try {
                outcomes.add(new Outcome(future.get(30, TimeUnit.SECONDS), null));
            } catch (ExecutionException e) {
                outcomes.add(new Outcome(null, e.getCause()));
            } catch (java.util.concurrent.TimeoutException e) {
                outcomes.add(new Outcome(null, e));
            }
        }
        executor.shutdownNow();
        return outcomes;
    }

    private static BookingDraft draft(ScheduleSnapshot schedule, Instant start) {
        BookingCommand command = new BookingCommand(CONTRACTOR_ID, SERVICE_ID, start,
                new ClientDetails(7L, null, null, null, null), null, "client");
        return new BookingDraft(command, schedule, service(60), false, BigDecimal.ZERO);
    }

    private record Outcome(Appointment appointment, Throwable failure) {
        boolean booked() {
            return appointment != null;
        }
    }
}
