package com.flagship.vacation_ledger.request;

import com.flagship.vacation_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VacationRequestSearchRepositoryTest extends PostgresIntegrationTest {

    @Autowired
    private VacationRequestSearchRepository searchRepository;

    private Long anaId;
    private Long conradId;
    private Long conferencePending;
    private Long beachPending;
    private Long conferenceApproved;
    private Long conradPending;

    @BeforeEach
    void setUp() {
        anaId = insertEmployee("Ana Lopez", 20);
        conradId = insertEmployee("Conrad Fisher", 20);

        conferencePending = insertRequestRow(anaId, LocalDate.of(2025, 3, 3), LocalDate.of(2025, 3, 4),
            "Tech Conference in Berlin", "PENDING", Instant.parse("2025-01-05T10:00:00Z"));
        beachPending = insertRequestRow(anaId, LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 6),
            "Beach", "PENDING", Instant.parse("2025-01-07T10:00:00Z"));
        conferenceApproved = insertRequestRow(anaId, LocalDate.of(2025, 2, 3), LocalDate.of(2025, 2, 4),
            "conference follow-up", "APPROVED", Instant.parse("2025-01-03T10:00:00Z"));
        conradPending = insertRequestRow(conradId, LocalDate.of(2025, 4, 14), LocalDate.of(2025, 4, 15),
            "Moving house", "PENDING", Instant.parse("2025-01-06T10:00:00Z"));
    }

    private static List<Long> ids(List<VacationRequestView> views) {
        return views.stream().map(v -> v.getRequest().getId()).toList();
    }

    @Test
    @DisplayName("Status and case-insensitive reason search combine")
    void pendingConferenceRequests() {
        printTestHeader("status=pending & search=conference");

        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.builder()
            .status(RequestStatus.PENDING)
            .search("conference")
            .build());

        printOutput("Matches", ids(result));
        assertEquals(List.of(conferencePending), ids(result));
        VacationRequestView view = result.get(0);
        assertEquals("Ana Lopez", view.getAccountName());
        assertEquals(RequestStatus.PENDING, view.getRequest().getStatus());
        assertEquals(2, view.getRequest().getDurationDays());
    }

    @Test
    @DisplayName("Search also matches the owner's name")
    void searchMatchesAccountName() {
        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.builder()
            .search("FISHER")
            .build());

        assertEquals(List.of(conradPending), ids(result));
    }

    @Test
    @DisplayName("LIKE wildcards in the search term match literally")
    void wildcardsAreEscaped() {
        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.builder()
            .search("%")
            .build());

        assertTrue(result.isEmpty());
        assertEquals("100\\%\\_off\\\\", VacationRequestSearchRepository.escapeLike("100%_off\\"));
    }

    @Test
    @DisplayName("Results are ordered by submission time, newest first")
    void newestSubmissionFirst() {
        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.none());

        assertEquals(List.of(beachPending, conradPending, conferencePending, conferenceApproved), ids(result));
    }

    @Test
    @DisplayName("Scoping to an account hides everyone else's requests")
    void scopedToAccount() {
        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.none().scopedTo(conradId));

        assertEquals(List.of(conradPending), ids(result));
    }

    @Test
    @DisplayName("Date bounds keep requests lying entirely inside the window")
    void dateWindow() {
        List<VacationRequestView> result = searchRepository.findByFilter(RequestFilter.builder()
            .from(LocalDate.of(2025, 3, 1))
            .to(LocalDate.of(2025, 4, 30))
            .build());

        assertEquals(List.of(conradPending, conferencePending), ids(result));
    }

    @Test
    @DisplayName("Lookup by id joins the owner and reports decision metadata")
    void findByIdJoinsAccount() {
        VacationRequestView view = searchRepository.findById(conferenceApproved).orElseThrow();

        assertEquals(anaId, view.getRequest().getAccountId());
        assertEquals(RequestStatus.APPROVED, view.getRequest().getStatus());
        assertNotNull(view.getRequest().getDecidedAt());
        assertTrue(view.getAccountEmail().endsWith("@company.test"));
        assertTrue(searchRepository.findById(999_999L).isEmpty());
    }
}
