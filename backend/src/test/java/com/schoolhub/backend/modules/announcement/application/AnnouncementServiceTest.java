package com.schoolhub.backend.modules.announcement.application;

import static com.schoolhub.backend.support.AnnouncementFixtures.announcement;
import static com.schoolhub.backend.support.AnnouncementFixtures.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.announcement.domain.Announcement;
import com.schoolhub.backend.modules.announcement.infrastructure.persistence.AnnouncementRepository;
import com.schoolhub.backend.modules.announcement.presentation.dto.AnnouncementResponse;
import com.schoolhub.backend.modules.teacher.application.TeacherAuthenticator;
import com.schoolhub.backend.modules.teacher.infrastructure.persistence.TeacherRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AnnouncementServiceTest {

    private static final String TEACHER = "mrodriguez";
    private static final UUID ID_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID ID_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final UUID ID_C = UUID.fromString("00000000-0000-0000-0000-00000000000c");

    @Mock
    private AnnouncementRepository announcementRepository;

    @Mock
    private TeacherRepository teacherRepository;

    private AnnouncementService announcementService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);
        announcementService = new AnnouncementService(
                announcementRepository,
                new TeacherAuthenticator(teacherRepository),
                clock
        );
        lenient().when(teacherRepository.existsById(anyString())).thenReturn(false);
        lenient().when(teacherRepository.existsById(TEACHER)).thenReturn(true);
    }

    @Test
    @DisplayName("an announcement whose window contains today is listed while a future one is not")
    void listActive_filtersByWindow() {
        when(announcementRepository.findAll()).thenReturn(List.of(
                announcement(ID_A, "2024-06-01", "2024-06-30"),
                announcement(ID_B, "2024-07-01", "2024-12-31")
        ));

        List<AnnouncementResponse> active = announcementService.listActive();

        assertThat(active).extracting(AnnouncementResponse::id).containsExactly(ID_A.toString());
    }

    @Test
    @DisplayName("a missing start date means active from the beginning of time")
    void listActive_withoutStartDate() {
        when(announcementRepository.findAll()).thenReturn(List.of(
                announcement(ID_A, null, "2024-06-15"),
                announcement(ID_B, null, "2024-06-14")
        ));

        List<AnnouncementResponse> active = announcementService.listActive();

        assertThat(active).extracting(AnnouncementResponse::id).containsExactly(ID_A.toString());
        assertThat(active.get(0).startDate()).isNull();
    }

    @Test
    @DisplayName("start and expiration dates are both inclusive")
    void listActive_boundsAreInclusive() {
        when(announcementRepository.findAll()).thenReturn(List.of(
                announcement(ID_A, "2024-06-15", "2024-06-15"),
                announcement(ID_B, "2024-06-16", "2024-06-20"),
                announcement(ID_C, "2024-06-20", "2024-06-01")
        ));

        assertThat(announcementService.listActive())
                .extracting(AnnouncementResponse::id)
                .containsExactly(ID_A.toString());
    }

    @Test
    void listActive_emptyStore() {
        when(announcementRepository.findAll()).thenReturn(List.of());

        assertThat(announcementService.listActive()).isEmpty();
    }

    @Test
    @DisplayName("listing everything returns expired announcements in the store's expiration order")
    void listAll_returnsEverythingForTeacher() {
        when(announcementRepository.findAllByOrderByExpirationDateDesc()).thenReturn(List.of(
                announcement(ID_B, "2024-07-01", "2024-12-31"),
                announcement(ID_A, "2024-06-01", "2024-06-30"),
                announcement(ID_C, null, "2023-01-01")
        ));

        List<AnnouncementResponse> all = announcementService.listAll(TEACHER);

        assertThat(all).extracting(AnnouncementResponse::expirationDate)
                .containsExactly("2024-12-31", "2024-06-30", "2023-01-01");
    }

    @Test
    void listAll_rejectsUnknownTeacher() {
        assertProblem(() -> announcementService.listAll("nobody"),
                HttpStatus.UNAUTHORIZED, TeacherAuthenticator.AUTHENTICATION_REQUIRED);
        verifyNoInteractions(announcementRepository);
    }

    @Test
    @DisplayName("create stores the teacher as author and leaves a missing start date unset")
    void create_persistsAnnouncement() {
        when(announcementRepository.save(any(Announcement.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0), ID_A));

        AnnouncementResponse response = announcementService.create("Picture day", "2099-01-01", TEACHER, null);

        ArgumentCaptor<Announcement> captor = ArgumentCaptor.forClass(Announcement.class);
        verify(announcementRepository).save(captor.capture());
        Announcement saved = captor.getValue();
        assertThat(saved.getMessage()).isEqualTo("Picture day");
        assertThat(saved.getStartDate()).isNull();
        assertThat(saved.getExpirationDate()).isEqualTo("2099-01-01");
        assertThat(saved.getCreatedBy()).isEqualTo(TEACHER);

        assertThat(response).isEqualTo(
                new AnnouncementResponse(ID_A.toString(), "Picture day", null, "2099-01-01", TEACHER));
    }

    @Test
    void create_blankStartDateIsTreatedAsMissing() {
        when(announcementRepository.save(any(Announcement.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0), ID_A));

        AnnouncementResponse response = announcementService.create("Picture day", "2099-01-01", TEACHER, "");

        assertThat(response.startDate()).isNull();
    }

    @Test
    void create_acceptsStartAfterExpiration() {
        when(announcementRepository.save(any(Announcement.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0), ID_A));

        AnnouncementResponse response = announcementService.create("Never shown", "2024-01-01", TEACHER, "2024-12-01");

        assertThat(response.startDate()).isEqualTo("2024-12-01");
        assertThat(response.expirationDate()).isEqualTo("2024-01-01");
    }

    @Test
    void create_rejectsUnknownTeacher() {
        assertProblem(() -> announcementService.create("Hi", "2099-01-01", "nobody", null),
                HttpStatus.UNAUTHORIZED, TeacherAuthenticator.AUTHENTICATION_REQUIRED);
        verify(announcementRepository, never()).save(any());
    }

    @Test
    void create_checksTeacherBeforeDates() {
        assertProblem(() -> announcementService.create("Hi", "2024-13-40", null, null),
                HttpStatus.UNAUTHORIZED, TeacherAuthenticator.AUTHENTICATION_REQUIRED);
    }

    @Test
    void create_rejectsMalformedExpirationDate() {
        assertProblem(() -> announcementService.create("Hi", "2024-13-40", TEACHER, null),
                HttpStatus.BAD_REQUEST, AnnouncementService.INVALID_DATE_FORMAT);
        verify(announcementRepository, never()).save(any());
    }

    @Test
    void create_rejectsMalformedStartDate() {
        assertProblem(() -> announcementService.create("Hi", "2099-01-01", TEACHER, "tomorrow"),
                HttpStatus.BAD_REQUEST, AnnouncementService.INVALID_DATE_FORMAT);
    }

    @Test
    @DisplayName("updating without a start date clears it before setting message and expiration")
    void update_withoutStartDateClearsIt() {
        Announcement existing = announcement(ID_A, "2024-06-01", "2024-06-30");
        when(announcementRepository.findById(ID_A)).thenReturn(Optional.of(existing));
        when(announcementRepository.updateMessageAndExpiration(eq(ID_A), eq("M"), eq("2099-01-01"), any()))
                .thenReturn(1);

        AnnouncementResponse response = announcementService.update(ID_A.toString(), "M", "2099-01-01", "mrodriguez", null);

        InOrder order = inOrder(announcementRepository);
        order.verify(announcementRepository).clearStartDate(eq(ID_A), any(OffsetDateTime.class));
        order.verify(announcementRepository).updateMessageAndExpiration(eq(ID_A), eq("M"), eq("2099-01-01"), any());
        verify(announcementRepository, never()).updateMessageAndWindow(any(), any(), any(), any(), any());
        assertThat(response).isEqualTo(
                new AnnouncementResponse(ID_A.toString(), "M", null, "2099-01-01", "mrodriguez"));
    }

    @Test
    void update_withStartDateReplacesWindowAndKeepsAuthor() {
        Announcement existing = new Announcement("Old", null, "2024-06-30", "mchen");
        withId(existing, ID_A);
        when(announcementRepository.findById(ID_A)).thenReturn(Optional.of(existing));
        when(announcementRepository.updateMessageAndWindow(eq(ID_A), eq("New"), eq("2024-07-01"), eq("2024-07-31"), any()))
                .thenReturn(1);

        AnnouncementResponse response = announcementService.update(ID_A.toString(), "New", "2024-07-31", TEACHER, "2024-07-01");

        verify(announcementRepository, never()).clearStartDate(any(), any());
        assertThat(response.createdBy()).isEqualTo("mchen");
        assertThat(response.startDate()).isEqualTo("2024-07-01");
    }

    @Test
    void update_rejectsUnknownTeacher() {
        assertProblem(() -> announcementService.update(ID_A.toString(), "M", "2099-01-01", "nobody", null),
                HttpStatus.UNAUTHORIZED, TeacherAuthenticator.AUTHENTICATION_REQUIRED);
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void update_rejectsMalformedId() {
        assertProblem(() -> announcementService.update("not-an-id", "M", "2099-01-01", TEACHER, null),
                HttpStatus.BAD_REQUEST, AnnouncementService.INVALID_ANNOUNCEMENT_ID);
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void update_reportsMissingAnnouncementBeforeBadDates() {
        when(announcementRepository.findById(ID_A)).thenReturn(Optional.empty());

        assertProblem(() -> announcementService.update(ID_A.toString(), "M", "bad", TEACHER, null),
                HttpStatus.NOT_FOUND, AnnouncementService.ANNOUNCEMENT_NOT_FOUND);
    }

    @Test
    void update_rejectsMalformedDatesWithoutTouchingTheRecord() {
        when(announcementRepository.findById(ID_A))
                .thenReturn(Optional.of(announcement(ID_A, null, "2024-06-30")));

        assertProblem(() -> announcementService.update(ID_A.toString(), "M", "2024-02-30", TEACHER, null),
                HttpStatus.BAD_REQUEST, AnnouncementService.INVALID_DATE_FORMAT);
        verify(announcementRepository, never()).clearStartDate(any(), any());
    }

    @Test
    void update_failsWhenStoreMatchesNothing() {
        when(announcementRepository.findById(ID_A))
                .thenReturn(Optional.of(announcement(ID_A, null, "2024-06-30")));
        when(announcementRepository.updateMessageAndExpiration(eq(ID_A), any(), any(), any())).thenReturn(0);

        assertProblem(() -> announcementService.update(ID_A.toString(), "M", "2099-01-01", TEACHER, null),
                HttpStatus.INTERNAL_SERVER_ERROR, AnnouncementService.ANNOUNCEMENT_UPDATE_FAILED);
    }

    @Test
    void update_withStartDateFailsWhenStoreMatchesNothing() {
        when(announcementRepository.findById(ID_A))
                .thenReturn(Optional.of(announcement(ID_A, null, "2024-06-30")));
        when(announcementRepository.updateMessageAndWindow(eq(ID_A), any(), any(), any(), any())).thenReturn(0);

        assertProblem(() -> announcementService.update(ID_A.toString(), "M", "2099-01-01", TEACHER, "2098-12-01"),
                HttpStatus.INTERNAL_SERVER_ERROR, AnnouncementService.ANNOUNCEMENT_UPDATE_FAILED);
        verify(announcementRepository, never()).clearStartDate(any(), any());
    }

    @Test
    void delete_removesAnnouncement() {
        when(announcementRepository.deleteAnnouncement(ID_A)).thenReturn(1);

        announcementService.delete(ID_A.toString(), TEACHER);

        verify(announcementRepository).deleteAnnouncement(ID_A);
    }

    @Test
    @DisplayName("deleting the same announcement twice reports not found the second time")
    void delete_twiceReportsNotFound() {
        when(announcementRepository.deleteAnnouncement(ID_A)).thenReturn(1, 0);

        announcementService.delete(ID_A.toString(), TEACHER);

        assertProblem(() -> announcementService.delete(ID_A.toString(), TEACHER),
                HttpStatus.NOT_FOUND, AnnouncementService.ANNOUNCEMENT_NOT_FOUND);
    }

    @Test
    void delete_rejectsUnknownTeacherAndMalformedId() {
        assertProblem(() -> announcementService.delete(ID_A.toString(), "nobody"),
                HttpStatus.UNAUTHORIZED, TeacherAuthenticator.AUTHENTICATION_REQUIRED);
        assertProblem(() -> announcementService.delete("12345", TEACHER),
                HttpStatus.BAD_REQUEST, AnnouncementService.INVALID_ANNOUNCEMENT_ID);
        verifyNoInteractions(announcementRepository);
    }

    private static void assertProblem(Runnable call, HttpStatus status, String code) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(status);
                    assertThat(ex.getCode()).isEqualTo(code);
                });
    }
}
