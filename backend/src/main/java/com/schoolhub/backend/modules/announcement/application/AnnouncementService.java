package com.schoolhub.backend.modules.announcement.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.announcement.domain.Announcement;
import com.schoolhub.backend.modules.announcement.domain.AnnouncementDates;
import com.schoolhub.backend.modules.announcement.infrastructure.persistence.AnnouncementIdentifiers;
import com.schoolhub.backend.modules.announcement.infrastructure.persistence.AnnouncementRepository;
import com.schoolhub.backend.modules.announcement.presentation.dto.AnnouncementResponse;
import com.schoolhub.backend.modules.teacher.application.TeacherAuthenticator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AnnouncementService {

    public static final String INVALID_DATE_FORMAT = "INVALID_DATE_FORMAT";
    public static final String INVALID_ANNOUNCEMENT_ID = "INVALID_ANNOUNCEMENT_ID";
    public static final String ANNOUNCEMENT_NOT_FOUND = "ANNOUNCEMENT_NOT_FOUND";
    public static final String ANNOUNCEMENT_UPDATE_FAILED = "ANNOUNCEMENT_UPDATE_FAILED";

    private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

    private final AnnouncementRepository announcementRepository;
    private final TeacherAuthenticator teacherAuthenticator;
    private final Clock clock;

    public AnnouncementService(
            AnnouncementRepository announcementRepository,
            TeacherAuthenticator teacherAuthenticator,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.teacherAuthenticator = teacherAuthenticator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AnnouncementResponse> listActive() {
        String today = AnnouncementDates.today(clock);
        return announcementRepository.findAll().stream()
                .filter(announcement -> announcement.isActiveOn(today))
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AnnouncementResponse> listAll(String teacherUsername) {
        teacherAuthenticator.requireTeacher(teacherUsername);
        return announcementRepository.findAllByOrderByExpirationDateDesc().stream()
                .map(this::toResponse)
                .toList();
    }

    public AnnouncementResponse create(String message, String expirationDate, String teacherUsername, String startDate) {
        String teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        String normalizedStart = AnnouncementDates.normalizeOptional(startDate);
        validateDates(expirationDate, normalizedStart);

        Announcement saved = announcementRepository.save(
                new Announcement(message, normalizedStart, expirationDate, teacher)
        );
        log.info("Announcement {} created by {}", saved.getId(), teacher);
        return toResponse(saved);
    }

    public AnnouncementResponse update(
            String announcementId,
            String message,
            String expirationDate,
            String teacherUsername,
            String startDate
    ) {
        String teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        UUID id = parseId(announcementId);
        Announcement existing = announcementRepository.findById(id)
                .orElseThrow(AnnouncementService::notFound);

        String normalizedStart = AnnouncementDates.normalizeOptional(startDate);
        validateDates(expirationDate, normalizedStart);

        OffsetDateTime now = OffsetDateTime.now(clock);
        int matched;
        if (normalizedStart == null) {
            announcementRepository.clearStartDate(id, now);
            matched = announcementRepository.updateMessageAndExpiration(id, message, expirationDate, now);
        } else {
            matched = announcementRepository.updateMessageAndWindow(id, message, normalizedStart, expirationDate, now);
        }
        if (matched == 0) {
            log.error("Announcement {} vanished between lookup and update", id);
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, ANNOUNCEMENT_UPDATE_FAILED,
                    "Failed to update announcement");
        }

        log.info("Announcement {} updated by {}", id, teacher);
        return new AnnouncementResponse(
                announcementId,
                message,
                normalizedStart,
                expirationDate,
                existing.getCreatedBy()
        );
    }

    public void delete(String announcementId, String teacherUsername) {
        String teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        UUID id = parseId(announcementId);
        if (announcementRepository.deleteAnnouncement(id) == 0) {
            throw notFound();
        }
        log.info("Announcement {} deleted by {}", id, teacher);
    }

    private static void validateDates(String expirationDate, String startDate) {
        if (!AnnouncementDates.isValid(expirationDate)
                || (startDate != null && !AnnouncementDates.isValid(startDate))) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_DATE_FORMAT,
                    "Invalid date format. Use YYYY-MM-DD");
        }
    }

    private static UUID parseId(String announcementId) {
        return AnnouncementIdentifiers.parse(announcementId)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, INVALID_ANNOUNCEMENT_ID,
                        "Invalid announcement ID"));
    }

    private static ProblemException notFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, ANNOUNCEMENT_NOT_FOUND, "Announcement not found");
    }

    private AnnouncementResponse toResponse(Announcement announcement) {
        return new AnnouncementResponse(
                announcement.getId().toString(),
                announcement.getMessage(),
                announcement.getStartDate(),
                announcement.getExpirationDate(),
                announcement.getCreatedBy()
        );
    }
}
