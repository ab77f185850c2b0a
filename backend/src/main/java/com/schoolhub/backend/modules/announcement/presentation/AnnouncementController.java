package com.schoolhub.backend.modules.announcement.presentation;

import java.util.List;

import com.schoolhub.backend.modules.announcement.application.AnnouncementService;
import com.schoolhub.backend.modules.announcement.presentation.dto.AnnouncementDeletedResponse;
import com.schoolhub.backend.modules.announcement.presentation.dto.AnnouncementResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/announcements")
@Tag(name = "announcements")
public class AnnouncementController {

    private final AnnouncementService announcementService;

    public AnnouncementController(AnnouncementService announcementService) {
        this.announcementService = announcementService;
    }

    @Operation(summary = "Active announcements", description = "Announcements whose date window contains today.")
    @GetMapping({"", "/"})
    public ResponseEntity<List<AnnouncementResponse>> listActive() {
        return ResponseEntity.ok(announcementService.listActive());
    }

    @Operation(summary = "All announcements", description = "Active and inactive, newest expiration first. Teachers only.")
    @GetMapping("/all")
    public ResponseEntity<List<AnnouncementResponse>> listAll(
            @Parameter(description = "Username of the calling teacher")
            @RequestParam(name = "teacher_username") String teacherUsername
    ) {
        return ResponseEntity.ok(announcementService.listAll(teacherUsername));
    }

    @Operation(summary = "Create an announcement")
    @PostMapping({"", "/"})
    public ResponseEntity<AnnouncementResponse> create(
            @RequestParam(name = "message") String message,
            @Parameter(description = "Last day on the board, YYYY-MM-DD")
            @RequestParam(name = "expiration_date") String expirationDate,
            @RequestParam(name = "teacher_username") String teacherUsername,
            @Parameter(description = "First day on the board, YYYY-MM-DD; omit to show immediately")
            @RequestParam(name = "start_date", required = false) String startDate
    ) {
        return ResponseEntity.ok(announcementService.create(message, expirationDate, teacherUsername, startDate));
    }

    @Operation(summary = "Update an announcement", description = "Omitting start_date clears the stored start date.")
    @PutMapping("/{announcementId}")
    public ResponseEntity<AnnouncementResponse> update(
            @PathVariable("announcementId") String announcementId,
            @RequestParam(name = "message") String message,
            @RequestParam(name = "expiration_date") String expirationDate,
            @RequestParam(name = "teacher_username") String teacherUsername,
            @RequestParam(name = "start_date", required = false) String startDate
    ) {
        return ResponseEntity.ok(
                announcementService.update(announcementId, message, expirationDate, teacherUsername, startDate)
        );
    }

    @Operation(summary = "Delete an announcement")
    @DeleteMapping("/{announcementId}")
    public ResponseEntity<AnnouncementDeletedResponse> delete(
            @PathVariable("announcementId") String announcementId,
            @RequestParam(name = "teacher_username") String teacherUsername
    ) {
        announcementService.delete(announcementId, teacherUsername);
        return ResponseEntity.ok(new AnnouncementDeletedResponse("Announcement deleted successfully"));
    }
}
