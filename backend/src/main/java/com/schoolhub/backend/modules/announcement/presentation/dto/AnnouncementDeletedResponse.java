package com.schoolhub.backend.modules.announcement.presentation.dto;

public record AnnouncementDeletedResponse(String message) {
}
