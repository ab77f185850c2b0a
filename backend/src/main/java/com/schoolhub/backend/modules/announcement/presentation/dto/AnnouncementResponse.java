package com.schoolhub.backend.modules.announcement.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnnouncementResponse(
        String id,
        String message,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("expiration_date") String expirationDate,
        @JsonProperty("created_by") String createdBy
) {
}
