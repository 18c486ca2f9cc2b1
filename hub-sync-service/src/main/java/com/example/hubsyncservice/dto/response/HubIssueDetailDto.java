package com.example.hubsyncservice.dto.response;

import java.util.List;

public record HubIssueDetailDto(HubIssueDto issue, List<HubCommentDto> comments) {
}
