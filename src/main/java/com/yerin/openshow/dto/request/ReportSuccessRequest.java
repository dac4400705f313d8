package com.yerin.openshow.dto.request;

import com.fasterxml.jackson.databind.JsonNode;

public record ReportSuccessRequest(JsonNode result) {
}
