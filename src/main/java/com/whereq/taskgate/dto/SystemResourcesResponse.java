package com.whereq.taskgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Combined resource and queue view for status polling
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SystemResourcesResponse {
    ResourceSummary resources;
    QueueStatus queue;
}
