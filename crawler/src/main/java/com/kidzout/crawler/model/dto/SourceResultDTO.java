package com.kidzout.crawler.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidzout.crawler.model.enums.FetchOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceResultDTO {
    private String sourceName;
    private String url;
    private String format;
    private FetchOutcome outcome;
    private Integer httpStatus;
    private int itemCount;
    private int skippedItems;
    private int retries;
    private long latencyMs;
    private long responseSize;
    private Double score;
    private String error;
}
