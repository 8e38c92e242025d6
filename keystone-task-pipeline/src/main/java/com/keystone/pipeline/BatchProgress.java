package com.keystone.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Reported after each submitted chunk of a batch workflow. {@code batchNum} starts at 1. */
public record BatchProgress(
        @JsonProperty("batch_num") int batchNum,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("submitted") int submitted,
        @JsonProperty("total") int total
) {
}
