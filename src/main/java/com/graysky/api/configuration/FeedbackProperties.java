package com.graysky.api.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FeedbackProperties {

    @NotBlank
    private String dataFile = "data/feedback.json";

    @Min(1)
    private int maxRecords = 1000;
}
