package com.graysky.api.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private VisitorProperties visitors = new VisitorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private FeedbackProperties feedback = new FeedbackProperties();
}
