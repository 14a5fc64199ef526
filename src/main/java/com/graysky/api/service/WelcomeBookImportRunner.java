package com.graysky.api.service;

import com.graysky.api.configuration.AppProperties;
import com.graysky.api.configuration.VisitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Imports {@code app.visitors.data-file} into the relational store at startup when
 * {@code app.visitors.import-on-startup} is true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.visitors", name = "import-on-startup", havingValue = "true")
public class WelcomeBookImportRunner implements ApplicationRunner {

    private final WelcomeBookImportService importService;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        VisitorProperties settings = appProperties.getVisitors();
        if (settings.getStorage() == VisitorProperties.StorageType.FILE) {
            log.info("Skipping welcome book import: file storage already reads {}", settings.getDataFile());
            return;
        }
        importService.importFrom(Path.of(settings.getDataFile()));
    }
}
