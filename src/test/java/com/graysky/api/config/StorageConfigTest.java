package com.graysky.api.config;

import com.graysky.api.storage.FeedbackStore;
import com.graysky.api.storage.JsonFileFeedbackStore;
import com.graysky.api.storage.JsonFileVisitorStore;
import com.graysky.api.storage.VisitorStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.visitors.storage=file",
        "app.visitors.data-file=target/test-data/file-backend/welcome_book.json",
        "app.feedback.data-file=target/test-data/file-backend/feedback.json"
})
@ActiveProfiles("test")
class StorageConfigTest {

    @Autowired
    private VisitorStore visitorStore;

    @Autowired
    private FeedbackStore feedbackStore;

    @Test
    void fileStorageSelectsJsonBackends() {
        assertThat(visitorStore).isInstanceOf(JsonFileVisitorStore.class);
        assertThat(feedbackStore).isInstanceOf(JsonFileFeedbackStore.class);
        assertThat(Files.exists(Path.of("target/test-data/file-backend/welcome_book.json"))).isTrue();
        assertThat(Files.exists(Path.of("target/test-data/file-backend/feedback.json"))).isTrue();
    }
}
