package com.delta.autoapply.run.auth;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.browser.FakeBrowserPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AuthStateStoreTest {
    private static final String APPLY_URL = "https://acme.wd5.myworkdayjobs.com/en-US/External/job/123/apply";

    @TempDir
    Path stateDir;

    private AuthStateStore store;

    @BeforeEach
    void setUp() {
        AutoApplyProperties properties = new AutoApplyProperties();
        properties.getAuth().setStateDir(stateDir.toString());
        store = new AuthStateStore(properties, new ObjectMapper());
    }

    @Test
    void stateFileIsKeyedByHost() {
        assertThat(store.stateFileFor(APPLY_URL))
            .isEqualTo(stateDir.resolve("acme.wd5.myworkdayjobs.com.json"));
        assertThat(store.stateFileFor("https://ACME.wd5.myworkdayjobs.com/other"))
            .isEqualTo(stateDir.resolve("acme.wd5.myworkdayjobs.com.json"));
        assertThat(store.stateFileFor(null)).isEqualTo(stateDir.resolve("unknown-host.json"));
    }

    @Test
    void savedStateIsLoadedForTheSameHost() throws Exception {
        FakeBrowserSession session = new FakeBrowserSession(new FakeBrowserPage(APPLY_URL));

        assertThat(store.save(session, APPLY_URL)).isTrue();

        Optional<Path> loaded = store.load(APPLY_URL);
        assertThat(loaded).contains(stateDir.resolve("acme.wd5.myworkdayjobs.com.json"));
        assertThat(Files.readString(loaded.get())).isEqualTo(FakeBrowserSession.STORAGE_STATE);
        assertThat(store.load("https://boards.greenhouse.io/acme/jobs/1")).isEmpty();
    }

    @Test
    void saveReplacesPreviousState() throws Exception {
        Path file = store.stateFileFor(APPLY_URL);
        Files.writeString(file, "{\"cookies\":[{\"name\":\"stale\"}]}");

        store.save(new FakeBrowserSession(new FakeBrowserPage(APPLY_URL)), APPLY_URL);

        assertThat(Files.readString(file)).isEqualTo(FakeBrowserSession.STORAGE_STATE);
        assertThat(listTempFiles()).isZero();
    }

    @Test
    void corruptStateIsTreatedAsAbsent() throws Exception {
        Files.writeString(store.stateFileFor(APPLY_URL), "{not json");
        assertThat(store.load(APPLY_URL)).isEmpty();
    }

    @Test
    void nonObjectStateIsTreatedAsAbsent() throws Exception {
        Files.writeString(store.stateFileFor(APPLY_URL), "[1, 2, 3]");
        assertThat(store.load(APPLY_URL)).isEmpty();
    }

    @Test
    void failedSaveReportsFalseAndLeavesNoTempFile() throws Exception {
        FakeBrowserSession session = new FakeBrowserSession(new FakeBrowserPage(APPLY_URL))
            .failSavesWith(new IllegalStateException("context closed"));

        assertThat(store.save(session, APPLY_URL)).isFalse();
        assertThat(Files.exists(store.stateFileFor(APPLY_URL))).isFalse();
        assertThat(listTempFiles()).isZero();
    }

    private long listTempFiles() throws Exception {
        try (Stream<Path> files = Files.list(stateDir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".tmp")).count();
        }
    }
}
