package com.delta.autoapply.run.auth;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.ats.AtsDetector;
import com.delta.autoapply.run.browser.BrowserSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Browser storage state (cookies, local storage) persisted per host so a login survives
 * across runs. Files are replaced whole on every save.
 */
@Component
public class AuthStateStore {
    private static final Logger log = LoggerFactory.getLogger(AuthStateStore.class);
    private static final String UNKNOWN_HOST = "unknown-host";

    private final Path stateDir;
    private final ObjectMapper objectMapper;

    public AuthStateStore(AutoApplyProperties properties, ObjectMapper objectMapper) {
        this.stateDir = Paths.get(properties.getAuth().getStateDir());
        this.objectMapper = objectMapper;
    }

    public Path stateFileFor(String url) {
        String host = AtsDetector.hostOf(url);
        return stateDir.resolve((host == null ? UNKNOWN_HOST : host) + ".json");
    }

    /**
     * Stored state for the URL's host. A file that cannot be read or is not a JSON object
     * is reported as absent so the run starts with a fresh browser context.
     */
    public Optional<Path> load(String url) {
        Path file = stateFileFor(url);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Ignoring auth state {}: not a JSON object", file);
                return Optional.empty();
            }
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Ignoring unreadable auth state {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean save(BrowserSession session, String url) {
        Path target = stateFileFor(url);
        Path temp = null;
        try {
            Files.createDirectories(stateDir);
            temp = Files.createTempFile(stateDir, target.getFileName().toString(), ".tmp");
            session.saveStorageState(temp);
            moveIntoPlace(temp, target);
            log.info("Saved auth state for {} to {}", AtsDetector.hostOf(url), target);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save auth state to {}", target, e);
            deleteQuietly(temp);
            return false;
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not delete temp auth state {}: {}", temp, e.getMessage());
        }
    }
}
