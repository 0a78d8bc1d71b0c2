package net.closetcapture.runner;

import net.closetcapture.application.capture.CaptureOutcome;
import net.closetcapture.application.capture.GarmentCaptureCoordinator;
import net.closetcapture.service.acquisition.LocalFileAcquisitionSource;
import net.closetcapture.service.processing.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Feeds local files through the capture pipeline when started with
 * {@code --capture.file=/path/photo.jpg --capture.owner=profile-id}. Repeating {@code --capture.file}
 * offers the next file whenever the previous one is rejected.
 */
@Component
public class CaptureFileRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CaptureFileRunner.class);
    private final ApplicationArguments arguments;
    private final GarmentCaptureCoordinator coordinator;

    public CaptureFileRunner(ApplicationArguments arguments,
                             GarmentCaptureCoordinator coordinator) {
        this.arguments = arguments;
        this.coordinator = coordinator;
    }

    @Override
    public void run(String... args) {
        if (!arguments.containsOption("capture.file")) {
            return;
        }
        if (!arguments.containsOption("capture.owner")) {
            throw new IllegalArgumentException("Missing required option --capture.owner=<profile id>");
        }

        List<Path> files = arguments.getOptionValues("capture.file").stream()
            .map(Paths::get)
            .toList();
        String owner = arguments.getOptionValues("capture.owner").get(0);
        long timeoutSeconds = parseLongOption("capture.timeout-seconds", 120L);

        log.info("Starting capture of {} candidate file(s) for owner {}.", files.size(), owner);
        CancellationToken token = CancellationToken.create();
        CaptureOutcome outcome;
        try {
            outcome = coordinator.capture(new LocalFileAcquisitionSource(files), owner, token)
                .block(Duration.ofSeconds(timeoutSeconds));
        } catch (IllegalStateException ex) {
            token.cancel();
            log.error("Capture did not finish within {} s; cancelled.", timeoutSeconds);
            return;
        }

        if (outcome == null) {
            log.warn("Capture produced no outcome.");
        } else if (outcome.isStored()) {
            log.info("Stored garment record {} at {} (signed URL valid until {}): {}",
                outcome.recordId(),
                outcome.storageRecord().storagePath(),
                outcome.storageRecord().expiresAt(),
                outcome.storageRecord().signedUrl());
        } else {
            log.warn("Capture ended with {} [code={}]: {}", outcome.status(), outcome.code(), outcome.userMessage());
        }
    }

    private long parseLongOption(String option, long defaultValue) {
        if (!arguments.containsOption(option)) {
            return defaultValue;
        }
        String raw = arguments.getOptionValues(option).get(0);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            log.warn("Invalid numeric value for --{} ({}). Using default {}.", option, raw, defaultValue);
            return defaultValue;
        }
    }
}
