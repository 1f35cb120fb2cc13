package com.sommerph.certdir.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sommerph.certdir.config.StorageProperties;
import com.sommerph.certdir.exception.CertificateStoreException;
import com.sommerph.certdir.model.ConsistencyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the consistency check once the application has started and optionally exports the report
 * as JSON. A violation fails the startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "certdir.check", name = "on-startup", havingValue = "true")
public class ConsistencyCheckRunner implements CommandLineRunner {

    private final KeyDirectoryService keyDirectoryService;
    private final StorageProperties properties;

    @Override
    public void run(String... args) {
        log.info("Run startup consistency check");
        ConsistencyReport report = keyDirectoryService.checkConsistency();

        String reportPath = properties.getCheck().getReportPath();
        if (reportPath != null && !reportPath.isBlank()) {
            writeReport(report, Path.of(reportPath));
        }
    }

    private void writeReport(ConsistencyReport report, Path path) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), report);
            log.info("Successfully wrote consistency report: {}", path);
        } catch (IOException e) {
            log.error("Failed to write consistency report: {}", path, e);
            throw new CertificateStoreException("Failed to write consistency report: " + path, e);
        }
    }

}
