package com.sommerph.certdir.config;

import com.sommerph.certdir.repository.CertificateStore;
import com.sommerph.certdir.repository.IndexStore;
import com.sommerph.certdir.repository.filesystem.FilesystemCertificateStore;
import com.sommerph.certdir.repository.filesystem.FilesystemIndexStore;
import com.sommerph.certdir.repository.filesystem.StorageLayout;
import com.sommerph.certdir.service.ConsistencyChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Configuration
public class StorageConfig {

    private final StorageProperties properties;

    public StorageConfig(StorageProperties properties) {
        this.properties = properties;
    }

    @Bean
    public StorageLayout storageLayout() throws IOException {
        StorageProperties.Storage storage = properties.getStorage();
        Path base = Path.of(storage.getBasePath());
        Path keys = base.resolve("keys");
        return new StorageLayout(
                resolve(storage.getInternalPath(), keys),
                resolve(storage.getExternalPath(), keys),
                resolve(storage.getTmpPath(), base.resolve("tmp")));
    }

    @Bean
    public CertificateStore certificateStore(StorageLayout layout) {
        if (properties.getStorage().isDryRun()) {
            log.warn("Dry run enabled, the certificate store will not be modified");
        }
        return new FilesystemCertificateStore(layout, properties.getStorage().isDryRun());
    }

    @Bean
    public IndexStore indexStore(StorageLayout layout) {
        return new FilesystemIndexStore(layout, properties.getStorage().isDryRun());
    }

    @Bean
    public ConsistencyChecker consistencyChecker(StorageLayout layout, CertificateStore certificateStore,
                                                 IndexStore indexStore) {
        return new ConsistencyChecker(layout, certificateStore, indexStore);
    }

    private static Path resolve(String configured, Path fallback) {
        return configured == null || configured.isBlank() ? fallback : Path.of(configured);
    }

}
