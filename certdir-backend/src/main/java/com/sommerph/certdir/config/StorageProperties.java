package com.sommerph.certdir.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "certdir")
public class StorageProperties {

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Check check = new Check();

    @Data
    public static class Storage {
        // internal, external and tmp default to base/keys, base/keys and base/tmp
        @NotBlank
        private String basePath = "./data";
        private String internalPath;
        private String externalPath;
        private String tmpPath;
        private boolean dryRun = false;
    }

    @Data
    public static class Check {
        private boolean onStartup = false;
        private String reportPath;
    }

}
