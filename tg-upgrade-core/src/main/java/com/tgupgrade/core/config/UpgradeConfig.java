package com.tgupgrade.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for an upgrade run.
 *
 * <p>Loaded from {@code tgupgrade.yaml}. Sections or keys left out of the file take their
 * default values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * files:
 *   source: terraform.tfvars
 *   target: terragrunt.hcl
 *
 * output:
 *   mode: git-mv
 *   parallelism: 4
 * }</pre>
 *
 * @param files names of the files to upgrade and to write
 * @param output how results are written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpgradeConfig(
    @JsonProperty("files") FilesConfig files,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_SOURCE = "terraform.tfvars";
    public static final String DEFAULT_TARGET = "terragrunt.hcl";
    public static final String DEFAULT_MODE = "in-place";

    public UpgradeConfig {
        if (files == null) {
            files = new FilesConfig(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the default configuration: upgrade {@code terraform.tfvars} in place into
     * {@code terragrunt.hcl}, one file at a time.
     *
     * @return default configuration
     */
    public static UpgradeConfig defaults() {
        return new UpgradeConfig(
            new FilesConfig(DEFAULT_SOURCE, DEFAULT_TARGET),
            new OutputConfig(DEFAULT_MODE, 1)
        );
    }

    /**
     * File names.
     *
     * @param source name of the files searched for in directories
     * @param target name of the file written next to each source
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FilesConfig(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target
    ) {
        public FilesConfig {
            if (source == null || source.isBlank()) {
                source = DEFAULT_SOURCE;
            }
            if (target == null || target.isBlank()) {
                target = DEFAULT_TARGET;
            }
        }
    }

    /**
     * Output settings.
     *
     * @param mode renderer ID: {@code in-place}, {@code dry-run} or {@code git-mv}
     * @param parallelism number of files upgraded concurrently
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("mode") String mode,
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public OutputConfig {
            if (mode == null || mode.isBlank()) {
                mode = DEFAULT_MODE;
            }
            if (parallelism == null || parallelism < 1) {
                parallelism = 1;
            }
        }
    }
}
