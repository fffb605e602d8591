package com.edxbuild.transi.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.CatalogLoader;
import com.edxbuild.transi.error.TransiGenException;
import com.edxbuild.transi.output.ArtifactNaming;
import com.edxbuild.transi.output.ArtifactWriter;
import com.edxbuild.transi.output.RunSummaryWriter;
import com.edxbuild.transi.tabular.TabularSource;

/**
 * Common run skeleton of the pipeline stages: take one timestamp, run the stage, record the
 * written artifacts and render the run summary. Any failure is turned into a failed
 * {@link RunResult}; a stage that fails before writing leaves no artifact behind.
 */
public abstract class PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(PipelineStage.class);

    protected final RunConfig config;
    protected final TabularSource source;
    protected final CatalogLoader loader;
    protected final ArtifactNaming naming;
    protected final ArtifactWriter artifactWriter;
    private final RunSummaryWriter summaryWriter;

    protected PipelineStage(RunConfig config) {
        this(config, new TabularSource());
    }

    protected PipelineStage(RunConfig config, TabularSource source) {
        this.config = config;
        this.source = source;
        this.loader = new CatalogLoader(source);
        this.naming = new ArtifactNaming(config.getClock(), config.getZone());
        this.artifactWriter = new ArtifactWriter(source, naming);
        this.summaryWriter = new RunSummaryWriter(naming);
    }

    /**
     * Stage name used in artifact names, e.g. {@code PreMerge}.
     */
    public abstract String getStage();

    /**
     * Runs the stage. Implementations write their artifacts and fill in the summary.
     */
    protected abstract RunResult.RunResultBuilder execute(RunSummary summary, String timestamp) throws Exception;

    public RunResult build() {
        String stage = getStage();
        try {
            log.info("Starting {} for SOP {}...", stage, config.getSop());
            String timestamp = naming.timestamp();
            RunSummary summary = new RunSummary(stage, config.getSop());

            RunResult.RunResultBuilder result = execute(summary, timestamp);
            RunResult built = result.success(true).stage(stage).build();
            summary.getArtifacts().addAll(built.getArtifacts());

            if (config.isWriteSummary()) {
                Path summaryPath = summaryWriter.write(summary, config.getOutputDir(), timestamp);
                built.setSummaryPath(summaryPath);
            }
            log.info("{} complete!", stage);
            return built;
        } catch (TransiGenException e) {
            log.error("{} failed: {}", stage, e.getMessage());
            return RunResult.failure(stage, e);
        } catch (Exception e) {
            log.error("{} failed", stage, e);
            return RunResult.failure(stage, e);
        }
    }

    protected void ensureOutputDir() throws IOException {
        Files.createDirectories(config.getOutputDir());
    }

    protected static RunResult.RunResultBuilder written(List<Path> artifacts) {
        return RunResult.builder().artifacts(List.copyOf(artifacts));
    }
}
