package com.edxbuild.transi.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.pipeline.RunSummary;
import com.edxbuild.transi.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the run summary report from {@code templates/run-summary.ftl}.
 */
public class RunSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);

    private static final String TEMPLATE = "run-summary.ftl";

    private final Configuration freemarkerConfig;
    private final ArtifactNaming naming;

    public RunSummaryWriter(ArtifactNaming naming) {
        this.naming = naming;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(RunSummary summary, String timestamp) throws IOException, TemplateException {
        Map<String, Object> model = new HashMap<>();
        model.put("summary", summary);
        model.put("timestamp", timestamp);
        model.put("artifacts", summary.getArtifacts().stream().map(Path::toString).collect(Collectors.toList()));
        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        template.process(model, out);
        return out.toString();
    }

    /**
     * Writes {@code <SOP>_<stage>_summary_<timestamp>.md} into {@code outputDir}.
     */
    public Path write(RunSummary summary, Path outputDir, String timestamp) throws IOException, TemplateException {
        String report = render(summary, timestamp);
        Path target = outputDir.resolve(
                naming.baseName(summary.getSop(), summary.getStage() + "_summary", timestamp) + ".md");
        FileWriteUtil.safeWriteString(target, report);
        log.info("Wrote run summary {}", target);
        return target;
    }
}
