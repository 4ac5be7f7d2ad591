package com.spectro.main;

import com.beust.jcommander.ParameterException;
import com.spectro.calib.DirectoryCalibrationLocator;
import com.spectro.model.AppConfig;
import com.spectro.model.RunDirectives;
import com.spectro.model.RunReport;
import com.spectro.service.PipelineController;
import com.spectro.service.PipelineStages;
import com.spectro.service.ReductionException;
import com.spectro.service.ReductionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;

public class QprocApp {

    private static final Logger LOG = LoggerFactory.getLogger(QprocApp.class);

    public static void main(String[] args) {
        int code = run(args, PipelineStages.defaults());
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, PipelineStages stages) {
        QprocOptions options = new QprocOptions();
        try {
            options.parse(args);
        } catch (ParameterException e) {
            LOG.error("argumentos no válidos: {}", e.getMessage());
            options.usage();
            return ReductionFailure.CONFIGURATION.exitCode;
        }
        if (options.help) {
            options.usage();
            return 0;
        }
        LOG.info("runClient: entry, options={}", options);

        RunDirectives directives;
        try {
            directives = options.toDirectives(AppConfig.getExtractionWidth(), AppConfig.getAutoOutputDir());
        } catch (IllegalStateException e) {
            LOG.error("argumentos no válidos: {}", e.getMessage());
            return ReductionFailure.CONFIGURATION.exitCode;
        }
        File calibRoot = options.calibRoot(AppConfig.getCalibDir());

        PipelineController controller = new PipelineController(stages, new DirectoryCalibrationLocator(calibRoot));
        try {
            RunReport report = controller.run(directives);
            LOG.info("runClient: exit, flavor={}, {} fibras, productos {}",
                    report.flavor, report.frame.nspec(), report.outputs);
            return 0;
        } catch (ReductionException e) {
            LOG.error("{} ({}): {}", e.getFailure(), e.getExitCode(), e.getMessage());
            LOG.debug("detalle", e);
            return e.getExitCode();
        } catch (RuntimeException e) {
            LOG.error("fallo inesperado en la reducción: {}", e.getMessage(), e);
            return ReductionFailure.INTERNAL.exitCode;
        }
    }
}
