package com.spectro.main;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.spectro.model.RunDirectives;
import java.io.File;

public class QprocOptions {

    @Parameter(names = {"-i", "--image"}, description = "Imagen de entrada (raw o preprocesada)", required = true)
    public String image;

    @Parameter(names = {"-c", "--camera"}, description = "Cámara, p.ej. r7; obligatoria si la imagen es raw")
    public String camera;

    @Parameter(names = {"-f", "--fibermap"}, description = "Fibermap de la exposición")
    public String fibermap;

    @Parameter(names = {"-o", "--outframe"}, description = "Frame final")
    public String outframe;

    @Parameter(names = {"-p", "--psf"}, description = "PSF de entrada; por defecto la de la calibración")
    public String psf;

    @Parameter(names = "--output-preproc", description = "Guarda la imagen preprocesada")
    public String outputPreproc;

    @Parameter(names = "--output-rawframe", description = "Guarda el frame recién extraído")
    public String outputRawframe;

    @Parameter(names = "--output-skyframe", description = "Guarda el modelo de cielo")
    public String outputSkyframe;

    @Parameter(names = "--output-psf", description = "Guarda la PSF ajustada")
    public String outputPsf;

    @Parameter(names = "--fibers", description = "Fibras a conservar, p.ej. 0:10,42 (el final del rango no se incluye)")
    public String fibers;

    @Parameter(names = "--width", description = "Ancho de extracción en píxeles")
    public Integer width;

    @Parameter(names = "--plot", description = "Muestra el resultado")
    public boolean plot;

    @Parameter(names = "--compute-lsf-sigma", description = "Ajusta la anchura de la LSF con las líneas de arco")
    public boolean computeLsfSigma;

    @Parameter(names = "--shift-psf", description = "Reajusta las trazas de la PSF sobre la imagen")
    public boolean shiftPsf;

    @Parameter(names = "--compute-fiberflat", description = "Calcula el flat de fibras y lo guarda en este fichero")
    public String computeFiberflat;

    @Parameter(names = "--apply-fiberflat", description = "Aplica el flat de fibras de la calibración")
    public boolean applyFiberflat;

    @Parameter(names = "--input-fiberflat", description = "Aplica este flat de fibras")
    public String inputFiberflat;

    @Parameter(names = "--skysub", description = "Resta el cielo")
    public boolean skysub;

    @Parameter(names = "--fluxcalib", description = "Calibra en flujo")
    public boolean fluxcalib;

    @Parameter(names = "--auto", description = "Etapas y productos según el FLAVOR de la cabecera")
    public boolean auto;

    @Parameter(names = "--auto-output-dir", description = "Directorio de los productos del modo automático; por defecto el de las preferencias")
    public String autoOutputDir;

    @Parameter(names = "--calib-dir", description = "Raíz de las calibraciones; por defecto la de las preferencias")
    public String calibDir;

    @Parameter(names = {"-h", "--help"}, description = "Muestra esta ayuda", help = true)
    public boolean help;

    private transient JCommander commander;

    public void parse(String[] args) {
        commander = JCommander.newBuilder().addObject(this).programName("qproc").build();
        commander.parse(args);
    }

    public void usage() {
        if (commander == null) {
            commander = JCommander.newBuilder().addObject(this).programName("qproc").build();
        }
        commander.usage();
    }

    public RunDirectives toDirectives(int defaultWidth, String defaultOutputDir) {
        return RunDirectives.builder(new File(image))
                .camera(camera)
                .fibermap(file(fibermap))
                .outframe(file(outframe))
                .psf(file(psf))
                .outputPreproc(file(outputPreproc))
                .outputRawframe(file(outputRawframe))
                .outputSkyframe(file(outputSkyframe))
                .outputPsf(file(outputPsf))
                .fibers(fibers)
                .width(width != null ? width : defaultWidth)
                .plot(plot)
                .computeLsfSigma(computeLsfSigma)
                .shiftPsf(shiftPsf)
                .computeFiberflat(file(computeFiberflat))
                .applyFiberflat(applyFiberflat)
                .inputFiberflat(file(inputFiberflat))
                .skysub(skysub)
                .fluxcalib(fluxcalib)
                .auto(auto)
                .autoOutputDir(new File(autoOutputDir != null ? autoOutputDir : defaultOutputDir))
                .build();
    }

    // --calib-dir o, si no se da, la raíz guardada en las preferencias.
    public File calibRoot(String preferred) {
        String root = (calibDir != null && !calibDir.trim().isEmpty()) ? calibDir : preferred;
        return new File(root == null || root.trim().isEmpty() ? "." : root.trim());
    }

    private static File file(String path) {
        return (path == null || path.trim().isEmpty()) ? null : new File(path.trim());
    }

    @Override
    public String toString() {
        return "QprocOptions{image=" + image + ", camera=" + camera + ", psf=" + psf + ", fibermap=" + fibermap
                + ", auto=" + auto + ", autoOutputDir=" + autoOutputDir + ", calibDir=" + calibDir + "}";
    }
}
