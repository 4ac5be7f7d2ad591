package com.spectro.model;

import java.io.File;

// Qué etapas se ejecutan y dónde se escribe cada producto en una reducción.
public class RunDirectives {

    public static final int DEFAULT_WIDTH = 7;

    public final File image;
    public final String camera;
    public final File fibermap;
    public final File psf;
    public final File outframe;
    public final File outputPreproc;
    public final File outputRawframe;
    public final File outputSkyframe;
    public final File outputPsf;
    public final String fibers;
    public final int width;
    public final boolean plot;
    public final boolean shiftPsf;
    public final boolean computeLsfSigma;
    public final File computeFiberflat;
    public final boolean applyFiberflat;
    public final File inputFiberflat;
    public final boolean skysub;
    public final boolean fluxcalib;
    public final boolean auto;
    public final File autoOutputDir;

    private RunDirectives(Builder b) {
        this.image = b.image;
        this.camera = b.camera;
        this.fibermap = b.fibermap;
        this.psf = b.psf;
        this.outframe = b.outframe;
        this.outputPreproc = b.outputPreproc;
        this.outputRawframe = b.outputRawframe;
        this.outputSkyframe = b.outputSkyframe;
        this.outputPsf = b.outputPsf;
        this.fibers = b.fibers;
        this.width = b.width;
        this.plot = b.plot;
        this.shiftPsf = b.shiftPsf;
        this.computeLsfSigma = b.computeLsfSigma;
        this.computeFiberflat = b.computeFiberflat;
        this.applyFiberflat = b.applyFiberflat;
        this.inputFiberflat = b.inputFiberflat;
        this.skysub = b.skysub;
        this.fluxcalib = b.fluxcalib;
        this.auto = b.auto;
        this.autoOutputDir = b.autoOutputDir;
    }

    public static Builder builder(File image) { return new Builder().image(image); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.image = image; b.camera = camera; b.fibermap = fibermap; b.psf = psf; b.outframe = outframe;
        b.outputPreproc = outputPreproc; b.outputRawframe = outputRawframe;
        b.outputSkyframe = outputSkyframe; b.outputPsf = outputPsf;
        b.fibers = fibers; b.width = width; b.plot = plot;
        b.shiftPsf = shiftPsf; b.computeLsfSigma = computeLsfSigma; b.computeFiberflat = computeFiberflat;
        b.applyFiberflat = applyFiberflat; b.inputFiberflat = inputFiberflat;
        b.skysub = skysub; b.fluxcalib = fluxcalib;
        b.auto = auto; b.autoOutputDir = autoOutputDir;
        return b;
    }

    public boolean fiberflatApplication() { return applyFiberflat || inputFiberflat != null; }

    @Override
    public String toString() {
        return "RunDirectives{image=" + image + ", camera=" + camera + ", psf=" + psf + ", fibermap=" + fibermap
                + ", width=" + width + ", fibers=" + fibers + ", shiftPsf=" + shiftPsf
                + ", computeLsfSigma=" + computeLsfSigma + ", computeFiberflat=" + computeFiberflat
                + ", applyFiberflat=" + applyFiberflat + ", inputFiberflat=" + inputFiberflat
                + ", skysub=" + skysub + ", fluxcalib=" + fluxcalib
                + ", outputPreproc=" + outputPreproc + ", outputRawframe=" + outputRawframe
                + ", outputSkyframe=" + outputSkyframe + ", outputPsf=" + outputPsf + ", outframe=" + outframe
                + ", auto=" + auto + ", autoOutputDir=" + autoOutputDir + ", plot=" + plot + "}";
    }

    public static class Builder {
        private File image;
        private String camera;
        private File fibermap;
        private File psf;
        private File outframe;
        private File outputPreproc;
        private File outputRawframe;
        private File outputSkyframe;
        private File outputPsf;
        private String fibers;
        private int width = DEFAULT_WIDTH;
        private boolean plot;
        private boolean shiftPsf;
        private boolean computeLsfSigma;
        private File computeFiberflat;
        private boolean applyFiberflat;
        private File inputFiberflat;
        private boolean skysub;
        private boolean fluxcalib;
        private boolean auto;
        private File autoOutputDir = new File(".");

        public Builder image(File v) { image = v; return this; }
        public Builder camera(String v) { camera = v; return this; }
        public Builder fibermap(File v) { fibermap = v; return this; }
        public Builder psf(File v) { psf = v; return this; }
        public Builder outframe(File v) { outframe = v; return this; }
        public Builder outputPreproc(File v) { outputPreproc = v; return this; }
        public Builder outputRawframe(File v) { outputRawframe = v; return this; }
        public Builder outputSkyframe(File v) { outputSkyframe = v; return this; }
        public Builder outputPsf(File v) { outputPsf = v; return this; }
        public Builder fibers(String v) { fibers = v; return this; }
        public Builder width(int v) { width = v; return this; }
        public Builder plot(boolean v) { plot = v; return this; }
        public Builder shiftPsf(boolean v) { shiftPsf = v; return this; }
        public Builder computeLsfSigma(boolean v) { computeLsfSigma = v; return this; }
        public Builder computeFiberflat(File v) { computeFiberflat = v; return this; }
        public Builder applyFiberflat(boolean v) { applyFiberflat = v; return this; }
        public Builder inputFiberflat(File v) { inputFiberflat = v; return this; }
        public Builder skysub(boolean v) { skysub = v; return this; }
        public Builder fluxcalib(boolean v) { fluxcalib = v; return this; }
        public Builder auto(boolean v) { auto = v; return this; }
        public Builder autoOutputDir(File v) { autoOutputDir = v; return this; }

        public RunDirectives build() {
            if (image == null) throw new IllegalStateException("falta la imagen de entrada");
            if (width <= 0) throw new IllegalStateException("el ancho de extracción debe ser positivo");
            return new RunDirectives(this);
        }
    }
}
