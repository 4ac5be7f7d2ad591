package com.spectro.service;

import com.spectro.io.FiberFlatStore;
import com.spectro.io.FibermapReader;
import com.spectro.io.FitsFiberFlatStore;
import com.spectro.io.FitsFibermapReader;
import com.spectro.io.FitsFluxCalibStore;
import com.spectro.io.FitsFrameStore;
import com.spectro.io.FitsImageStore;
import com.spectro.io.FitsTraceSetStore;
import com.spectro.io.FluxCalibStore;
import com.spectro.io.FrameStore;
import com.spectro.io.ImageStore;
import com.spectro.io.TraceSetStore;
import com.spectro.stage.ArcLineLsfEstimator;
import com.spectro.stage.BoxcarExtractor;
import com.spectro.stage.CentroidTraceShiftFitter;
import com.spectro.stage.ContinuumFlavorClassifier;
import com.spectro.stage.FiberFlatApplier;
import com.spectro.stage.FiberFlatComputer;
import com.spectro.stage.FiberFlatService;
import com.spectro.stage.FlavorClassifier;
import com.spectro.stage.LsfSigmaEstimator;
import com.spectro.stage.MedianSkySubtractor;
import com.spectro.stage.SkySubtractor;
import com.spectro.stage.SpectralExtractor;
import com.spectro.stage.TraceShiftFitter;
import com.spectro.ui.SpectrumDisplay;
import com.spectro.ui.SpectrumPlotApp;

public class PipelineStages {

    public final ImageStore images;
    public final TraceSetStore traceSets;
    public final FrameStore frames;
    public final FiberFlatStore fiberFlats;
    public final FluxCalibStore fluxCalibs;
    public final FibermapReader fibermaps;
    public final SpectralExtractor extractor;
    public final TraceShiftFitter traceShiftFitter;
    public final LsfSigmaEstimator lsfEstimator;
    public final FiberFlatComputer fiberFlatComputer;
    public final FiberFlatApplier fiberFlatApplier;
    public final SkySubtractor skySubtractor;
    public final FlavorClassifier flavorClassifier;
    public final SpectrumDisplay display;

    private PipelineStages(Builder b) {
        this.images = b.images;
        this.traceSets = b.traceSets;
        this.frames = b.frames;
        this.fiberFlats = b.fiberFlats;
        this.fluxCalibs = b.fluxCalibs;
        this.fibermaps = b.fibermaps;
        this.extractor = b.extractor;
        this.traceShiftFitter = b.traceShiftFitter;
        this.lsfEstimator = b.lsfEstimator;
        this.fiberFlatComputer = b.fiberFlatComputer;
        this.fiberFlatApplier = b.fiberFlatApplier;
        this.skySubtractor = b.skySubtractor;
        this.flavorClassifier = b.flavorClassifier;
        this.display = b.display;
    }

    public static PipelineStages defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private ImageStore images = new FitsImageStore();
        private TraceSetStore traceSets = new FitsTraceSetStore();
        private FrameStore frames = new FitsFrameStore();
        private FiberFlatStore fiberFlats = new FitsFiberFlatStore();
        private FluxCalibStore fluxCalibs = new FitsFluxCalibStore();
        private FibermapReader fibermaps = new FitsFibermapReader();
        private SpectralExtractor extractor = new BoxcarExtractor();
        private TraceShiftFitter traceShiftFitter = new CentroidTraceShiftFitter();
        private LsfSigmaEstimator lsfEstimator = new ArcLineLsfEstimator();
        private FiberFlatComputer fiberFlatComputer;
        private FiberFlatApplier fiberFlatApplier;
        private SkySubtractor skySubtractor = new MedianSkySubtractor();
        private FlavorClassifier flavorClassifier = new ContinuumFlavorClassifier();
        private SpectrumDisplay display = new SpectrumPlotApp();

        private Builder() {
            FiberFlatService flats = new FiberFlatService();
            fiberFlatComputer = flats;
            fiberFlatApplier = flats;
        }

        public Builder images(ImageStore v) { images = v; return this; }
        public Builder traceSets(TraceSetStore v) { traceSets = v; return this; }
        public Builder frames(FrameStore v) { frames = v; return this; }
        public Builder fiberFlats(FiberFlatStore v) { fiberFlats = v; return this; }
        public Builder fluxCalibs(FluxCalibStore v) { fluxCalibs = v; return this; }
        public Builder fibermaps(FibermapReader v) { fibermaps = v; return this; }
        public Builder extractor(SpectralExtractor v) { extractor = v; return this; }
        public Builder traceShiftFitter(TraceShiftFitter v) { traceShiftFitter = v; return this; }
        public Builder lsfEstimator(LsfSigmaEstimator v) { lsfEstimator = v; return this; }
        public Builder fiberFlatComputer(FiberFlatComputer v) { fiberFlatComputer = v; return this; }
        public Builder fiberFlatApplier(FiberFlatApplier v) { fiberFlatApplier = v; return this; }
        public Builder skySubtractor(SkySubtractor v) { skySubtractor = v; return this; }
        public Builder flavorClassifier(FlavorClassifier v) { flavorClassifier = v; return this; }
        public Builder display(SpectrumDisplay v) { display = v; return this; }

        public PipelineStages build() { return new PipelineStages(this); }
    }
}
