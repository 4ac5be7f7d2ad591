package com.spectro.ui;

import com.spectro.model.Frame;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.chart.LineChart;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Ventana JavaFX con los espectros de un frame. Solo se dibujan las muestras con ivar positiva.
public class SpectrumPlotApp extends Application implements SpectrumDisplay {

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumPlotApp.class);

    // Application.launch instancia la clase por reflexión: el frame se pasa por aquí
    private static Frame current;

    @Override
    public void show(Frame frame) {
        LOG.info("dibujando {} espectros", frame.nspec());
        current = frame;
        Application.launch(SpectrumPlotApp.class);
    }

    @Override
    public void start(Stage primaryStage) {
        Frame frame = current;
        primaryStage.setTitle("qproc - " + frame.nspec() + " espectros");

        NumberAxis xAxis = new NumberAxis();
        xAxis.setLabel("wavelength");
        xAxis.setForceZeroInRange(false);
        NumberAxis yAxis = new NumberAxis();
        yAxis.setLabel("flux");

        LineChart<Number, Number> chart = new LineChart<>(xAxis, yAxis);
        chart.setCreateSymbols(false);
        chart.setAnimated(false);
        chart.setLegendVisible(frame.nspec() <= 20);
        chart.setHorizontalGridLinesVisible(true);
        chart.setVerticalGridLinesVisible(true);

        for (int i = 0; i < frame.nspec(); i++) {
            XYChart.Series<Number, Number> series = new XYChart.Series<>();
            series.setName("fibra " + frame.fibers[i]);
            for (int j = 0; j < frame.wave[i].length; j++) {
                if (frame.ivar[i][j] > 0) series.getData().add(new XYChart.Data<>(frame.wave[i][j], frame.flux[i][j]));
            }
            chart.getData().add(series);
        }

        Scene scene = new Scene(chart, 1024, 700);
        primaryStage.setScene(scene);
        primaryStage.show();
    }
}
