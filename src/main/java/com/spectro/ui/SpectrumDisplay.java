package com.spectro.ui;

import com.spectro.model.Frame;

public interface SpectrumDisplay {

    void show(Frame frame);
}
