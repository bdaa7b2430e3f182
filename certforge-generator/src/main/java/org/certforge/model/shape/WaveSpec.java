package org.certforge.model.shape;

import java.awt.Color;

/**
 * Sinusoidal band edge {@code y = baseline + amplitude * sin(2 * PI * x / wavelength)}.
 */
public record WaveSpec(int baseline, int amplitude, int wavelength, Color fill) {

    public WaveSpec {
        if (wavelength <= 0) {
            throw new IllegalArgumentException("Wavelength must be positive: " + wavelength);
        }
    }
}
