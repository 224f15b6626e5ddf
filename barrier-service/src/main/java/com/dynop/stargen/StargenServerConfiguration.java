package com.dynop.stargen;

import com.dynop.stargen.config.StargenBundleConfiguration;
import com.dynop.stargen.config.StargenSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;

/**
 * Configuration type for {@link StargenServerApplication}: Dropwizard server settings plus the
 * {@code stargen:} section.
 */
public class StargenServerConfiguration extends Configuration implements StargenBundleConfiguration {

    private StargenSettings stargen = new StargenSettings();

    @Override
    @JsonProperty("stargen")
    public StargenSettings getStargen() {
        return stargen;
    }

    @JsonProperty("stargen")
    public void setStargen(StargenSettings stargen) {
        this.stargen = stargen;
    }
}
