package com.dynop.stargen.config;

/**
 * Implemented by application configurations that carry a {@code stargen:} section.
 */
public interface StargenBundleConfiguration {

    StargenSettings getStargen();
}
