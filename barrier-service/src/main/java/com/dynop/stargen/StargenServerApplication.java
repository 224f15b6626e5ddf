package com.dynop.stargen;

import com.dynop.stargen.cli.ComputeCommand;
import com.dynop.stargen.config.BarrierBundle;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Dropwizard application serving the barrier computation.
 */
public final class StargenServerApplication extends Application<StargenServerConfiguration> {

    public static void main(String[] args) throws Exception {
        new StargenServerApplication().run(args);
    }

    @Override
    public String getName() {
        return "stargen";
    }

    @Override
    public void initialize(Bootstrap<StargenServerConfiguration> bootstrap) {
        bootstrap.addBundle(new BarrierBundle());
        bootstrap.addCommand(new ComputeCommand());
    }

    @Override
    public void run(StargenServerConfiguration configuration, Environment environment) {
        // everything is registered by BarrierBundle
    }
}
