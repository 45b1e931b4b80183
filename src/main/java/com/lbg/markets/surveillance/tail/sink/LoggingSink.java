package com.lbg.markets.surveillance.tail.sink;

import com.lbg.markets.surveillance.tail.domain.Entry;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@ApplicationScoped
@IfBuildProfile("prod")
public class LoggingSink implements Sink {

    private static final Logger LOG = Logger.getLogger("tail.entries");

    @Override
    public void emit(Entry entry) {
        LOG.infof("%s %s", entry.attributes(), entry.body());
    }
}
