package io.gradeflow.server.config;

import io.gradeflow.core.workflow.WorkflowEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/// Re-enters runs a previous process left unfinished once the container has started.
///
/// Suspended runs are not touched; they continue when a reviewer resumes them.
///
/// @see WorkflowEngine#recover()
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final WorkflowEngine engine;

    @Inject
    public ServerBootstrap(WorkflowEngine engine) {
        this.engine = engine;
    }

    void onStart(@Observes @Initialized(ApplicationScoped.class) Object ignored) {
        List<String> recovered = engine.recover();
        if (recovered.isEmpty()) {
            LOG.info("No interrupted runs to recover");
        } else {
            LOG.infov("Recovered {0} interrupted runs: {1}", recovered.size(), recovered);
        }
    }
}
