package io.gradeflow.server.config;

import io.gradeflow.core.GradeflowConfig;
import io.gradeflow.core.GradeflowEnvironment;
import io.gradeflow.core.GradeflowFactory;
import io.gradeflow.core.document.PageRasterizer;
import io.gradeflow.core.export.ResultExporter;
import io.gradeflow.core.grading.GradingCapability;
import io.gradeflow.core.rubric.RubricExtractor;
import io.gradeflow.core.segment.PageIndexer;
import io.gradeflow.core.workflow.WorkflowListener;
import io.gradeflow.server.logging.JbossLoggingWorkflowListener;
import io.gradeflow.server.persistence.CheckpointSchema;
import io.gradeflow.server.persistence.JdbcCheckpointStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Properties;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the grading runtime environment.
///
/// Wires the core through {@link GradeflowFactory}. The four grading collaborators
/// (`PageRasterizer`, `RubricExtractor`, `PageIndexer`, `GradingCapability`) must be
/// provided as beans by the deployment; a `ResultExporter` bean is optional.
///
/// ### Configuration Properties
/// Every `gradeflow.*` key understood by {@link GradeflowConfig#fromProperties} is read from
/// MicroProfile Config. In addition:
///
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `gradeflow.persistence.jdbc` | Boolean | `true` | use the JDBC store when a `DataSource` bean exists |
///
/// The JDBC store's schema is migrated with Flyway before the store is used.
///
/// @implNote Application-scoped. The produced environment is a `@Singleton` and is closed
/// on shutdown.
/// @see ServerConfiguration for beans derived from the environment
@ApplicationScoped
public class GradeflowEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(GradeflowEnvironmentProducer.class);

    static final String PROPERTY_PREFIX = "gradeflow.";
    static final String JDBC_ENABLED_KEY = "gradeflow.persistence.jdbc";

    private GradeflowEnvironment environment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject Instance<PageRasterizer> rasterizer;

    @Inject Instance<RubricExtractor> rubricExtractor;

    @Inject Instance<PageIndexer> pageIndexer;

    @Inject Instance<GradingCapability> gradingCapability;

    @Inject Instance<ResultExporter> exporterInstance;

    @Inject Instance<WorkflowListener> listeners;

    /// Produces the environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    /// @throws IllegalStateException if a required collaborator bean is missing
    @Produces
    @Singleton
    public GradeflowEnvironment gradeflowEnvironment() {
        GradeflowConfig gradeflowConfig =
                GradeflowConfig.fromProperties(extractGradeflowProperties());

        GradeflowFactory.Builder builder =
                GradeflowFactory.builder()
                        .config(gradeflowConfig)
                        .rasterizer(required(rasterizer, "PageRasterizer"))
                        .rubricExtractor(required(rubricExtractor, "RubricExtractor"))
                        .pageIndexer(required(pageIndexer, "PageIndexer"))
                        .gradingCapability(required(gradingCapability, "GradingCapability"))
                        .loggingListener(false)
                        .listener(new JbossLoggingWorkflowListener());

        if (exporterInstance.isResolvable()) {
            builder.exporter(exporterInstance.get());
            LOG.info("Using CDI-provided ResultExporter");
        }

        boolean jdbcEnabled =
                config.getOptionalValue(JDBC_ENABLED_KEY, Boolean.class).orElse(true);
        if (jdbcEnabled && dataSourceInstance.isResolvable()) {
            DataSource dataSource = dataSourceInstance.get();
            CheckpointSchema.migrate(dataSource);
            builder.checkpointStore(new JdbcCheckpointStore(dataSource));
            LOG.info("Using JDBC checkpoint store");
        } else {
            LOG.info("Using in-memory checkpoint store");
        }

        for (WorkflowListener listener : listeners) {
            builder.listener(listener);
            LOG.infov("Registered workflow listener: {0}", listener.getClass().getSimpleName());
        }

        environment = builder.build();
        LOG.info("Configured GradeflowEnvironment via GradeflowFactory");
        return environment;
    }

    /// Copies `gradeflow.*` keys from MicroProfile Config.
    Properties extractGradeflowProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(PROPERTY_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    private static <T> T required(Instance<T> instance, String name) {
        if (!instance.isResolvable()) {
            throw new IllegalStateException("No unique " + name + " bean is available");
        }
        return instance.get();
    }

    /// Closes the environment, stopping run drivers and grading workers.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("GradeflowEnvironment closed");
        }
    }
}
