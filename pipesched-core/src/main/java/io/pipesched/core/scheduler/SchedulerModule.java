package io.pipesched.core.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.pipesched.core.agent.AgentRegistry;
import io.pipesched.core.agent.AgentSupervisor;
import io.pipesched.core.agent.AgentTemplateLoader;
import io.pipesched.core.agent.AgentTemplateRegistry;
import io.pipesched.core.agent.LocalWorkerLauncher;
import io.pipesched.core.config.ConfigFactory;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.config.SchedulerConfigLoader;
import io.pipesched.core.database.FileJobStore;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.host.HostRegistry;
import io.pipesched.core.job.DatabaseSync;
import io.pipesched.core.job.JobQueue;
import io.pipesched.core.lock.ProcessLock;
import io.pipesched.core.server.StatusBoard;
import io.pipesched.core.server.StatusResource;
import io.pipesched.core.server.StatusServer;
import io.pipesched.core.signal.ChildReaper;
import io.pipesched.core.signal.SignalBridge;
import io.pipesched.core.signal.SignalRegistrar;
import io.pipesched.core.signal.SunMiscSignalRegistrar;
import io.pipesched.spi.JobStore;
import io.pipesched.spi.WorkerLauncher;

public class SchedulerModule
        implements Module
{
    private final SchedulerConfigLoader configLoader;
    private final SchedulerConfig config;

    public SchedulerModule(SchedulerConfigLoader configLoader, SchedulerConfig config)
    {
        this.configLoader = configLoader;
        this.config = config;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerConfigLoader.class).toInstance(configLoader);
        binder.bind(SchedulerConfig.class).toInstance(config);
        binder.bind(ObjectMapper.class).toInstance(ConfigFactory.objectMapper());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);

        binder.bind(EventBus.class).in(Scopes.SINGLETON);
        binder.bind(ChildReaper.class).in(Scopes.SINGLETON);
        binder.bind(SignalRegistrar.class).to(SunMiscSignalRegistrar.class).in(Scopes.SINGLETON);
        binder.bind(SignalBridge.class).in(Scopes.SINGLETON);
        binder.bind(ProcessLock.class).in(Scopes.SINGLETON);

        binder.bind(HostRegistry.class).in(Scopes.SINGLETON);
        binder.bind(AgentRegistry.class).in(Scopes.SINGLETON);
        binder.bind(AgentTemplateRegistry.class).in(Scopes.SINGLETON);
        binder.bind(AgentTemplateLoader.class).in(Scopes.SINGLETON);
        binder.bind(JobQueue.class).in(Scopes.SINGLETON);

        binder.bind(JobStore.class).to(FileJobStore.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseSync.class).in(Scopes.SINGLETON);
        binder.bind(WorkerLauncher.class).to(LocalWorkerLauncher.class).in(Scopes.SINGLETON);
        binder.bind(AgentSupervisor.class).in(Scopes.SINGLETON);

        binder.bind(SchedulerState.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerCore.class).in(Scopes.SINGLETON);
        binder.bind(ConfigReloader.class).in(Scopes.SINGLETON);
        binder.bind(StatusBoard.class).in(Scopes.SINGLETON);
        binder.bind(StatusResource.class).in(Scopes.SINGLETON);
        binder.bind(StatusServer.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerDaemon.class).in(Scopes.SINGLETON);
    }
}
