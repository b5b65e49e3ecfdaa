package io.pipesched.core.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import javax.servlet.ServletException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import com.google.inject.Inject;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.servlet.Servlets;
import io.undertow.servlet.api.DeploymentInfo;
import io.undertow.servlet.api.DeploymentManager;
import io.undertow.servlet.util.ImmediateInstanceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP interface to query the scheduler and to ask it to close.
 *
 * {@link StatusResource} runs in a RESTEasy servlet deployed on Undertow.
 */
public class StatusServer
{
    private static final Logger logger = LoggerFactory.getLogger(StatusServer.class);

    private static final String BIND_ADDRESS = "0.0.0.0";

    private final StatusResource resource;
    private final ObjectMapper mapper;
    private Undertow server;
    private DeploymentManager deployment;

    @Inject
    public StatusServer(StatusResource resource, ObjectMapper mapper)
    {
        this.resource = resource;
        this.mapper = mapper;
    }

    /**
     * Starts listening. Port 0 picks a free port.
     */
    public synchronized void start(int port)
        throws IOException
    {
        if (server != null) {
            throw new IllegalStateException("Status server is already started");
        }

        StatusApplicationServlet servlet = new StatusApplicationServlet(resource, new JacksonJsonProvider(mapper));
        DeploymentInfo servletBuilder = Servlets.deployment()
            .setClassLoader(StatusServer.class.getClassLoader())
            .setContextPath("/")
            .setDeploymentName("status.war")
            .addServlet(Servlets.servlet("status", StatusApplicationServlet.class, new ImmediateInstanceFactory<>(servlet))
                    .setAsyncSupported(true)
                    .setLoadOnStartup(1)
                    .addMapping("/*"));

        DeploymentManager manager = Servlets.newContainer().addDeployment(servletBuilder);
        manager.deploy();
        HttpHandler handler;
        try {
            handler = manager.start();
        }
        catch (ServletException ex) {
            manager.undeploy();
            throw new IOException("Failed to start status interface", ex);
        }

        Undertow s = Undertow.builder()
            .setIoThreads(1)
            .setWorkerThreads(2)
            .addHttpListener(port, BIND_ADDRESS, handler)
            .build();
        try {
            s.start();
        }
        catch (RuntimeException ex) {
            // Undertow wraps bind failures
            undeploy(manager);
            throw new IOException("Failed to listen on port " + port, ex);
        }
        server = s;
        deployment = manager;
        logger.info("Status server listening on port {}", getPort());
    }

    public synchronized int getPort()
    {
        if (server == null) {
            throw new IllegalStateException("Status server is not started");
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public synchronized boolean isStarted()
    {
        return server != null;
    }

    public synchronized void stop()
    {
        if (server != null) {
            server.stop();
            undeploy(deployment);
            server = null;
            deployment = null;
            logger.debug("Status server stopped");
        }
    }

    private static void undeploy(DeploymentManager manager)
    {
        try {
            manager.stop();
        }
        catch (ServletException ex) {
            logger.warn("Failed to stop status interface", ex);
        }
        manager.undeploy();
    }
}
