package io.pipesched.core.server;

import javax.servlet.ServletConfig;
import javax.servlet.ServletException;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import org.jboss.resteasy.plugins.server.servlet.HttpServlet30Dispatcher;

/**
 * RESTEasy dispatcher serving an already built resource instance.
 */
class StatusApplicationServlet
        extends HttpServlet30Dispatcher
{
    private final transient StatusResource resource;
    private final transient JacksonJsonProvider jsonProvider;

    StatusApplicationServlet(StatusResource resource, JacksonJsonProvider jsonProvider)
    {
        this.resource = resource;
        this.jsonProvider = jsonProvider;
    }

    @Override
    public void init(ServletConfig servletConfig)
            throws ServletException
    {
        super.init(servletConfig);
        servletContainerDispatcher.getDispatcher().getProviderFactory().registerProviderInstance(jsonProvider);
        servletContainerDispatcher.getDispatcher().getRegistry().addSingletonResource(resource);
    }
}
