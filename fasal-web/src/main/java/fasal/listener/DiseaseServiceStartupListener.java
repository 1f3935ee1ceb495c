package fasal.listener;

import fasal.config.ContextLoader;
import fasal.disease.pojo.ServiceStatus;
import fasal.disease.service.DiseaseDetectionService;
import lombok.extern.slf4j.Slf4j;

import javax.servlet.ServletContextEvent;
import javax.servlet.ServletContextListener;
import javax.servlet.annotation.WebListener;

/**
 * Builds the detection service when the web application starts and closes it on shutdown.
 */
@Slf4j
@WebListener
public class DiseaseServiceStartupListener implements ServletContextListener {
    public static final String SERVICE_ATTRIBUTE = "diseaseDetectionService";

    private DiseaseDetectionService service;

    @Override
    public void contextInitialized(ServletContextEvent sce) {
        ContextLoader.loadContext();
        log.info("Starting {} disease detection service...", ContextLoader.configuration.getSystemTitle());
        service = DiseaseDetectionService.fromConfig(ContextLoader.configuration);
        sce.getServletContext().setAttribute(SERVICE_ATTRIBUTE, service);
        ServiceStatus status = service.getStatus();
        log.info("Disease detection service started, model {} ({})", status.getModelStatus(),
                status.getDegradedReason() == null ? status.getModelUsed() : status.getDegradedReason());
    }

    @Override
    public void contextDestroyed(ServletContextEvent sce) {
        sce.getServletContext().removeAttribute(SERVICE_ATTRIBUTE);
        if (service != null) {
            service.shutdown();
            log.info("Disease detection service stopped");
        }
    }
}
