package com.openrangelabs.ingestor.registry;

import com.openrangelabs.ingestor.connector.DataSourceConnector;
import com.openrangelabs.ingestor.exception.ConnectorRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers every connector bean type once the context is up
 */
@Component
public class ConnectorDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorDiscovery.class);

    private final ConnectorRegistry registry;
    private final ListableBeanFactory beanFactory;

    public ConnectorDiscovery(ConnectorRegistry registry, ListableBeanFactory beanFactory) {
        this.registry = registry;
        this.beanFactory = beanFactory;
    }

    @EventListener(ContextRefreshedEvent.class)
    public void onContextRefreshed() {
        int registered = registerAll();
        logger.info("Registered a total of {} connectors", registered);
    }

    public int registerAll() {
        String[] names = beanFactory.getBeanNamesForType(DataSourceConnector.class, true, false);
        int count = 0;
        for (String name : names) {
            try {
                registry.register(() -> beanFactory.getBean(name, DataSourceConnector.class));
                count++;
            } catch (ConnectorRegistrationException e) {
                logger.error("Failed to register connector bean {}: {}", name, e.getMessage(), e);
            }
        }
        return count;
    }
}
