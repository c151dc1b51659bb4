package org.croniq.services;

import org.croniq.config.XmlConfiguration;
import org.croniq.monitoring.LateJobScanner;
import org.croniq.services.tasks.LateJobScanTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ApplicationTasks {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationTasks.class);

    private ApplicationTasks() {}

    public static void registerApplicationTasks(TaskScheduler scheduler, LateJobScanner scanner, XmlConfiguration cfg) {
        logger.info("[------------ Registering application tasks ------------]");

        scheduler.register(new LateJobScanTask(scanner, cfg.monitoring.scanIntervalSeconds));

        logger.info("[------------ Application tasks registered ------------]");
    }
}
