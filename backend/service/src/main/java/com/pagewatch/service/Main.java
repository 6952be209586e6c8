package com.pagewatch.service;

import com.pagewatch.service.config.ConfigLoader;
import com.pagewatch.service.config.PageWatchConfig;
import com.pagewatch.service.runtime.PageWatchRuntime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();

        Path configFile = ConfigLoader.resolveConfigPath(System.getenv());
        PageWatchConfig config = ConfigLoader.load(configFile, System.getenv());
        LOGGER.info("Loaded configuration from " + configFile);

        PageWatchRuntime runtime = PageWatchRuntime.create(config, Clock.systemUTC());
        runtime.startup();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not load logging.properties: " + e.getMessage());
        }
    }
}
