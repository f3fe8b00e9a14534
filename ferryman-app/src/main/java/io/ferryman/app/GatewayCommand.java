/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import io.ferryman.config.ConfigParser;
import io.ferryman.config.ConfigurationException;
import io.ferryman.config.GatewayConfiguration;
import io.ferryman.gateway.Gateway;

@Command(name = "gateway", description = "Run the gateway until the process is terminated")
final class GatewayCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayCommand.class);

    @Option(names = { "-c", "--config" }, required = true, description = "Gateway configuration file (YAML)")
    Path config;

    @Override
    public Integer call() throws InterruptedException {
        GatewayConfiguration configuration;
        try {
            configuration = new ConfigParser().parseConfiguration(config);
        }
        catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        Gateway gateway = new Gateway(configuration);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gateway.close();
            stopped.countDown();
        }, "gateway-shutdown"));
        try {
            gateway.start();
        }
        catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
        LOGGER.info("Gateway started");
        stopped.await();
        return 0;
    }
}
