package com.harvester;

import com.harvester.core.Kernel;
import com.harvester.core.config.ConfigManager;
import com.harvester.core.config.ConfigValidator;
import com.harvester.core.config.Configuration;
import com.harvester.core.crawl.CrawlReport;
import com.harvester.core.crawl.RunRequest;
import com.harvester.core.crawl.RunRequestParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        RunRequest request;
        try {
            request = RunRequestParser.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        logger.info("🚀 Starting Telegraph Harvester...");
        logger.info("📄 Log File: logs/latest.log");

        Configuration config = new ConfigManager(new File(request.configFile())).getConfig();
        if (request.downloadDir() != null) config.downloadPath = request.downloadDir();
        if (request.fullCrawl() != null) config.fullCrawl = request.fullCrawl();

        try {
            new ConfigValidator().validateAndReport(config);
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            System.exit(1);
            return;
        }

        Kernel kernel;
        try {
            kernel = new Kernel(config);
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
            return;
        }

        Thread mainThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            if (kernel.isStopped()) return;
            logger.warn("Interrupted, stopping running downloads...");
            mainThread.interrupt();
            try {
                mainThread.join(10_000);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            kernel.shutdown(true);
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode = 0;
        try {
            if (request.importLedgerFile() != null) {
                kernel.importLedger(new File(request.importLedgerFile()));
            }
            if (request.hasEntries()) {
                CrawlReport report = kernel.run(request.entries(), config.fullCrawl);
                logger.info("Done. {}", report.summary());
            }
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE", e);
            exitCode = 1;
        } finally {
            kernel.shutdown(false);
        }

        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException alreadyExiting) {
            return;
        }
        System.exit(exitCode);
    }
}
